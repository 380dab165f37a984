package healrun.cli;

import healrun.model.ExecutionMode;
import healrun.model.ExecutionPlan;
import healrun.model.ExecutionPolicy;
import healrun.model.ExecutionResult;
import healrun.model.PlanIO;
import healrun.model.Suite;
import healrun.model.TestCase;
import healrun.runner.DirectorySuiteCodeSource;
import healrun.runner.PlanRunner;
import healrun.runner.RunnerConfig;
import healrun.runner.SuiteExecutor;
import healrun.scheduler.SuiteScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * CLI entry-point for HealRun.
 *
 * <p>Sub-commands:
 * <ul>
 *   <li>{@code healrun plan}: partition test cases into suites and print or save the plan</li>
 *   <li>{@code healrun run}: schedule the cases and execute every suite's compiled code</li>
 *   <li>{@code healrun version}: print build version</li>
 * </ul>
 *
 * <p>Exit codes: 0 all green, 1 bad input, 2 at least one suite failed or did not run.
 */
@Command(
        name        = "healrun",
        description = "Suite scheduling and execution for generated UI/API test suites",
        version     = "1.0.0-SNAPSHOT",
        mixinStandardHelpOptions = true,
        subcommands = {
                HealRunCLI.PlanCommand.class,
                HealRunCLI.RunCommand.class,
                HealRunCLI.VersionCommand.class
        }
)
public class HealRunCLI implements Callable<Integer> {

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    // ── Entry-point ─────────────────────────────────────────────────────────

    public static void main(String[] args) {
        int exit = new CommandLine(new HealRunCLI()).execute(args);
        System.exit(exit);
    }

    // ── Shared input handling ───────────────────────────────────────────────

    /** Options common to every command that needs a plan. */
    static class PlanInput {

        @Parameters(index = "0", description = "Path to the test cases JSON file")
        Path casesFile;

        @Option(
                names       = {"-p", "--policy"},
                description = "Execution policy JSON file (mode + per-suite overrides)"
        )
        Path policyFile;

        @Option(
                names       = {"-m", "--mode"},
                description = "Mode when no policy file is given: sequential, parallel, smart (default: smart)",
                defaultValue = "smart"
        )
        String mode;

        @Option(
                names       = {"-a", "--assignments"},
                description = "JSON object mapping case name to suite name"
        )
        Path assignmentsFile;

        @Option(
                names       = {"-w", "--max-workers"},
                description = "Worker ceiling for parallel suites (default: scheduler.max.workers)"
        )
        Integer maxWorkers;

        /** Returns null after printing the problem when an input file is missing. */
        ExecutionPlan buildPlan(RunnerConfig config) throws IOException {
            for (Path p : new Path[] {casesFile, policyFile, assignmentsFile}) {
                if (p != null && !Files.exists(p)) {
                    System.err.println("File not found: " + p.toAbsolutePath());
                    return null;
                }
            }
            List<TestCase> cases = PlanIO.readCases(casesFile);
            ExecutionPolicy policy = policyFile != null
                    ? PlanIO.readPolicy(policyFile)
                    : ExecutionPolicy.of(ExecutionMode.fromLabel(mode));
            Map<String, String> assignments = assignmentsFile != null
                    ? PlanIO.readAssignments(assignmentsFile)
                    : Map.of();

            int ceiling = maxWorkers != null ? maxWorkers : config.getMaxWorkers();
            return new SuiteScheduler(ceiling).schedule(cases, policy, assignments);
        }
    }

    static void printPlan(ExecutionPlan plan) {
        System.out.printf("Plan: %d suite(s), %d case(s)%n", plan.suites().size(), plan.totalCases());
        for (Suite suite : plan.suites()) {
            System.out.printf("  %-24s cases=%-4d workers=%-3d shared=%s%n",
                    suite.name(), suite.size(), suite.workers(), suite.sharedContext());
        }
    }

    // ── Sub-commands ─────────────────────────────────────────────────────────

    /**
     * Builds an execution plan without running anything.
     */
    @Command(
            name        = "plan",
            description = "Partition test cases into suites",
            mixinStandardHelpOptions = true
    )
    static class PlanCommand implements Callable<Integer> {

        private static final Logger log = LoggerFactory.getLogger(PlanCommand.class);

        @CommandLine.Mixin
        PlanInput input = new PlanInput();

        @Option(
                names       = {"-o", "--output"},
                description = "Write the plan as JSON to this file"
        )
        Path output;

        RunnerConfig config;

        @Override
        public Integer call() throws Exception {
            ExecutionPlan plan;
            try {
                plan = input.buildPlan(config != null ? config : new RunnerConfig());
            } catch (PlanIO.PlanFormatException | IllegalArgumentException e) {
                System.err.println("Invalid input: " + e.getMessage());
                return 1;
            }
            if (plan == null) {
                return 1;
            }

            printPlan(plan);
            if (output != null) {
                PlanIO.writePlan(plan, output);
                log.info("Plan written to {}", output.toAbsolutePath());
                System.out.println("Plan written to " + output.toAbsolutePath());
            }
            return 0;
        }
    }

    /**
     * Schedules the cases and runs each suite's compiled code from a directory.
     */
    @Command(
            name        = "run",
            description = "Schedule test cases and execute the compiled suites",
            mixinStandardHelpOptions = true
    )
    static class RunCommand implements Callable<Integer> {

        private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

        @CommandLine.Mixin
        PlanInput input = new PlanInput();

        @Option(
                names       = {"-c", "--code-dir"},
                description = "Directory holding <suite><extension> files (default: generated)",
                defaultValue = "generated"
        )
        Path codeDir;

        @Option(
                names       = {"-t", "--timeout"},
                description = "Per-suite timeout in seconds (default: executor.timeout.sec)"
        )
        Integer timeoutSec;

        @Option(
                names       = {"-r", "--results"},
                description = "Write execution results as JSON to this file"
        )
        Path resultsFile;

        RunnerConfig config;

        @Override
        public Integer call() throws Exception {
            RunnerConfig cfg = config != null ? config : new RunnerConfig();
            if (!Files.isDirectory(codeDir)) {
                System.err.println("Code directory not found: " + codeDir.toAbsolutePath());
                return 1;
            }
            if (timeoutSec != null && timeoutSec <= 0) {
                System.err.println("Timeout must be positive: " + timeoutSec);
                return 1;
            }

            ExecutionPlan plan;
            try {
                plan = input.buildPlan(cfg);
            } catch (PlanIO.PlanFormatException | IllegalArgumentException e) {
                System.err.println("Invalid input: " + e.getMessage());
                return 1;
            }
            if (plan == null) {
                return 1;
            }
            printPlan(plan);

            SuiteExecutor executor = new SuiteExecutor(cfg);
            Duration timeout = timeoutSec != null ? Duration.ofSeconds(timeoutSec) : cfg.getSuiteTimeout();
            PlanRunner runner = new PlanRunner(executor,
                    new DirectorySuiteCodeSource(codeDir, cfg.getArtifactExtension()),
                    cfg.getMaxConcurrentSuites(), timeout);
            runner.setKeepRunDirectories(cfg.isKeepRunDirectories());

            Thread abortHook = new Thread(runner::abort, "healrun-abort");
            Runtime.getRuntime().addShutdownHook(abortHook);
            List<ExecutionResult> results;
            try {
                results = runner.run(plan);
            } finally {
                removeHook(abortHook);
            }

            for (ExecutionResult r : results) {
                System.out.printf("  %-24s %-10s exit=%-4d %.1fs%n",
                        r.suiteName(), r.state(), r.exitCode(), r.durationSeconds());
            }
            if (resultsFile != null) {
                PlanIO.writeResults(results, resultsFile);
                log.info("Results written to {}", resultsFile.toAbsolutePath());
            }

            List<String> skipped = skippedSuites(plan, results);
            if (!skipped.isEmpty()) {
                System.err.println("\nSkipped, no compiled code: " + String.join(", ", skipped));
            }
            boolean allPassed = results.stream().allMatch(ExecutionResult::success);
            if (allPassed && skipped.isEmpty()) {
                System.out.println("\nAll suites passed.");
                return 0;
            }
            System.err.println(allPassed
                    ? "\n" + skipped.size() + " of " + plan.suites().size() + " suite(s) did not run."
                    : "\nSome suites failed.");
            return 2;
        }

        /** Plan suites with no result, in plan order. */
        static List<String> skippedSuites(ExecutionPlan plan, List<ExecutionResult> results) {
            Set<String> ran = results.stream().map(ExecutionResult::suiteName).collect(Collectors.toSet());
            return plan.suites().stream()
                    .map(Suite::name)
                    .filter(name -> !ran.contains(name))
                    .toList();
        }

        private static void removeHook(Thread hook) {
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                // JVM already shutting down; the hook is running
                log.debug("Shutdown in progress, abort hook stays registered");
            }
        }
    }

    @Command(
            name        = "version",
            description = "Print version information",
            mixinStandardHelpOptions = true
    )
    static class VersionCommand implements Callable<Integer> {

        @Override
        public Integer call() {
            System.out.println("HealRun 1.0.0-SNAPSHOT");
            System.out.println("Selenium WebDriver 4.19.1 | Jackson 2.17.0 | picocli 4.7.5");
            System.out.println("Modules: model, locator, scheduler, runner, cli");
            return 0;
        }
    }
}
