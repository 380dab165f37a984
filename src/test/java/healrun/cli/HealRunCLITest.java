package healrun.cli;

import healrun.config.ConfigProperties;
import healrun.model.ExecutionPlan;
import healrun.model.ExecutionResult;
import healrun.model.Suite;
import healrun.model.TestCase;
import healrun.model.TestCategory;
import healrun.runner.RunnerConfig;
import org.testng.SkipException;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Properties;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Command-line tests for {@link HealRunCLI} exit codes and outputs.
 */
public class HealRunCLITest {

    private static final String CASES = """
            [
              { "name": "home", "category": "functional", "route": "/" },
              { "name": "home-visual", "category": "visual", "route": "/" },
              { "name": "list", "category": "api", "route": "/api/products" },
              { "name": "products", "category": "functional", "route": "/products" }
            ]
            """;

    private Path dir;
    private Path casesFile;

    @BeforeMethod
    public void setUp() throws IOException {
        dir = Files.createTempDirectory("healrun-cli");
        casesFile = dir.resolve("cases.json");
        Files.writeString(casesFile, CASES);
    }

    @AfterMethod(alwaysRun = true)
    public void tearDown() throws IOException {
        try (Stream<Path> tree = Files.walk(dir)) {
            for (Path p : tree.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        }
    }

    private static int exec(String... args) {
        return new CommandLine(new HealRunCLI()).execute(args);
    }

    /** Runs {@code run} with an injected config. */
    private static int execRun(RunnerConfig config, String... args) {
        CommandLine cli = new CommandLine(new HealRunCLI());
        HealRunCLI.RunCommand run = cli.getSubcommands().get("run").getCommand();
        run.config = config;
        String[] full = new String[args.length + 1];
        full[0] = "run";
        System.arraycopy(args, 0, full, 1, args.length);
        return cli.execute(full);
    }

    /** {@code sh} as the runner, run directories under the temp dir. */
    private RunnerConfig shellConfig(boolean keepRunDirs) {
        if (!Files.isExecutable(Path.of("/bin/sh"))) {
            throw new SkipException("Requires /bin/sh");
        }
        Properties p = new Properties();
        p.setProperty("runner.command", "sh");
        p.setProperty("runner.verbose.flag", "");
        p.setProperty("runner.artifact.extension", ".sh");
        p.setProperty("executor.timeout.sec", "30");
        p.setProperty("executor.work.dir", dir.resolve("runs").toString());
        p.setProperty("executor.keep.run.dirs", String.valueOf(keepRunDirs));
        p.setProperty("executor.max.concurrent.suites", "2");
        p.setProperty("scheduler.max.workers", "1");
        return new RunnerConfig(new ConfigProperties(p));
    }

    private List<Path> listRunDirs() throws IOException {
        Path runs = dir.resolve("runs");
        if (!Files.isDirectory(runs)) {
            return List.of();
        }
        try (Stream<Path> children = Files.list(runs)) {
            return children.toList();
        }
    }

    @Test(description = "plan writes a smart plan to the output file")
    public void testPlanWritesFile() throws IOException {
        Path out = dir.resolve("out/plan.json");

        int code = exec("plan", casesFile.toString(), "-w", "2", "-o", out.toString());

        assertThat(code).isZero();
        assertThat(Files.readString(out))
                .contains("\"api-tests\"")
                .contains("\"ui-root\"")
                .contains("\"ui-products\"")
                .contains("\"totalCases\" : 4");
    }

    @Test(description = "plan honours explicit assignments and a policy file")
    public void testPlanWithAssignments() throws IOException {
        Path policy = dir.resolve("policy.json");
        Files.writeString(policy,
                "{ \"mode\": \"smart\", \"suites\": { \"smoke\": { \"mode\": \"parallel\", \"workers\": 2 } } }");
        Path assignments = dir.resolve("assign.json");
        Files.writeString(assignments, "{ \"home\": \"smoke\", \"products\": \"smoke\" }");
        Path out = dir.resolve("plan.json");

        int code = exec("plan", casesFile.toString(), "-p", policy.toString(),
                "-a", assignments.toString(), "-o", out.toString());

        assertThat(code).isZero();
        assertThat(Files.readString(out)).contains("\"smoke\"").contains("\"unassigned\"");
    }

    @Test(description = "Missing input file exits with 1")
    public void testMissingFile() {
        assertThat(exec("plan", dir.resolve("nope.json").toString())).isEqualTo(1);
    }

    @Test(description = "Schema-invalid cases exit with 1")
    public void testInvalidCases() throws IOException {
        Files.writeString(casesFile, "[ { \"name\": \"x\", \"category\": \"load\", \"route\": \"/\" } ]");

        assertThat(exec("plan", casesFile.toString())).isEqualTo(1);
    }

    @Test(description = "run with a missing code directory exits with 1")
    public void testRunMissingCodeDir() {
        assertThat(exec("run", casesFile.toString(), "-c", dir.resolve("missing").toString())).isEqualTo(1);
    }

    @Test(description = "run with no compiled code for any suite is not green")
    public void testRunNoCode() throws IOException {
        Path codeDir = Files.createDirectory(dir.resolve("generated"));
        Path results = dir.resolve("results.json");

        int code = exec("run", casesFile.toString(), "-c", codeDir.toString(), "-r", results.toString());

        assertThat(code).isEqualTo(2);
        assertThat(Files.readString(results).trim()).isEqualTo("[ ]");
    }

    @Test(description = "run fails when some suites pass and others have no code")
    public void testRunPartialCode() throws IOException {
        Path codeDir = Files.createDirectory(dir.resolve("generated"));
        Files.writeString(codeDir.resolve("ui-root.sh"), "exit 0\n");
        Path results = dir.resolve("results.json");

        int code = execRun(shellConfig(false), casesFile.toString(), "-c", codeDir.toString(),
                "-r", results.toString());

        assertThat(code).isEqualTo(2);
        assertThat(Files.readString(results)).contains("\"ui-root\"").doesNotContain("\"api-tests\"");
    }

    @Test(description = "run exits 0 only when every suite ran and passed, then removes run directories")
    public void testRunAllPass() throws IOException {
        Path codeDir = Files.createDirectory(dir.resolve("generated"));
        for (String suite : List.of("api-tests", "ui-root", "ui-products")) {
            Files.writeString(codeDir.resolve(suite + ".sh"), "echo " + suite + "\nexit 0\n");
        }

        int code = execRun(shellConfig(false), casesFile.toString(), "-c", codeDir.toString());

        assertThat(code).isZero();
        assertThat(listRunDirs()).isEmpty();
    }

    @Test(description = "executor.keep.run.dirs keeps each suite's working directory")
    public void testRunKeepsDirectories() throws IOException {
        Path codeDir = Files.createDirectory(dir.resolve("generated"));
        for (String suite : List.of("api-tests", "ui-root", "ui-products")) {
            Files.writeString(codeDir.resolve(suite + ".sh"), "exit 0\n");
        }

        int code = execRun(shellConfig(true), casesFile.toString(), "-c", codeDir.toString());

        assertThat(code).isZero();
        assertThat(listRunDirs()).hasSize(3);
    }

    @Test(description = "skippedSuites lists plan suites without a result, in plan order")
    public void testSkippedSuites() {
        ExecutionPlan plan = new ExecutionPlan(List.of(
                new Suite("a", List.of(new TestCase("a1", TestCategory.API, "/api", List.of())), 1),
                new Suite("b", List.of(new TestCase("b1", TestCategory.FUNCTIONAL, "/", List.of())), 1),
                new Suite("c", List.of(new TestCase("c1", TestCategory.FUNCTIONAL, "/c", List.of())), 1)));
        List<ExecutionResult> results = List.of(ExecutionResult.completed("b", 0, "", "", 0.1, null));

        assertThat(HealRunCLI.RunCommand.skippedSuites(plan, results)).containsExactly("a", "c");
    }

    @Test(description = "version exits with 0")
    public void testVersion() {
        assertThat(exec("version")).isZero();
    }
}
