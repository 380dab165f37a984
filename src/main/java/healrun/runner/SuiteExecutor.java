package healrun.runner;

import healrun.model.ExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Runs one suite's compiled code as an external test-runner process.
 *
 * <p>Every invocation writes its artifact into a fresh directory under the
 * work root, so concurrent invocations never share a path. Expected failures
 * (nonzero exit, timeout, cancel, launch error) come back as an
 * {@link ExecutionResult}; only invalid arguments throw.
 *
 * <p>Instances hold configuration only and are safe to share between threads.
 */
public class SuiteExecutor {

    private static final Logger log = LoggerFactory.getLogger(SuiteExecutor.class);

    private final RunnerCommand command;
    private final Path workRoot;
    private final String artifactExtension;
    private final Duration defaultTimeout;

    public SuiteExecutor(RunnerConfig config) {
        this(RunnerCommand.fromConfig(config), config.getWorkDir(),
                config.getArtifactExtension(), config.getSuiteTimeout());
    }

    public SuiteExecutor(RunnerCommand command, Path workRoot, String artifactExtension, Duration defaultTimeout) {
        if (defaultTimeout == null || defaultTimeout.isZero() || defaultTimeout.isNegative()) {
            throw new IllegalArgumentException("Default timeout must be positive: " + defaultTimeout);
        }
        this.command = command;
        this.workRoot = workRoot;
        this.artifactExtension = artifactExtension == null ? "" : artifactExtension;
        this.defaultTimeout = defaultTimeout;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    // ── Blocking ────────────────────────────────────────────────────────────

    public ExecutionResult run(String suiteName, String compiledCode, int workers) {
        return run(suiteName, compiledCode, workers, defaultTimeout);
    }

    /** Starts the suite and blocks until it finishes, times out, or the calling thread is interrupted. */
    public ExecutionResult run(String suiteName, String compiledCode, int workers, Duration timeout) {
        return start(suiteName, compiledCode, workers, timeout).await();
    }

    // ── Asynchronous ────────────────────────────────────────────────────────

    /**
     * Materializes the artifact and launches the runner without waiting.
     * The returned handle is already terminal if the process could not be started.
     *
     * @throws IllegalArgumentException on a blank suite name, null code,
     *                                  workers &lt; 1 or a non-positive timeout
     */
    public SuiteRun start(String suiteName, String compiledCode, int workers, Duration timeout) {
        if (suiteName == null || suiteName.isBlank()) {
            throw new IllegalArgumentException("Suite name must not be blank");
        }
        if (compiledCode == null) {
            throw new IllegalArgumentException("Compiled code for suite '" + suiteName + "' is null");
        }
        if (workers < 1) {
            throw new IllegalArgumentException("Workers must be >= 1, got " + workers);
        }
        Duration budget = timeout == null ? defaultTimeout : timeout;
        if (budget.isZero() || budget.isNegative()) {
            throw new IllegalArgumentException("Timeout must be positive: " + budget);
        }

        long startNanos = System.nanoTime();
        Path artifact = null;
        try {
            artifact = materialize(suiteName, compiledCode);
            List<String> cmd = command.build(artifact, workers);
            log.info("Running suite '{}' (workers={}, timeout={}): {}",
                    suiteName, workers, SuiteRun.formatTimeout(budget), String.join(" ", cmd));

            ProcessBuilder pb = new ProcessBuilder(cmd);
            pb.directory(artifact.getParent().toFile());
            Process process = pb.start();
            closeStdin(suiteName, process);

            StreamCollector out = new StreamCollector(process.getInputStream(), "suite-" + suiteName + "-stdout");
            StreamCollector err = new StreamCollector(process.getErrorStream(), "suite-" + suiteName + "-stderr");
            out.start();
            err.start();
            return SuiteRun.started(suiteName, process, out, err, artifact.toString(), budget, startNanos);
        } catch (IOException e) {
            log.error("Could not launch suite '{}': {}", suiteName, e.getMessage());
            double duration = (System.nanoTime() - startNanos) / 1_000_000_000.0;
            return SuiteRun.finished(ExecutionResult.launchFailed(suiteName,
                    "Failed to launch runner: " + e.getMessage(), duration,
                    artifact == null ? null : artifact.toString()));
        }
    }

    // ── Retention ───────────────────────────────────────────────────────────

    /**
     * Deletes the working directory a run was given, if it lies under the work root.
     * The result keeps its {@code artifactPath} as a record of where the run happened.
     *
     * @return true if a directory was removed
     */
    public boolean cleanUp(ExecutionResult result) {
        if (result == null || result.artifactPath() == null) {
            return false;
        }
        Path root = workRoot.toAbsolutePath().normalize();
        Path runDir = Path.of(result.artifactPath()).toAbsolutePath().normalize().getParent();
        if (runDir == null || runDir.equals(root) || !runDir.startsWith(root) || !Files.isDirectory(runDir)) {
            return false;
        }
        try (Stream<Path> tree = Files.walk(runDir)) {
            for (Path p : tree.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
            log.debug("Removed working directory of suite '{}': {}", result.suiteName(), runDir);
            return true;
        } catch (IOException | UncheckedIOException e) {
            log.warn("Could not remove working directory {}: {}", runDir, e.getMessage());
            return false;
        }
    }

    // ── Helpers ─────────────────────────────────────────────────────────────

    private static void closeStdin(String suiteName, Process process) {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Closing stdin of suite '{}' failed: {}", suiteName, e.getMessage());
        }
    }

    private Path materialize(String suiteName, String compiledCode) throws IOException {
        String fileStem = safeFileStem(suiteName);
        Files.createDirectories(workRoot);
        Path dir = Files.createTempDirectory(workRoot, fileStem + "-");
        Path artifact = dir.resolve(fileStem + artifactExtension);
        Files.writeString(artifact, compiledCode, StandardCharsets.UTF_8);
        log.debug("Wrote artifact for suite '{}' to {}", suiteName, artifact);
        return artifact.toAbsolutePath();
    }

    static String safeFileStem(String suiteName) {
        String stem = suiteName.trim().replaceAll("[^A-Za-z0-9_.-]", "_");
        return stem.isEmpty() || stem.startsWith(".") ? "suite" + stem : stem;
    }
}
