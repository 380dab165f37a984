package healrun.runner;

import healrun.config.ConfigProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

/**
 * Reads {@code config.properties} from the classpath and exposes typed runner,
 * executor and scheduler settings with sensible defaults.
 *
 * <p>All values can be overridden by placing a {@code config.local.properties}
 * file on the classpath (higher priority, not committed to VCS).
 */
public class RunnerConfig {

    // Property keys
    private static final String KEY_RUNNER_COMMAND     = "runner.command";
    private static final String KEY_VERBOSE_FLAG       = "runner.verbose.flag";
    private static final String KEY_PARALLEL_FLAG      = "runner.parallel.flag";
    private static final String KEY_ARTIFACT_EXTENSION = "runner.artifact.extension";
    private static final String KEY_TIMEOUT            = "executor.timeout.sec";
    private static final String KEY_WORK_DIR           = "executor.work.dir";
    private static final String KEY_KEEP_RUN_DIRS      = "executor.keep.run.dirs";
    private static final String KEY_MAX_CONCURRENT     = "executor.max.concurrent.suites";
    private static final String KEY_MAX_WORKERS        = "scheduler.max.workers";

    // Defaults
    private static final String DEFAULT_RUNNER_COMMAND     = "pytest";
    private static final String DEFAULT_VERBOSE_FLAG       = "-v";
    private static final String DEFAULT_PARALLEL_FLAG      = "-n";
    private static final String DEFAULT_ARTIFACT_EXTENSION = ".py";
    private static final int    DEFAULT_TIMEOUT            = 300;
    private static final String DEFAULT_WORK_DIR           = "test-runs";

    private final ConfigProperties props;

    /**
     * Loads configuration from the classpath.
     * {@code config.local.properties} values override {@code config.properties}.
     *
     * @throws RuntimeException if the base config.properties cannot be loaded
     */
    public RunnerConfig() {
        this(ConfigProperties.load());
    }

    public RunnerConfig(ConfigProperties props) {
        this.props = props;
    }

    /**
     * Package-private constructor for tests. Accepts an already-populated
     * {@link Properties} instance.
     */
    RunnerConfig(Properties props) {
        this(new ConfigProperties(props));
    }

    // ── Accessors ──────────────────────────────────────────────────────────

    /** Runner executable and fixed leading arguments, split on whitespace (default: pytest). */
    public List<String> getRunnerCommand() {
        String raw = props.getString(KEY_RUNNER_COMMAND, DEFAULT_RUNNER_COMMAND);
        return Arrays.asList(raw.split("\\s+"));
    }

    /** Flag appended after the artifact for verbose output (default: -v); empty disables it. */
    public String getVerboseFlag() {
        String raw = props.get(KEY_VERBOSE_FLAG);
        return raw == null ? DEFAULT_VERBOSE_FLAG : raw.trim();
    }

    /** Flag preceding the worker count when workers > 1 (default: -n). */
    public String getParallelFlag() {
        return props.getString(KEY_PARALLEL_FLAG, DEFAULT_PARALLEL_FLAG);
    }

    /** File extension of materialized suite artifacts (default: .py). */
    public String getArtifactExtension() {
        String raw = props.get(KEY_ARTIFACT_EXTENSION);
        raw = raw == null ? DEFAULT_ARTIFACT_EXTENSION : raw.trim();
        return raw.isEmpty() || raw.startsWith(".") ? raw : "." + raw;
    }

    /** Wall-clock budget per suite invocation (default: 300 s). Non-positive values fall back to the default. */
    public Duration getSuiteTimeout() {
        int sec = props.getInt(KEY_TIMEOUT, DEFAULT_TIMEOUT);
        return Duration.ofSeconds(sec > 0 ? sec : DEFAULT_TIMEOUT);
    }

    /** Root under which each invocation gets its own working directory (default: test-runs). */
    public Path getWorkDir() {
        return Path.of(props.getString(KEY_WORK_DIR, DEFAULT_WORK_DIR));
    }

    /** Whether finished suites keep their working directories (default: false). */
    public boolean isKeepRunDirectories() {
        return props.getBoolean(KEY_KEEP_RUN_DIRS, false);
    }

    /** Suites run at the same time by {@link PlanRunner} (default: available processors). */
    public int getMaxConcurrentSuites() {
        return positiveOrProcessors(props.getInt(KEY_MAX_CONCURRENT, 0));
    }

    /** Ceiling for a suite's parallel worker count (default: available processors). */
    public int getMaxWorkers() {
        return positiveOrProcessors(props.getInt(KEY_MAX_WORKERS, 0));
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private static int positiveOrProcessors(int value) {
        return value > 0 ? value : Runtime.getRuntime().availableProcessors();
    }
}
