package healrun.runner;

import org.testng.annotations.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RunnerConfig}.
 *
 * <p>Tests use the package-private {@code RunnerConfig(Properties)} constructor
 * to avoid classpath file I/O.
 */
public class RunnerConfigTest {

    private static final int CPUS = Runtime.getRuntime().availableProcessors();

    @Test(description = "All accessors return documented defaults when properties are empty")
    public void testAllDefaults() {
        RunnerConfig cfg = new RunnerConfig(new Properties());

        assertThat(cfg.getRunnerCommand()).containsExactly("pytest");
        assertThat(cfg.getVerboseFlag()).isEqualTo("-v");
        assertThat(cfg.getParallelFlag()).isEqualTo("-n");
        assertThat(cfg.getArtifactExtension()).isEqualTo(".py");
        assertThat(cfg.getSuiteTimeout()).isEqualTo(Duration.ofSeconds(300));
        assertThat(cfg.getWorkDir()).isEqualTo(Path.of("test-runs"));
        assertThat(cfg.getMaxConcurrentSuites()).isEqualTo(CPUS);
        assertThat(cfg.getMaxWorkers()).isEqualTo(CPUS);
        assertThat(cfg.isKeepRunDirectories()).isFalse();
    }

    @Test(description = "keep.run.dirs parses case-insensitively, garbage falls back to false")
    public void testKeepRunDirectories() {
        Properties p = new Properties();
        p.setProperty("executor.keep.run.dirs", " TRUE ");
        assertThat(new RunnerConfig(p).isKeepRunDirectories()).isTrue();

        p.setProperty("executor.keep.run.dirs", "sometimes");
        assertThat(new RunnerConfig(p).isKeepRunDirectories()).isFalse();
    }

    @Test(description = "Runner command splits on whitespace into tokens")
    public void testRunnerCommandTokens() {
        Properties p = new Properties();
        p.setProperty("runner.command", "  python3 -m   pytest ");

        assertThat(new RunnerConfig(p).getRunnerCommand()).isEqualTo(List.of("python3", "-m", "pytest"));
    }

    @Test(description = "Values are read from properties, extension gets a leading dot")
    public void testOverrides() {
        Properties p = new Properties();
        p.setProperty("runner.verbose.flag", "");
        p.setProperty("runner.artifact.extension", "sh");
        p.setProperty("executor.timeout.sec", "45");
        p.setProperty("executor.work.dir", "/var/tmp/runs");
        p.setProperty("executor.max.concurrent.suites", "3");
        p.setProperty("scheduler.max.workers", "6");

        RunnerConfig cfg = new RunnerConfig(p);

        assertThat(cfg.getVerboseFlag()).isEmpty();
        assertThat(cfg.getArtifactExtension()).isEqualTo(".sh");
        assertThat(cfg.getSuiteTimeout()).isEqualTo(Duration.ofSeconds(45));
        assertThat(cfg.getWorkDir()).isEqualTo(Path.of("/var/tmp/runs"));
        assertThat(cfg.getMaxConcurrentSuites()).isEqualTo(3);
        assertThat(cfg.getMaxWorkers()).isEqualTo(6);
    }

    @Test(description = "Malformed or non-positive numbers fall back to defaults")
    public void testInvalidNumbers() {
        Properties p = new Properties();
        p.setProperty("executor.timeout.sec", "soon");
        p.setProperty("executor.max.concurrent.suites", "-1");
        p.setProperty("scheduler.max.workers", "lots");

        RunnerConfig cfg = new RunnerConfig(p);

        assertThat(cfg.getSuiteTimeout()).isEqualTo(Duration.ofSeconds(300));
        assertThat(cfg.getMaxConcurrentSuites()).isEqualTo(CPUS);
        assertThat(cfg.getMaxWorkers()).isEqualTo(CPUS);
    }

    @Test(description = "Classpath config.properties loads with the pytest runner")
    public void testClasspathLoad() {
        RunnerConfig cfg = new RunnerConfig();

        assertThat(cfg.getRunnerCommand()).isNotEmpty();
        assertThat(cfg.getSuiteTimeout()).isPositive();
    }
}
