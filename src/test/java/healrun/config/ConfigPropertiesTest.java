package healrun.config;

import healrun.locator.LocatorConfig;
import healrun.runner.RunnerConfig;
import org.testng.annotations.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ConfigProperties}.
 */
public class ConfigPropertiesTest {

    @Test(description = "Typed getters trim values and fall back on blank or malformed input")
    public void testTypedGetters() {
        Properties p = new Properties();
        p.setProperty("a.string", "  value ");
        p.setProperty("a.blank", "   ");
        p.setProperty("an.int", " 7 ");
        p.setProperty("a.bad.int", "seven");
        p.setProperty("a.long", "9000000000");
        p.setProperty("a.bad.long", "1.5");

        ConfigProperties cfg = new ConfigProperties(p);

        assertThat(cfg.getString("a.string", "x")).isEqualTo("value");
        assertThat(cfg.getString("a.blank", "x")).isEqualTo("x");
        assertThat(cfg.getString("missing", "x")).isEqualTo("x");
        assertThat(cfg.get("a.blank")).isEqualTo("   ");
        assertThat(cfg.get("missing")).isNull();
        assertThat(cfg.getInt("an.int", 0)).isEqualTo(7);
        assertThat(cfg.getInt("a.bad.int", 3)).isEqualTo(3);
        assertThat(cfg.getLong("a.long", 0L)).isEqualTo(9_000_000_000L);
        assertThat(cfg.getLong("a.bad.long", 4L)).isEqualTo(4L);
    }

    @Test(description = "Classpath load reads config.properties")
    public void testLoad() {
        ConfigProperties cfg = ConfigProperties.load();

        assertThat(cfg.get("runner.command")).isNotBlank();
        assertThat(cfg.get("locator.testid.attribute")).isNotBlank();
    }

    @Test(description = "Runner and locator settings can share one loaded instance")
    public void testSharedInstance() {
        Properties p = new Properties();
        p.setProperty("runner.command", "sh");
        p.setProperty("locator.retry.attempts", "3");
        ConfigProperties shared = new ConfigProperties(p);

        assertThat(new RunnerConfig(shared).getRunnerCommand()).containsExactly("sh");
        assertThat(new LocatorConfig(shared).getRetryAttempts()).isEqualTo(3);
    }
}
