package healrun.locator;

import org.testng.annotations.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link LocatorConfig} using the package-private
 * {@code LocatorConfig(Properties)} constructor.
 */
public class LocatorConfigTest {

    @Test(description = "Defaults apply when properties are empty")
    public void testDefaults() {
        LocatorConfig cfg = new LocatorConfig(new Properties());

        assertThat(cfg.getRetryAttempts()).isEqualTo(1);
        assertThat(cfg.getRetryDelayMs()).isEqualTo(500L);
        assertThat(cfg.getTestIdAttribute()).isEqualTo("data-testid");
    }

    @Test(description = "Values are read from properties")
    public void testOverrides() {
        Properties p = new Properties();
        p.setProperty("locator.retry.attempts", "4");
        p.setProperty("locator.retry.delay.ms", "250");
        p.setProperty("locator.testid.attribute", " data-qa ");

        LocatorConfig cfg = new LocatorConfig(p);

        assertThat(cfg.getRetryAttempts()).isEqualTo(4);
        assertThat(cfg.getRetryDelayMs()).isEqualTo(250L);
        assertThat(cfg.getTestIdAttribute()).isEqualTo("data-qa");
    }

    @Test(description = "Malformed or out-of-range numbers fall back to safe values")
    public void testInvalidValues() {
        Properties p = new Properties();
        p.setProperty("locator.retry.attempts", "many");
        p.setProperty("locator.retry.delay.ms", "-20");

        LocatorConfig cfg = new LocatorConfig(p);

        assertThat(cfg.getRetryAttempts()).isEqualTo(1);
        assertThat(cfg.getRetryDelayMs()).isZero();
    }

    @Test(description = "Classpath config.properties loads")
    public void testClasspathLoad() {
        LocatorConfig cfg = new LocatorConfig();

        assertThat(cfg.getRetryAttempts()).isGreaterThanOrEqualTo(1);
        assertThat(cfg.getTestIdAttribute()).isNotBlank();
    }
}
