package healrun.locator;

import healrun.config.ConfigProperties;

import java.util.Properties;

/**
 * Locator settings from {@code config.properties} on the classpath, with
 * optional overrides from {@code config.local.properties}.
 *
 * <table>
 *   <tr><th>Key</th><th>Default</th></tr>
 *   <tr><td>locator.retry.attempts</td><td>1</td></tr>
 *   <tr><td>locator.retry.delay.ms</td><td>500</td></tr>
 *   <tr><td>locator.testid.attribute</td><td>data-testid</td></tr>
 * </table>
 */
public class LocatorConfig {

    private static final String KEY_RETRY_ATTEMPTS    = "locator.retry.attempts";
    private static final String KEY_RETRY_DELAY       = "locator.retry.delay.ms";
    private static final String KEY_TESTID_ATTRIBUTE  = "locator.testid.attribute";

    private static final int    DEFAULT_RETRY_ATTEMPTS   = 1;
    private static final long   DEFAULT_RETRY_DELAY      = 500L;
    private static final String DEFAULT_TESTID_ATTRIBUTE = "data-testid";

    private final ConfigProperties props;

    /**
     * @throws RuntimeException if the base config.properties cannot be loaded
     */
    public LocatorConfig() {
        this(ConfigProperties.load());
    }

    public LocatorConfig(ConfigProperties props) {
        this.props = props;
    }

    /** Package-private constructor for tests. */
    LocatorConfig(Properties props) {
        this(new ConfigProperties(props));
    }

    /** How many times a step resolves its chain before giving up; at least 1. */
    public int getRetryAttempts() {
        return Math.max(1, props.getInt(KEY_RETRY_ATTEMPTS, DEFAULT_RETRY_ATTEMPTS));
    }

    /** Pause between resolution attempts in milliseconds; never negative. */
    public long getRetryDelayMs() {
        return Math.max(0L, props.getLong(KEY_RETRY_DELAY, DEFAULT_RETRY_DELAY));
    }

    /** DOM attribute holding stable test identifiers. */
    public String getTestIdAttribute() {
        return props.getString(KEY_TESTID_ATTRIBUTE, DEFAULT_TESTID_ATTRIBUTE);
    }
}
