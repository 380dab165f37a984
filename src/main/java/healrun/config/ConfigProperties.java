package healrun.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Layered {@code config.properties} / {@code config.local.properties} lookup
 * shared by the typed config classes of each package.
 *
 * <p>Typed getters warn and fall back to the caller's default on malformed values.
 */
public final class ConfigProperties {

    private static final Logger log = LoggerFactory.getLogger(ConfigProperties.class);

    static final String CONFIG_FILE       = "config.properties";
    static final String CONFIG_LOCAL_FILE = "config.local.properties";

    private final Properties props;

    public ConfigProperties(Properties props) {
        this.props = props;
    }

    /**
     * Loads configuration from the classpath.
     * {@code config.local.properties} values override {@code config.properties}.
     *
     * @throws RuntimeException if the base config.properties cannot be loaded
     */
    public static ConfigProperties load() {
        Properties props = new Properties();
        ClassLoader cl = ConfigProperties.class.getClassLoader();

        // Load base config (required)
        try (InputStream base = cl.getResourceAsStream(CONFIG_FILE)) {
            if (base == null) {
                throw new IOException("Classpath resource not found: " + CONFIG_FILE);
            }
            props.load(base);
            log.debug("Loaded base config from {}", CONFIG_FILE);
        } catch (IOException e) {
            throw new RuntimeException("Cannot load " + CONFIG_FILE, e);
        }

        // Load local overrides (optional, no error if missing)
        try (InputStream local = cl.getResourceAsStream(CONFIG_LOCAL_FILE)) {
            if (local != null) {
                props.load(local);
                log.debug("Applied local overrides from {}", CONFIG_LOCAL_FILE);
            }
        } catch (IOException e) {
            log.warn("Failed to read {} — using base config only: {}", CONFIG_LOCAL_FILE, e.getMessage());
        }
        return new ConfigProperties(props);
    }

    // ── Accessors ──────────────────────────────────────────────────────────

    /** Raw value, or {@code null} when the key is absent. */
    public String get(String key) {
        return props.getProperty(key);
    }

    /** Trimmed value, or {@code defaultValue} when the key is absent or blank. */
    public String getString(String key, String defaultValue) {
        String raw = props.getProperty(key);
        return raw == null || raw.isBlank() ? defaultValue : raw.trim();
    }

    public int getInt(String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for key '{}': '{}' — using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid long for key '{}': '{}' — using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    /** {@code true}/{@code false}, case-insensitive; anything else warns and yields the default. */
    public boolean getBoolean(String key, boolean defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        String value = raw.trim();
        if (value.equalsIgnoreCase("true")) return true;
        if (value.equalsIgnoreCase("false")) return false;
        log.warn("Invalid boolean for key '{}': '{}' — using default {}", key, raw, defaultValue);
        return defaultValue;
    }
}
