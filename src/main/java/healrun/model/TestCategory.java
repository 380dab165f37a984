package healrun.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TestCategory {
    FUNCTIONAL, API, VISUAL;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TestCategory fromLabel(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Test category must not be null");
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
