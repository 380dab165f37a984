package healrun.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Global or per-suite grouping mode. Parsing is lenient: anything that is not
 * {@code sequential} or {@code parallel} means {@link #SMART}.
 */
public enum ExecutionMode {
    SEQUENTIAL, PARALLEL, SMART;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ExecutionMode fromLabel(String raw) {
        if (raw == null || raw.isBlank()) {
            return SMART;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "sequential" -> SEQUENTIAL;
            case "parallel" -> PARALLEL;
            default -> SMART;
        };
    }
}
