package healrun.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * One way of locating a UI element.
 *
 * <p>Declaration order is the default resolution priority: the most stable
 * strategy first, raw CSS last.
 */
public enum SelectorStrategy {

    TEST_ID("test_id"),
    ROLE("role"),
    TEXT("text"),
    SEMANTIC("semantic"),
    STRUCTURAL("structural"),
    CSS("css");

    /** TestId, Role, Text, Semantic, Structural, Css. */
    public static final List<SelectorStrategy> DEFAULT_PRIORITY = List.of(values());

    private final String label;

    SelectorStrategy(String label) {
        this.label = label;
    }

    /** Wire name used in JSON and in heal warnings (e.g. {@code test_id}). */
    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Parses a wire name or enum constant name, case-insensitively.
     *
     * @throws IllegalArgumentException for unknown strategies
     */
    @JsonCreator
    public static SelectorStrategy fromLabel(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Selector strategy must not be null");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (SelectorStrategy s : values()) {
            if (s.label.equals(normalized) || s.name().equalsIgnoreCase(normalized)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown selector strategy: '" + raw + "'");
    }

    @Override
    public String toString() {
        return label;
    }
}
