package healrun.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single concrete way to locate a UI element.
 *
 * @param strategy       locator strategy
 * @param value          strategy-specific value: test id, ARIA role, visible text or raw selector
 * @param accessibleName accessible name narrowing a {@link SelectorStrategy#ROLE} lookup; may be {@code null}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SelectorCandidate(
        @JsonProperty("strategy") SelectorStrategy strategy,
        @JsonProperty("value") String value,
        @JsonProperty("name") String accessibleName) {

    public SelectorCandidate {
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(value, "value");
    }

    public static SelectorCandidate of(SelectorStrategy strategy, String value) {
        return new SelectorCandidate(strategy, value, null);
    }

    public static SelectorCandidate testId(String value)  { return of(SelectorStrategy.TEST_ID, value); }
    public static SelectorCandidate text(String value)    { return of(SelectorStrategy.TEXT, value); }
    public static SelectorCandidate semantic(String value) { return of(SelectorStrategy.SEMANTIC, value); }
    public static SelectorCandidate structural(String value) { return of(SelectorStrategy.STRUCTURAL, value); }
    public static SelectorCandidate css(String value)     { return of(SelectorStrategy.CSS, value); }

    public static SelectorCandidate role(String role, String accessibleName) {
        return new SelectorCandidate(SelectorStrategy.ROLE, role, accessibleName);
    }

    /** {@code strategy(value)}, the form used in heal warnings. */
    public String describe() {
        return strategy.label() + "(" + value + ")";
    }

    @Override
    public String toString() {
        return accessibleName == null
                ? describe()
                : strategy.label() + "(" + value + ", name='" + accessibleName + "')";
    }
}
