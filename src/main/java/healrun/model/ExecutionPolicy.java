package healrun.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Parsed execution section of the rules configuration.
 *
 * @param mode   global grouping mode
 * @param suites named suite overrides, consulted for explicit assignments
 */
public record ExecutionPolicy(
        @JsonProperty("mode") ExecutionMode mode,
        @JsonProperty("suites") @JsonAlias("overrides") Map<String, SuiteOverride> suites) {

    public ExecutionPolicy {
        mode = mode == null ? ExecutionMode.SMART : mode;
        suites = suites == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(suites));
    }

    public static ExecutionPolicy of(ExecutionMode mode) {
        return new ExecutionPolicy(mode, Map.of());
    }

    public static ExecutionPolicy smart() {
        return of(ExecutionMode.SMART);
    }

    public Optional<SuiteOverride> override(String suiteName) {
        return Optional.ofNullable(suites.get(suiteName));
    }
}
