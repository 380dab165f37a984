package healrun.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-suite execution override from the rules configuration.
 *
 * @param mode          {@code sequential} pins workers to 1
 * @param workers       configured worker count, or {@code null} for the scheduler's maximum
 * @param sharedContext cases share one session; forces workers to 1
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SuiteOverride(
        @JsonProperty("mode") ExecutionMode mode,
        @JsonProperty("workers") Integer workers,
        @JsonProperty("sharedContext") boolean sharedContext) {

    public SuiteOverride {
        mode = mode == null ? ExecutionMode.SMART : mode;
    }

    public static SuiteOverride sequential(boolean sharedContext) {
        return new SuiteOverride(ExecutionMode.SEQUENTIAL, null, sharedContext);
    }

    public static SuiteOverride parallel(int workers) {
        return new SuiteOverride(ExecutionMode.PARALLEL, workers, false);
    }
}
