package healrun.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Observed metadata of a UI component, used to infer selector candidates that
 * were not captured explicitly.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ComponentMetadata(
        @JsonProperty("name") String name,
        @JsonProperty("elementType") String elementType,
        @JsonProperty("textContent") String textContent,
        @JsonProperty("ariaRole") String ariaRole,
        @JsonProperty("testId") String testId,
        @JsonProperty("interactive") boolean interactive) {

    /** Metadata that yields no inferred candidates. */
    public static ComponentMetadata none() {
        return new ComponentMetadata(null, null, null, null, null, true);
    }
}
