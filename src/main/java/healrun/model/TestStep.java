package healrun.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One generated step of a {@link TestCase}.
 *
 * @param action      navigate, click, fill, assert_url, assert_text, api_call or screenshot
 * @param selectors   candidate locators for the step's target element, in priority order
 * @param targetUrl   URL for navigate / api_call steps
 * @param expected    expected value for assertions
 * @param method      HTTP method for api_call steps
 * @param name        screenshot name
 * @param description human-readable description
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TestStep(
        @JsonProperty("action") String action,
        @JsonProperty("selectors") List<SelectorCandidate> selectors,
        @JsonProperty("targetUrl") String targetUrl,
        @JsonProperty("expected") Object expected,
        @JsonProperty("method") String method,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description) {

    public TestStep {
        selectors = selectors == null ? List.of() : List.copyOf(selectors);
        description = description == null ? "" : description;
    }
}
