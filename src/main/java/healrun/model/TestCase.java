package healrun.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A generated test case. Produced by the generator and consumed read-only here.
 *
 * @param name        unique within a run
 * @param category    functional, api or visual
 * @param description free text
 * @param route       route the case exercises, e.g. {@code /products}
 * @param steps       ordered steps
 * @param code        generated executable code for this case, if any
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TestCase(
        @JsonProperty("name") String name,
        @JsonProperty("category") TestCategory category,
        @JsonProperty("description") String description,
        @JsonProperty("route") String route,
        @JsonProperty("steps") List<TestStep> steps,
        @JsonProperty("code") String code) {

    public TestCase {
        Objects.requireNonNull(name, "name");
        category = category == null ? TestCategory.FUNCTIONAL : category;
        description = description == null ? "" : description;
        route = route == null ? "" : route;
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public TestCase(String name, TestCategory category, String route, List<TestStep> steps) {
        this(name, category, "", route, steps, null);
    }

    @JsonIgnore
    public boolean isApi() {
        return category == TestCategory.API;
    }
}
