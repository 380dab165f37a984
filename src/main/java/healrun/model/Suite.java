package healrun.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A named group of test cases executed as one external runner process.
 *
 * <p>Construction does not enforce the scheduling invariants (non-empty cases,
 * {@code sharedContext -> workers == 1}); plans are checked by
 * {@code PlanValidator} before anything is executed.
 *
 * @param name          unique within a plan
 * @param cases         ordered cases
 * @param workers       runner-internal parallel workers
 * @param sharedContext cases reuse one browser/session context
 */
public record Suite(
        @JsonProperty("name") String name,
        @JsonProperty("cases") List<TestCase> cases,
        @JsonProperty("workers") int workers,
        @JsonProperty("sharedContext") boolean sharedContext) {

    public Suite {
        cases = cases == null ? List.of() : List.copyOf(cases);
    }

    public Suite(String name, List<TestCase> cases, int workers) {
        this(name, cases, workers, false);
    }

    @JsonIgnore
    public int size() {
        return cases.size();
    }

    @JsonIgnore
    public List<String> caseNames() {
        return cases.stream().map(TestCase::name).toList();
    }
}
