package healrun.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Partition of a run's test cases into suites, built once per run.
 */
public record ExecutionPlan(@JsonProperty("suites") List<Suite> suites) {

    public ExecutionPlan {
        suites = suites == null ? List.of() : List.copyOf(suites);
    }

    public static ExecutionPlan empty() {
        return new ExecutionPlan(List.of());
    }

    @JsonProperty("totalCases")
    public int totalCases() {
        return suites.stream().mapToInt(Suite::size).sum();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return suites.isEmpty();
    }

    public Optional<Suite> suite(String name) {
        return suites.stream().filter(s -> s.name().equals(name)).findFirst();
    }
}
