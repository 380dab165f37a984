package healrun.scheduler;

import healrun.model.ExecutionPlan;
import healrun.model.Suite;
import healrun.model.TestCase;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks execution-plan invariants before a plan is executed.
 */
public final class PlanValidator {

    private PlanValidator() {}

    /**
     * @throws SchedulingInvariantViolationException on the first violated invariant
     */
    public static void validate(ExecutionPlan plan) {
        Set<String> names = new HashSet<>();
        for (Suite suite : plan.suites()) {
            if (suite.name() == null || suite.name().isBlank()) {
                throw new SchedulingInvariantViolationException("Suite name must not be blank");
            }
            if (!names.add(suite.name())) {
                throw new SchedulingInvariantViolationException("Duplicate suite name: '" + suite.name() + "'");
            }
            if (suite.cases().isEmpty()) {
                throw new SchedulingInvariantViolationException("Suite '" + suite.name() + "' has no cases");
            }
            if (suite.workers() < 1) {
                throw new SchedulingInvariantViolationException(
                        "Suite '" + suite.name() + "' has workers=" + suite.workers() + ", must be >= 1");
            }
            if (suite.sharedContext() && suite.workers() > 1) {
                throw new SchedulingInvariantViolationException(
                        "Suite '" + suite.name() + "' shares one context but has workers=" + suite.workers());
            }
        }
    }

    /**
     * {@link #validate} plus case conservation: the multiset of case names in
     * the plan equals the multiset of input case names.
     */
    public static void validateAgainst(ExecutionPlan plan, List<TestCase> inputCases) {
        validate(plan);
        Map<String, Long> expected = countNames(inputCases);
        Map<String, Long> actual = countNames(plan.suites().stream()
                .flatMap(s -> s.cases().stream())
                .toList());
        if (!expected.equals(actual)) {
            Map<String, Long> diff = new HashMap<>(expected);
            actual.forEach((k, v) -> diff.merge(k, -v, Long::sum));
            diff.values().removeIf(v -> v == 0);
            throw new SchedulingInvariantViolationException(
                    "Plan does not conserve test cases (input minus planned): " + diff);
        }
    }

    private static Map<String, Long> countNames(List<TestCase> cases) {
        return cases.stream().collect(Collectors.groupingBy(TestCase::name, Collectors.counting()));
    }
}
