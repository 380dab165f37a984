package healrun.scheduler;

import healrun.model.ExecutionMode;
import healrun.model.ExecutionPolicy;
import healrun.model.Suite;
import healrun.model.SuiteOverride;
import healrun.model.TestCase;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Routes each case to the suite named in an explicit {@code caseName -> suiteName}
 * map, taking worker count and shared-context flag from the policy's suite
 * overrides.
 *
 * <ul>
 *   <li>override mode {@code sequential}: 1 worker, whatever {@code workers} says</li>
 *   <li>other modes: configured workers clamped to at least 1, or maxWorkers when unset</li>
 *   <li>no override for the suite: 1 worker, no shared context</li>
 *   <li>cases without an assignment (or with a blank one) go to {@code unassigned}, 1 worker</li>
 * </ul>
 */
public class ExplicitAssignmentPolicy implements SchedulingPolicy {

    static final String UNASSIGNED_SUITE = "unassigned";

    private final Map<String, String> assignments;
    private final ExecutionPolicy policy;
    private final int maxWorkers;

    public ExplicitAssignmentPolicy(Map<String, String> assignments, ExecutionPolicy policy, int maxWorkers) {
        this.assignments = new HashMap<>(assignments);
        this.policy = policy == null ? ExecutionPolicy.smart() : policy;
        this.maxWorkers = Math.max(1, maxWorkers);
    }

    @Override
    public String name() {
        return "explicit";
    }

    @Override
    public List<Suite> group(List<TestCase> cases) {
        Map<String, List<TestCase>> bySuite = new LinkedHashMap<>();
        List<TestCase> unassigned = new ArrayList<>();

        for (TestCase c : cases) {
            String suite = assignments.get(c.name());
            if (suite == null || suite.isBlank() || suite.trim().equals(UNASSIGNED_SUITE)) {
                unassigned.add(c);
            } else {
                bySuite.computeIfAbsent(suite.trim(), k -> new ArrayList<>()).add(c);
            }
        }

        List<Suite> suites = new ArrayList<>();
        bySuite.forEach((name, suiteCases) -> suites.add(configured(name, suiteCases)));
        if (!unassigned.isEmpty()) {
            boolean shared = policy.override(UNASSIGNED_SUITE).map(SuiteOverride::sharedContext).orElse(false);
            suites.add(new Suite(UNASSIGNED_SUITE, unassigned, 1, shared));
        }
        return suites;
    }

    private Suite configured(String name, List<TestCase> cases) {
        Optional<SuiteOverride> override = policy.override(name);
        if (override.isEmpty()) {
            return new Suite(name, cases, 1, false);
        }
        SuiteOverride o = override.get();
        int workers = o.mode() == ExecutionMode.SEQUENTIAL
                ? 1
                : Math.max(1, o.workers() != null ? o.workers() : maxWorkers);
        return new Suite(name, cases, workers, o.sharedContext());
    }
}
