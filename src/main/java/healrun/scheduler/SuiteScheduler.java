package healrun.scheduler;

import healrun.model.ExecutionPlan;
import healrun.model.ExecutionPolicy;
import healrun.model.Suite;
import healrun.model.TestCase;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns a run's test cases into an {@link ExecutionPlan}.
 *
 * <p>Explicit assignments, when given, take precedence over the global mode.
 * Otherwise the mode picks {@link SequentialPolicy}, {@link ParallelPolicy} or
 * {@link SmartPolicy}.
 *
 * <p>Planning never fails on odd input: empty suites are dropped, worker
 * counts below 1 become 1, and a shared-context suite always gets exactly one
 * worker. The finished plan is checked by {@link PlanValidator} before it is
 * returned.
 *
 * <p>Holds only {@code maxWorkers}; safe to share.
 */
public class SuiteScheduler {

    private static final Logger log = LoggerFactory.getLogger(SuiteScheduler.class);

    private final int maxWorkers;

    /** Uses the number of available processors as the worker ceiling. */
    public SuiteScheduler() {
        this(Runtime.getRuntime().availableProcessors());
    }

    /**
     * @param maxWorkers concurrency ceiling for parallel suites; values below 1 mean 1
     */
    public SuiteScheduler(int maxWorkers) {
        this.maxWorkers = Math.max(1, maxWorkers);
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public ExecutionPlan schedule(List<TestCase> cases, ExecutionPolicy policy) {
        return schedule(cases, policy, Map.of());
    }

    /**
     * @param explicitAssignments {@code caseName -> suiteName}; {@code null} or empty to use the policy mode
     */
    public ExecutionPlan schedule(List<TestCase> cases, ExecutionPolicy policy,
                                  Map<String, String> explicitAssignments) {
        if (cases == null || cases.isEmpty()) {
            log.info("No test cases to schedule");
            return ExecutionPlan.empty();
        }
        ExecutionPolicy effective = policy == null ? ExecutionPolicy.smart() : policy;
        SchedulingPolicy grouping = policyFor(effective, explicitAssignments);

        ExecutionPlan plan = new ExecutionPlan(normalize(grouping.group(List.copyOf(cases))));
        PlanValidator.validateAgainst(plan, cases);

        log.info("Scheduled {} case(s) into {} suite(s) using {} policy",
                plan.totalCases(), plan.suites().size(), grouping.name());
        for (Suite s : plan.suites()) {
            log.debug("  suite '{}': {} case(s), workers={}, sharedContext={}",
                    s.name(), s.size(), s.workers(), s.sharedContext());
        }
        return plan;
    }

    SchedulingPolicy policyFor(ExecutionPolicy policy, Map<String, String> explicitAssignments) {
        if (explicitAssignments != null && !explicitAssignments.isEmpty()) {
            return new ExplicitAssignmentPolicy(explicitAssignments, policy, maxWorkers);
        }
        return switch (policy.mode()) {
            case SEQUENTIAL -> new SequentialPolicy();
            case PARALLEL   -> new ParallelPolicy(maxWorkers);
            case SMART      -> new SmartPolicy(maxWorkers);
        };
    }

    private static List<Suite> normalize(List<Suite> suites) {
        List<Suite> out = new ArrayList<>(suites.size());
        for (Suite s : suites) {
            if (s.cases().isEmpty()) {
                continue;
            }
            int workers = Math.max(1, s.workers());
            if (s.sharedContext() && workers > 1) {
                log.warn("Suite '{}' shares one context; forcing workers {} -> 1", s.name(), workers);
                workers = 1;
            }
            out.add(workers == s.workers() ? s : new Suite(s.name(), s.cases(), workers, s.sharedContext()));
        }
        return out;
    }
}
