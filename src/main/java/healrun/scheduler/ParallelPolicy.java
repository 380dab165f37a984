package healrun.scheduler;

import healrun.model.Suite;
import healrun.model.TestCase;

import java.util.List;

/**
 * Every case in one suite {@code all} with {@code min(caseCount, maxWorkers)}
 * workers.
 */
public class ParallelPolicy implements SchedulingPolicy {

    private final int maxWorkers;

    public ParallelPolicy(int maxWorkers) {
        this.maxWorkers = Math.max(1, maxWorkers);
    }

    @Override
    public String name() {
        return "parallel";
    }

    @Override
    public List<Suite> group(List<TestCase> cases) {
        int workers = Math.max(1, Math.min(cases.size(), maxWorkers));
        return List.of(new Suite(SequentialPolicy.SUITE_NAME, cases, workers));
    }
}
