package healrun.scheduler;

import healrun.model.Suite;
import healrun.model.TestCase;

import java.util.List;

/**
 * One grouping rule: partitions a run's cases into suites.
 *
 * <p>Implementations must place every input case in exactly one suite. They
 * may emit suites the scheduler later normalizes (worker clamping, shared
 * context), but must never drop or duplicate a case.
 */
public interface SchedulingPolicy {

    /** Short name used in log output. */
    String name();

    /**
     * @param cases non-empty list of cases, in input order
     * @return suites in execution-plan order
     */
    List<Suite> group(List<TestCase> cases);
}
