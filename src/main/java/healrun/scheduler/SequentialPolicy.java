package healrun.scheduler;

import healrun.model.Suite;
import healrun.model.TestCase;

import java.util.List;

/** Every case in one suite {@code all}, one worker, input order. */
public class SequentialPolicy implements SchedulingPolicy {

    static final String SUITE_NAME = "all";

    @Override
    public String name() {
        return "sequential";
    }

    @Override
    public List<Suite> group(List<TestCase> cases) {
        return List.of(new Suite(SUITE_NAME, cases, 1));
    }
}
