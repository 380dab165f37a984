package healrun.scheduler;

import healrun.model.Suite;
import healrun.model.TestCase;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Default grouping.
 *
 * <ul>
 *   <li>All API cases form {@code api-tests} with {@code min(apiCount, maxWorkers)}
 *       workers; API checks are stateless.</li>
 *   <li>Remaining UI cases are grouped by route, one suite per distinct route
 *       in first-seen order, one worker each: cases on the same route may share
 *       page or navigation state.</li>
 * </ul>
 *
 * <p>Two cases on the same route are always serialized, even when they are
 * functionally independent.
 */
public class SmartPolicy implements SchedulingPolicy {

    static final String API_SUITE = "api-tests";

    private final int maxWorkers;

    public SmartPolicy(int maxWorkers) {
        this.maxWorkers = Math.max(1, maxWorkers);
    }

    @Override
    public String name() {
        return "smart";
    }

    @Override
    public List<Suite> group(List<TestCase> cases) {
        List<Suite> suites = new ArrayList<>();
        Set<String> taken = new HashSet<>();

        List<TestCase> api = cases.stream().filter(TestCase::isApi).toList();
        if (!api.isEmpty()) {
            suites.add(new Suite(API_SUITE, api, Math.max(1, Math.min(api.size(), maxWorkers))));
            taken.add(API_SUITE);
        }

        Map<String, List<TestCase>> byRoute = cases.stream()
                .filter(c -> !c.isApi())
                .collect(Collectors.groupingBy(TestCase::route, LinkedHashMap::new, Collectors.toList()));

        byRoute.forEach((route, routeCases) -> {
            String name = SuiteNames.unique(SuiteNames.forRoute(route), taken);
            suites.add(new Suite(name, routeCases, 1));
        });
        return suites;
    }
}
