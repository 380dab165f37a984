package healrun.model;

import org.testng.annotations.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class ExecutionModeTest {

    @Test(description = "Mode labels parse case-insensitively")
    public void testFromLabel() {
        assertThat(ExecutionMode.fromLabel("sequential")).isEqualTo(ExecutionMode.SEQUENTIAL);
        assertThat(ExecutionMode.fromLabel(" Parallel ")).isEqualTo(ExecutionMode.PARALLEL);
        assertThat(ExecutionMode.fromLabel("SMART")).isEqualTo(ExecutionMode.SMART);
    }

    @Test(description = "Unknown or missing modes fall back to smart")
    public void testLenientDefault() {
        assertThat(ExecutionMode.fromLabel(null)).isEqualTo(ExecutionMode.SMART);
        assertThat(ExecutionMode.fromLabel("")).isEqualTo(ExecutionMode.SMART);
        assertThat(ExecutionMode.fromLabel("turbo")).isEqualTo(ExecutionMode.SMART);
    }

    @Test(description = "Policy override lookup by suite name")
    public void testPolicyOverrideLookup() {
        ExecutionPolicy policy = new ExecutionPolicy(ExecutionMode.SMART,
                Map.of("checkout", SuiteOverride.sequential(true)));

        assertThat(policy.override("checkout")).isPresent();
        assertThat(policy.override("checkout").get().sharedContext()).isTrue();
        assertThat(policy.override("missing")).isEmpty();
    }
}
