package healrun.scheduler;

import healrun.model.ExecutionPlan;
import healrun.model.Suite;
import healrun.model.TestCase;
import healrun.model.TestCategory;
import org.testng.annotations.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PlanValidatorTest {

    private static final TestCase A = new TestCase("a", TestCategory.FUNCTIONAL, "/", List.of());
    private static final TestCase B = new TestCase("b", TestCategory.FUNCTIONAL, "/", List.of());

    private static ExecutionPlan plan(Suite... suites) {
        return new ExecutionPlan(List.of(suites));
    }

    @Test(description = "A well-formed plan passes")
    public void testValid() {
        assertThatCode(() -> PlanValidator.validateAgainst(
                plan(new Suite("s1", List.of(A), 1, true), new Suite("s2", List.of(B), 3)),
                List.of(A, B))).doesNotThrowAnyException();
    }

    @Test(description = "Shared context with several workers is rejected")
    public void testSharedWithWorkers() {
        assertThatThrownBy(() -> PlanValidator.validate(plan(new Suite("s", List.of(A), 2, true))))
                .isInstanceOf(SchedulingInvariantViolationException.class)
                .hasMessageContaining("shares one context");
    }

    @Test(description = "Empty suites, zero workers, blank and duplicate names are rejected")
    public void testStructuralViolations() {
        assertThatThrownBy(() -> PlanValidator.validate(plan(new Suite("s", List.of(), 1))))
                .isInstanceOf(SchedulingInvariantViolationException.class)
                .hasMessageContaining("no cases");
        assertThatThrownBy(() -> PlanValidator.validate(plan(new Suite("s", List.of(A), 0))))
                .isInstanceOf(SchedulingInvariantViolationException.class)
                .hasMessageContaining("workers=0");
        assertThatThrownBy(() -> PlanValidator.validate(plan(new Suite(" ", List.of(A), 1))))
                .isInstanceOf(SchedulingInvariantViolationException.class);
        assertThatThrownBy(() -> PlanValidator.validate(
                plan(new Suite("s", List.of(A), 1), new Suite("s", List.of(B), 1))))
                .isInstanceOf(SchedulingInvariantViolationException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test(description = "Lost or duplicated cases are rejected")
    public void testConservation() {
        assertThatThrownBy(() -> PlanValidator.validateAgainst(
                plan(new Suite("s", List.of(A), 1)), List.of(A, B)))
                .isInstanceOf(SchedulingInvariantViolationException.class)
                .hasMessageContaining("b=1");
        assertThatThrownBy(() -> PlanValidator.validateAgainst(
                plan(new Suite("s1", List.of(A), 1), new Suite("s2", List.of(A, B), 1)), List.of(A, B)))
                .isInstanceOf(SchedulingInvariantViolationException.class)
                .hasMessageContaining("a=-1");
    }
}
