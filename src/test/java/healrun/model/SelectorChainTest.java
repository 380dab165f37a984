package healrun.model;

import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SelectorChain} and {@link SelectorCandidate}.
 */
public class SelectorChainTest {

    @Test(description = "A chain keeps the given order and is iterable")
    public void testOrderPreserved() {
        SelectorChain chain = SelectorChain.of(
                SelectorCandidate.css(".btn"),
                SelectorCandidate.testId("x"),
                SelectorCandidate.text("Submit"));

        assertThat(chain.size()).isEqualTo(3);
        assertThat(chain.get(0)).isEqualTo(SelectorCandidate.css(".btn"));
        assertThat(chain).extracting(SelectorCandidate::strategy)
                .containsExactly(SelectorStrategy.CSS, SelectorStrategy.TEST_ID, SelectorStrategy.TEXT);
    }

    @Test(description = "Duplicate (strategy, value) pairs are rejected")
    public void testDuplicatesRejected() {
        assertThatThrownBy(() -> SelectorChain.of(
                SelectorCandidate.css(".btn"),
                SelectorCandidate.css(".btn")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(".btn");
    }

    @Test(description = "Same value under different strategies is not a duplicate")
    public void testSameValueDifferentStrategy() {
        SelectorChain chain = SelectorChain.of(
                SelectorCandidate.text("Submit"),
                SelectorCandidate.css("Submit"));

        assertThat(chain.size()).isEqualTo(2);
    }

    @Test(description = "Candidate identity is strategy plus value, the accessible name does not count")
    public void testKey() {
        assertThat(SelectorChain.key(SelectorCandidate.role("button", "Save")))
                .isEqualTo(SelectorChain.key(SelectorCandidate.role("button", "Cancel")))
                .isNotEqualTo(SelectorChain.key(SelectorCandidate.text("button")));
    }

    @Test(description = "The chain is a snapshot of the input list")
    public void testImmutable() {
        List<SelectorCandidate> source = new ArrayList<>(List.of(SelectorCandidate.testId("a")));
        SelectorChain chain = SelectorChain.of(source);
        source.add(SelectorCandidate.testId("b"));

        assertThat(chain.size()).isEqualTo(1);
        assertThatThrownBy(() -> chain.candidates().add(SelectorCandidate.testId("c")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test(description = "Empty chain is valid and equal to another empty chain")
    public void testEmpty() {
        assertThat(SelectorChain.empty().isEmpty()).isTrue();
        assertThat(SelectorChain.of(List.of())).isEqualTo(SelectorChain.empty());
    }

    @Test(description = "describe() renders label(value) for heal warnings")
    public void testDescribe() {
        assertThat(SelectorCandidate.testId("login-btn").describe()).isEqualTo("test_id(login-btn)");
        assertThat(SelectorCandidate.role("button", "Sign in").describe()).isEqualTo("role(button)");
        assertThat(SelectorCandidate.role("button", "Sign in").toString())
                .isEqualTo("role(button, name='Sign in')");
    }

    @Test(description = "Candidates require strategy and value")
    public void testCandidateNullChecks() {
        assertThatThrownBy(() -> SelectorCandidate.of(null, "x"))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> SelectorCandidate.css(null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test(description = "Strategy labels parse case-insensitively, with dashes or constant names")
    public void testStrategyFromLabel() {
        assertThat(SelectorStrategy.fromLabel("test_id")).isEqualTo(SelectorStrategy.TEST_ID);
        assertThat(SelectorStrategy.fromLabel("Test-Id")).isEqualTo(SelectorStrategy.TEST_ID);
        assertThat(SelectorStrategy.fromLabel("STRUCTURAL")).isEqualTo(SelectorStrategy.STRUCTURAL);
        assertThatThrownBy(() -> SelectorStrategy.fromLabel("xpath"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
