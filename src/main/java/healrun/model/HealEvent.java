package healrun.model;

import java.util.Objects;

/**
 * Emitted when resolution fell back past the first candidate of a chain.
 *
 * @param originalCandidate the chain's preferred (index 0) candidate
 * @param usedCandidate     the candidate that actually matched
 */
public record HealEvent(SelectorCandidate originalCandidate, SelectorCandidate usedCandidate) {

    public HealEvent {
        Objects.requireNonNull(originalCandidate, "originalCandidate");
        Objects.requireNonNull(usedCandidate, "usedCandidate");
    }

    /**
     * Warning line consumed by the report UI's healed-selector list. The
     * wording is fixed.
     */
    public String warningMessage() {
        return "Selector healed: preferred " + originalCandidate.describe()
                + " failed, fell back to " + usedCandidate.describe();
    }

    @Override
    public String toString() {
        return warningMessage();
    }
}
