package healrun.locator;

import healrun.model.HealEvent;
import healrun.model.SelectorCandidate;

import java.util.Optional;

/**
 * Outcome of resolving one {@link healrun.model.SelectorChain} against a page.
 *
 * @param found             a candidate matched at least one element
 * @param healed            the winning candidate was not the chain's first
 * @param usedCandidate     winning candidate, {@code null} when not found
 * @param originalCandidate chain's first candidate, set only when healed
 * @param usedIndex         index of the winner in the chain, {@code -1} when not found
 */
public record ResolveResult(boolean found,
                            boolean healed,
                            SelectorCandidate usedCandidate,
                            SelectorCandidate originalCandidate,
                            int usedIndex) {

    private static final ResolveResult NOT_FOUND = new ResolveResult(false, false, null, null, -1);

    public static ResolveResult notFound() {
        return NOT_FOUND;
    }

    static ResolveResult matched(SelectorCandidate first, SelectorCandidate winner, int index) {
        boolean healed = index > 0;
        return new ResolveResult(true, healed, winner, healed ? first : null, index);
    }

    public Optional<HealEvent> healEvent() {
        return healed ? Optional.of(new HealEvent(originalCandidate, usedCandidate)) : Optional.empty();
    }

    /** Warning line for the report, present only when healing occurred. */
    public Optional<String> warningMessage() {
        return healEvent().map(HealEvent::warningMessage);
    }
}
