package healrun.locator;

import healrun.model.SelectorChain;

/**
 * Thrown at step level when no candidate of a chain matched. Carries the full
 * chain for diagnosis.
 */
public class SelectorExhaustedException extends RuntimeException {

    private final String step;
    private final SelectorChain chain;

    public SelectorExhaustedException(String step, SelectorChain chain) {
        super(message(step, chain));
        this.step = step;
        this.chain = chain;
    }

    public SelectorExhaustedException(String step, SelectorChain chain, Throwable cause) {
        super(message(step, chain), cause);
        this.step = step;
        this.chain = chain;
    }

    private static String message(String step, SelectorChain chain) {
        return chain.isEmpty()
                ? "No selector candidates for step '" + step + "'"
                : "All " + chain.size() + " selector candidate(s) failed for step '" + step + "': " + chain;
    }

    public String getStep() { return step; }
    public SelectorChain getChain() { return chain; }
}
