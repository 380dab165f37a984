package healrun.locator;

import healrun.model.HealEvent;
import healrun.model.SelectorCandidate;
import healrun.model.SelectorChain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Step-level wrapper around {@link SelectorResolver} used by compiled tests.
 *
 * <ol>
 *   <li>Resolve the chain; on a miss, wait {@code retryDelayMs} and try again,
 *       up to {@code attempts} resolutions in total.</li>
 *   <li>On a healed match, log the warning and hand a {@link HealEvent} to
 *       every registered {@link HealEventListener}. The step still passes.</li>
 *   <li>When every attempt misses, throw {@link SelectorExhaustedException}
 *       with the full chain.</li>
 * </ol>
 *
 * <p>Heal warnings go to the {@code healrun.healing} logger, which
 * logback routes to {@code logs/healing.log} as well as the console.
 */
public class HealingLocator {

    // logback.xml routes this logger to HEALING_FILE + CONSOLE (additivity=false)
    private static final Logger log = LoggerFactory.getLogger("healrun.healing");

    private final SelectorResolver resolver;
    private final int attempts;
    private final long retryDelayMs;
    private final List<HealEventListener> listeners = new CopyOnWriteArrayList<>();

    /** Uses retry settings from {@link LocatorConfig}. */
    public HealingLocator(SelectorResolver resolver) {
        this(resolver, new LocatorConfig());
    }

    public HealingLocator(SelectorResolver resolver, LocatorConfig config) {
        this(resolver, config.getRetryAttempts(), config.getRetryDelayMs());
    }

    /**
     * @param resolver     shared resolver
     * @param attempts     total resolutions per step, at least 1
     * @param retryDelayMs pause between resolutions
     */
    public HealingLocator(SelectorResolver resolver, int attempts, long retryDelayMs) {
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be >= 1, got " + attempts);
        }
        if (retryDelayMs < 0) {
            throw new IllegalArgumentException("retryDelayMs must be >= 0, got " + retryDelayMs);
        }
        this.resolver = resolver;
        this.attempts = attempts;
        this.retryDelayMs = retryDelayMs;
    }

    public void addListener(HealEventListener listener) {
        listeners.add(listener);
    }

    /**
     * Resolves once without throwing, for absence assertions. Heal events are
     * still published.
     */
    public ResolveResult tryLocate(String step, SelectorChain chain, PageCapability page) {
        ResolveResult result = resolver.resolve(chain, page);
        result.healEvent().ifPresent(e -> publish(e, step));
        return result;
    }

    /**
     * Returns the candidate the caller should act on.
     *
     * @param step  description of the step, used in warnings and failures
     * @throws SelectorExhaustedException if no candidate matched on any attempt
     */
    public SelectorCandidate locate(String step, SelectorChain chain, PageCapability page) {
        for (int attempt = 1; attempt <= attempts; attempt++) {
            ResolveResult result = resolver.resolve(chain, page);
            if (result.found()) {
                result.healEvent().ifPresent(e -> publish(e, step));
                return result.usedCandidate();
            }
            if (attempt < attempts) {
                log.debug("Step '{}': no match on attempt {}/{}, retrying in {} ms",
                        step, attempt, attempts, retryDelayMs);
                try {
                    Thread.sleep(retryDelayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new SelectorExhaustedException(step, chain, ie);
                }
            }
        }
        log.error("SELECTOR EXHAUSTED | step={} | chain={}", step, chain);
        throw new SelectorExhaustedException(step, chain);
    }

    private void publish(HealEvent event, String step) {
        log.warn("HEALED | step={} | {}", step, event.warningMessage());
        for (HealEventListener listener : listeners) {
            try {
                listener.onHeal(event, step);
            } catch (RuntimeException e) {
                log.warn("Heal listener {} failed: {}", listener, e.getMessage(), e);
            }
        }
    }
}
