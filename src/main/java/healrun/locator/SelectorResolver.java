package healrun.locator;

import healrun.model.SelectorCandidate;
import healrun.model.SelectorChain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the first candidate of a chain that matches at least one element on
 * the live page.
 *
 * <p>Candidates are tried in chain order with {@link PageCapability#count};
 * the first with a non-zero count wins, no scoring. A candidate whose query
 * throws counts as zero matches. "Not found" is returned, never thrown, and
 * there is no retry at this level.
 *
 * <p>Stateless and safe to share.
 */
public class SelectorResolver {

    private static final Logger log = LoggerFactory.getLogger(SelectorResolver.class);

    public ResolveResult resolve(SelectorChain chain, PageCapability page) {
        if (chain == null || chain.isEmpty()) {
            log.debug("Empty selector chain — nothing to resolve");
            return ResolveResult.notFound();
        }

        SelectorCandidate first = chain.get(0);
        for (int i = 0; i < chain.size(); i++) {
            SelectorCandidate candidate = chain.get(i);
            int count;
            try {
                count = page.count(candidate);
            } catch (RuntimeException e) {
                log.debug("[{}] query failed, treating as no match: {}", candidate, e.toString());
                continue;
            }
            log.debug("Trying [{}]: {} match(es)", candidate, count);
            if (count > 0) {
                if (i > 0) {
                    log.warn("Selector healed: {} -> {}", first, candidate);
                }
                return ResolveResult.matched(first, candidate, i);
            }
        }

        log.warn("All {} selector candidate(s) failed, preferred was {}", chain.size(), first);
        return ResolveResult.notFound();
    }
}
