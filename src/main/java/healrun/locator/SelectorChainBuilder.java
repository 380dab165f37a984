package healrun.locator;

import healrun.model.ComponentMetadata;
import healrun.model.SelectorCandidate;
import healrun.model.SelectorChain;
import healrun.model.SelectorStrategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the ordered fallback chain for one component from its recorded
 * candidates plus candidates inferred from its metadata.
 *
 * <ol>
 *   <li>Explicit candidates are taken as given.</li>
 *   <li>TestId, Role and Text candidates are inferred from metadata when no
 *       explicit candidate of that strategy exists.</li>
 *   <li>Duplicates by (strategy, value) are dropped, first occurrence wins.</li>
 *   <li>The result is stable-sorted by strategy priority; strategies missing
 *       from the priority list go last in input order.</li>
 * </ol>
 *
 * <p>Pure and deterministic: no I/O, same input gives an equal chain.
 */
public class SelectorChainBuilder {

    private static final Logger log = LoggerFactory.getLogger(SelectorChainBuilder.class);

    private final Map<SelectorStrategy, Integer> rank;
    private final int unranked;

    public SelectorChainBuilder() {
        this(SelectorStrategy.DEFAULT_PRIORITY);
    }

    /**
     * @param priority strategies in descending priority; duplicates keep their first position
     */
    public SelectorChainBuilder(List<SelectorStrategy> priority) {
        this.rank = new EnumMap<>(SelectorStrategy.class);
        for (SelectorStrategy s : priority) {
            rank.putIfAbsent(s, rank.size());
        }
        this.unranked = rank.size();
    }

    public SelectorChain build(List<SelectorCandidate> candidates, ComponentMetadata metadata) {
        List<SelectorCandidate> all = new ArrayList<>(candidates == null ? List.of() : candidates);
        all.addAll(infer(all, metadata));

        Map<String, SelectorCandidate> unique = new LinkedHashMap<>();
        for (SelectorCandidate c : all) {
            unique.putIfAbsent(SelectorChain.key(c), c);
        }

        List<SelectorCandidate> ordered = new ArrayList<>(unique.values());
        // List.sort is stable
        ordered.sort(Comparator.comparingInt(c -> rank.getOrDefault(c.strategy(), unranked)));

        SelectorChain chain = SelectorChain.of(ordered);
        log.debug("Built selector chain for '{}': {}",
                metadata != null ? metadata.name() : null, chain);
        return chain;
    }

    private List<SelectorCandidate> infer(List<SelectorCandidate> explicit, ComponentMetadata metadata) {
        if (metadata == null) {
            return List.of();
        }
        Set<SelectorStrategy> present = EnumSet.noneOf(SelectorStrategy.class);
        explicit.forEach(c -> present.add(c.strategy()));

        List<SelectorCandidate> inferred = new ArrayList<>(3);
        if (!present.contains(SelectorStrategy.TEST_ID) && hasText(metadata.testId())) {
            inferred.add(SelectorCandidate.testId(metadata.testId()));
        }
        if (!present.contains(SelectorStrategy.ROLE) && hasText(metadata.ariaRole())) {
            String name = hasText(metadata.textContent()) ? metadata.textContent() : metadata.name();
            inferred.add(SelectorCandidate.role(metadata.ariaRole(), name));
        }
        if (!present.contains(SelectorStrategy.TEXT) && hasText(metadata.textContent())) {
            inferred.add(SelectorCandidate.text(metadata.textContent()));
        }
        return inferred;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
