package healrun.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ordered, duplicate-free list of {@link SelectorCandidate}s for one element.
 * Position encodes resolution priority: index 0 is the preferred candidate.
 *
 * <p>Uniqueness is by (strategy, value); the accessible name does not take
 * part in it.
 */
public final class SelectorChain implements Iterable<SelectorCandidate> {

    private static final SelectorChain EMPTY = new SelectorChain(List.of());

    private final List<SelectorCandidate> candidates;

    private SelectorChain(List<SelectorCandidate> candidates) {
        this.candidates = candidates;
    }

    /**
     * @throws IllegalArgumentException if two candidates share a (strategy, value) pair
     */
    @JsonCreator
    public static SelectorChain of(List<SelectorCandidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return EMPTY;
        }
        Set<String> seen = new HashSet<>();
        for (SelectorCandidate c : candidates) {
            if (c == null) {
                throw new IllegalArgumentException("Selector chain contains a null candidate");
            }
            if (!seen.add(key(c))) {
                throw new IllegalArgumentException("Duplicate selector candidate in chain: " + c.describe());
            }
        }
        return new SelectorChain(Collections.unmodifiableList(new ArrayList<>(candidates)));
    }

    public static SelectorChain of(SelectorCandidate... candidates) {
        return of(List.of(candidates));
    }

    public static SelectorChain empty() {
        return EMPTY;
    }

    /** Identity of a candidate within a chain: strategy plus value, ignoring accessible name. */
    public static String key(SelectorCandidate c) {
        return c.strategy().name() + '\u0000' + c.value();
    }

    @JsonValue
    public List<SelectorCandidate> candidates() {
        return candidates;
    }

    public SelectorCandidate get(int index) {
        return candidates.get(index);
    }

    public int size() {
        return candidates.size();
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }

    @Override
    public Iterator<SelectorCandidate> iterator() {
        return candidates.iterator();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SelectorChain other && candidates.equals(other.candidates);
    }

    @Override
    public int hashCode() {
        return candidates.hashCode();
    }

    @Override
    public String toString() {
        return candidates.stream()
                .map(SelectorCandidate::toString)
                .collect(Collectors.joining(" -> ", "[", "]"));
    }
}
