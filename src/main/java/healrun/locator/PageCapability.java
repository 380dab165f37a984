package healrun.locator;

import healrun.model.SelectorCandidate;

/**
 * Read-only element queries a browser-automation binding must provide.
 *
 * <p>Every method returns the number of elements currently matching; none of
 * them act on the page. Implementations may throw when a query cannot be
 * evaluated (stale reference, invalid selector); the resolver treats that as
 * zero matches.
 */
public interface PageCapability {

    /** Elements carrying the given stable test identifier. */
    int countByTestId(String testId);

    /**
     * Elements with the given ARIA role, narrowed by accessible name when
     * {@code accessibleName} is non-null.
     */
    int countByRole(String role, String accessibleName);

    /** Elements whose visible text contains {@code text}. */
    int countByText(String text);

    /** Elements matching a raw selector expression (CSS, or XPath where supported). */
    int countBySelector(String selector);

    /**
     * Translates a candidate into the query for its strategy and returns the
     * match count.
     */
    default int count(SelectorCandidate candidate) {
        return switch (candidate.strategy()) {
            case TEST_ID    -> countByTestId(candidate.value());
            case ROLE       -> countByRole(candidate.value(), candidate.accessibleName());
            case TEXT       -> countByText(candidate.value());
            case SEMANTIC   -> countBySelector(semanticTag(candidate.value()));
            case STRUCTURAL, CSS -> countBySelector(candidate.value());
        };
    }

    /**
     * Semantic values are recorded as {@code tag[label]}, e.g.
     * {@code nav[Main Navigation]}; only the tag is queried.
     */
    static String semanticTag(String value) {
        int bracket = value.indexOf('[');
        return bracket > 0 ? value.substring(0, bracket).trim() : value;
    }
}
