package healrun.scheduler;

import java.util.Set;
import java.util.regex.Pattern;

/** Deterministic suite names derived from routes. */
final class SuiteNames {

    static final String ROOT = "root";

    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9_-]");
    private static final Pattern EDGE_SLASHES = Pattern.compile("^/+|/+$");

    private SuiteNames() {}

    /** {@code /products/list} -> {@code ui-products-list}; {@code /} or empty -> {@code ui-root}. */
    static String forRoute(String route) {
        String trimmed = route == null ? "" : EDGE_SLASHES.matcher(route.trim()).replaceAll("");
        String safe = UNSAFE.matcher(trimmed).replaceAll("-");
        return "ui-" + (safe.isEmpty() ? ROOT : safe);
    }

    /**
     * Returns {@code base}, or {@code base-2}, {@code base-3}... if already
     * taken, and records the result in {@code taken}.
     */
    static String unique(String base, Set<String> taken) {
        String name = base;
        for (int n = 2; taken.contains(name); n++) {
            name = base + "-" + n;
        }
        taken.add(name);
        return name;
    }
}
