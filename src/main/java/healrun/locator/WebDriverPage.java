package healrun.locator;

import healrun.model.SelectorCandidate;

import org.openqa.selenium.By;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import static java.util.Map.entry;

/**
 * Selenium WebDriver binding of {@link PageCapability}.
 *
 * <ul>
 *   <li>test id: {@code [<testIdAttribute>="value"]}</li>
 *   <li>role: explicit {@code [role]} plus the implicit HTML role of common
 *       elements, filtered by accessible name when one is given</li>
 *   <li>text: elements with a text node containing the value, whitespace-normalized</li>
 *   <li>raw selector: XPath when it starts with {@code /} or {@code (}, CSS otherwise</li>
 * </ul>
 */
public class WebDriverPage implements PageCapability {

    private static final Map<String, String> IMPLICIT_ROLES = Map.ofEntries(
            entry("button",     "button, input[type='button'], input[type='submit'], input[type='reset']"),
            entry("link",       "a[href], area[href]"),
            entry("heading",    "h1, h2, h3, h4, h5, h6"),
            entry("textbox",    "input:not([type]), input[type='text'], input[type='email'], "
                              + "input[type='tel'], input[type='url'], input[type='search'], textarea"),
            entry("searchbox",  "input[type='search']"),
            entry("checkbox",   "input[type='checkbox']"),
            entry("radio",      "input[type='radio']"),
            entry("combobox",   "select"),
            entry("img",        "img[alt]"),
            entry("navigation", "nav"),
            entry("main",       "main"),
            entry("banner",     "header"),
            entry("contentinfo", "footer"),
            entry("list",       "ul, ol"),
            entry("listitem",   "li"),
            entry("table",      "table"),
            entry("form",       "form"));

    private final WebDriver driver;
    private final String testIdAttribute;

    public WebDriverPage(WebDriver driver) {
        this(driver, new LocatorConfig().getTestIdAttribute());
    }

    public WebDriverPage(WebDriver driver, String testIdAttribute) {
        this.driver = driver;
        this.testIdAttribute = testIdAttribute;
    }

    @Override
    public int countByTestId(String testId) {
        return driver.findElements(byTestId(testId)).size();
    }

    @Override
    public int countByRole(String role, String accessibleName) {
        return roleElements(role, accessibleName).size();
    }

    @Override
    public int countByText(String text) {
        return driver.findElements(byText(text)).size();
    }

    @Override
    public int countBySelector(String selector) {
        return driver.findElements(bySelector(selector)).size();
    }

    /** Elements matched by {@code candidate}, for acting on the resolved locator. */
    public List<WebElement> elements(SelectorCandidate candidate) {
        return switch (candidate.strategy()) {
            case TEST_ID    -> driver.findElements(byTestId(candidate.value()));
            case ROLE       -> roleElements(candidate.value(), candidate.accessibleName());
            case TEXT       -> driver.findElements(byText(candidate.value()));
            case SEMANTIC   -> driver.findElements(bySelector(PageCapability.semanticTag(candidate.value())));
            case STRUCTURAL, CSS -> driver.findElements(bySelector(candidate.value()));
        };
    }

    // ── Query builders ────────────────────────────────────────────────────

    By byTestId(String testId) {
        return By.cssSelector("[" + testIdAttribute + "=\"" + cssEscape(testId) + "\"]");
    }

    static By byRole(String role) {
        String normalized = role.trim().toLowerCase(Locale.ROOT);
        String css = "[role=\"" + cssEscape(normalized) + "\"]";
        String implicit = IMPLICIT_ROLES.get(normalized);
        return By.cssSelector(implicit == null ? css : css + ", " + implicit);
    }

    static By byText(String text) {
        return By.xpath("//*[text()[contains(normalize-space(.), " + xpathLiteral(text.trim()) + ")]]");
    }

    static By bySelector(String selector) {
        String s = selector.trim();
        return s.startsWith("/") || s.startsWith("(") ? By.xpath(s) : By.cssSelector(s);
    }

    private List<WebElement> roleElements(String role, String accessibleName) {
        List<WebElement> candidates = driver.findElements(byRole(role));
        if (accessibleName == null || accessibleName.isBlank()) {
            return candidates;
        }
        String wanted = accessibleName.trim();
        return candidates.stream()
                .filter(el -> wanted.equalsIgnoreCase(accessibleName(el)))
                .toList();
    }

    private static String accessibleName(WebElement element) {
        String name;
        try {
            name = element.getAccessibleName();
        } catch (UnsupportedOperationException | WebDriverException e) {
            // Computed names are not supported by every driver; visible text is the closest substitute
            name = null;
        }
        if (name == null || name.isBlank()) {
            name = element.getText();
        }
        return name == null ? "" : name.trim();
    }

    // ── Escaping ──────────────────────────────────────────────────────────

    static String cssEscape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    static String xpathLiteral(String value) {
        if (!value.contains("'")) {
            return "'" + value + "'";
        }
        if (!value.contains("\"")) {
            return "\"" + value + "\"";
        }
        StringBuilder sb = new StringBuilder("concat(");
        String[] parts = value.split("'", -1);
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                sb.append(", \"'\", ");
            }
            sb.append('\'').append(parts[i]).append('\'');
        }
        return sb.append(')').toString();
    }
}
