package wizardrunner.runner;

import org.openqa.selenium.By;
import org.openqa.selenium.WebElement;
import wizardrunner.model.ElementSelector;

/**
 * Static helpers that turn wizard selectors into Selenium locators and
 * resolve them through a {@link WaitStrategy}.
 */
final class Selectors {

    private Selectors() { }

    /**
     * Converts a selector to a Selenium {@link By}.
     * ID selectors become {@code #id} CSS, text selectors match an element
     * whose own whitespace-normalised text equals the value.
     */
    static By toBy(ElementSelector selector) {
        return switch (selector.getSelectorType()) {
            case ID   -> By.cssSelector(selector.normalizedSelector());
            case TEXT -> By.xpath("//*[normalize-space(text())=" + xpathLiteral(selector.getSelector().trim()) + "]");
            case CSS  -> By.cssSelector(selector.getSelector());
        };
    }

    static WebElement resolveClickable(ElementSelector selector, WaitStrategy wait) {
        return wait.waitForClickable(toBy(selector));
    }

    static WebElement resolveVisible(ElementSelector selector, WaitStrategy wait) {
        return wait.waitForVisible(toBy(selector));
    }

    static WebElement resolvePresent(ElementSelector selector, WaitStrategy wait) {
        return wait.waitForPresent(toBy(selector));
    }

    /**
     * Quotes a string for XPath 1.0, which has no escape sequences; values
     * holding both quote kinds are split with {@code concat()}.
     */
    static String xpathLiteral(String value) {
        if (!value.contains("'")) return "'" + value + "'";
        if (!value.contains("\"")) return "\"" + value + "\"";
        StringBuilder sb = new StringBuilder("concat(");
        String[] parts = value.split("'", -1);
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) sb.append(", \"'\", ");
            sb.append("'").append(parts[i]).append("'");
        }
        return sb.append(")").toString();
    }
}
