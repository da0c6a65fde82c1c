package wizardrunner.runner;

import org.openqa.selenium.By;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wizardrunner.model.ElementSelector;
import wizardrunner.model.ResultsDeclaration;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the results off the wizard's terminal page, as the wizard's
 * {@link ResultsDeclaration} describes. No heuristics beyond that.
 *
 * <p>The payload always holds {@code page_url} and {@code page_title}.
 * Extraction problems are recorded in the payload under
 * {@code extraction_error} instead of failing the run.
 */
public class ResultExtractor {

    private static final Logger log = LoggerFactory.getLogger(ResultExtractor.class);

    static final String PAGE_URL         = "page_url";
    static final String PAGE_TITLE       = "page_title";
    static final String BODY_TEXT        = "body_text";
    static final String EXTRACTION_ERROR = "extraction_error";

    private final int maxTextChars;

    public ResultExtractor(int maxTextChars) {
        this.maxTextChars = Math.max(0, maxTextChars);
    }

    public Map<String, Object> extract(WebDriver driver, ResultsDeclaration declaration) {
        Map<String, Object> results = new LinkedHashMap<>();
        try {
            results.put(PAGE_URL, driver.getCurrentUrl());
            results.put(PAGE_TITLE, driver.getTitle());

            if (declaration.includesBodyText()) {
                String body = driver.findElement(By.tagName("body")).getText();
                results.put(BODY_TEXT, truncate(body));
            }

            for (Map.Entry<String, ElementSelector> entry : declaration.getFields().entrySet()) {
                results.put(entry.getKey(), readText(driver, entry.getKey(), entry.getValue()));
            }
            log.info("Results extracted from {} ({} entries)", results.get(PAGE_URL), results.size());
        } catch (WebDriverException e) {
            String reason = NavigationException.firstLine(e.getMessage());
            log.error("Result extraction failed: {}", reason);
            results.put(EXTRACTION_ERROR, reason);
        }
        return results;
    }

    private String readText(WebDriver driver, String name, ElementSelector selector) {
        List<WebElement> matches = driver.findElements(Selectors.toBy(selector));
        if (matches.isEmpty()) {
            log.warn("Result '{}' not found on terminal page ({})", name, selector);
            return null;
        }
        return truncate(matches.get(0).getText().trim());
    }

    private String truncate(String text) {
        if (text == null || text.length() <= maxTextChars) return text;
        return text.substring(0, maxTextChars);
    }
}
