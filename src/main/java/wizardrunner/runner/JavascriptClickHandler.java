package wizardrunner.runner;

import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wizardrunner.model.ElementSelector;
import wizardrunner.model.InteractionType;

/**
 * Handles {@code javascript_click} fields: controls hidden beneath a styled
 * label, clicked through the DOM without a visibility check.
 */
public class JavascriptClickHandler implements FieldHandler {

    private static final Logger log = LoggerFactory.getLogger(JavascriptClickHandler.class);

    static final String CLICK_SCRIPT = "arguments[0].click();";

    @Override
    public FieldReport handle(FieldContext ctx, String fieldId, ElementSelector selector, Object value) {
        if (Boolean.FALSE.equals(value)) {
            log.debug("Click field '{}' has value false; not clicking", fieldId);
            return FieldReport.skipped(fieldId, InteractionType.JAVASCRIPT_CLICK);
        }
        WebElement el = Selectors.resolvePresent(selector, ctx.waits());
        ((JavascriptExecutor) ctx.driver()).executeScript(CLICK_SCRIPT, el);
        log.debug("JavaScript-clicked '{}' at {}", fieldId, selector);
        return FieldReport.clicked(fieldId, InteractionType.JAVASCRIPT_CLICK);
    }
}
