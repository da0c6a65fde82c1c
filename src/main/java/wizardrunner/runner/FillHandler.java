package wizardrunner.runner;

import org.openqa.selenium.WebElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wizardrunner.model.ElementSelector;
import wizardrunner.model.InteractionType;
import wizardrunner.model.UserData;

/**
 * Handles {@code fill} fields: clears the input and types the value.
 */
public class FillHandler implements FieldHandler {

    private static final Logger log = LoggerFactory.getLogger(FillHandler.class);

    @Override
    public FieldReport handle(FieldContext ctx, String fieldId, ElementSelector selector, Object value) {
        type(ctx, selector, UserData.asText(value));
        log.debug("Filled '{}' at {}", fieldId, selector);
        return FieldReport.filled(fieldId, InteractionType.FILL);
    }

    /** Waits for the input to be visible, clears it and sends {@code text}. */
    static WebElement type(FieldContext ctx, ElementSelector selector, String text) {
        WebElement el = Selectors.resolveVisible(selector, ctx.waits());
        el.clear();
        el.sendKeys(text);
        return el;
    }
}
