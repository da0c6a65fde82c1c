package wizardrunner.runner;

import org.openqa.selenium.Keys;
import org.openqa.selenium.WebElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wizardrunner.model.ElementSelector;
import wizardrunner.model.InteractionType;
import wizardrunner.model.UserData;

/**
 * Handles {@code fill_enter} fields: typeahead inputs that only register a
 * choice after an explicit ENTER.
 */
public class FillEnterHandler implements FieldHandler {

    private static final Logger log = LoggerFactory.getLogger(FillEnterHandler.class);

    @Override
    public FieldReport handle(FieldContext ctx, String fieldId, ElementSelector selector, Object value) {
        WebElement el = FillHandler.type(ctx, selector, UserData.asText(value));
        el.sendKeys(Keys.ENTER);
        Pacing.settle(ctx.sleeper(), ctx.typeaheadSettle());
        log.debug("Filled '{}' at {} and committed with ENTER", fieldId, selector);
        return FieldReport.filled(fieldId, InteractionType.FILL_ENTER);
    }
}
