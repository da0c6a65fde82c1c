package wizardrunner.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wizardrunner.model.ElementSelector;
import wizardrunner.model.InteractionType;

/**
 * Handles {@code click} fields. A value of {@code false} means "leave it",
 * any other value clicks.
 */
public class ClickHandler implements FieldHandler {

    private static final Logger log = LoggerFactory.getLogger(ClickHandler.class);

    @Override
    public FieldReport handle(FieldContext ctx, String fieldId, ElementSelector selector, Object value) {
        if (Boolean.FALSE.equals(value)) {
            log.debug("Click field '{}' has value false; not clicking", fieldId);
            return FieldReport.skipped(fieldId, InteractionType.CLICK);
        }
        Selectors.resolveClickable(selector, ctx.waits()).click();
        log.debug("Clicked '{}' at {}", fieldId, selector);
        return FieldReport.clicked(fieldId, InteractionType.CLICK);
    }
}
