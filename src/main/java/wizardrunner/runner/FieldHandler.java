package wizardrunner.runner;

import wizardrunner.model.ElementSelector;
import wizardrunner.model.InteractionType;

/**
 * Strategy interface implemented once per {@link InteractionType}.
 *
 * <p>Handlers are stateless; all context (driver, waits, pacing) is supplied
 * per-call so that the same handler instance can be reused across fields
 * and across executions.
 */
public interface FieldHandler {

    /**
     * Applies {@code value} to the element behind {@code selector}.
     *
     * @param ctx      live session and pacing
     * @param fieldId  id of the field, used in reports and errors
     * @param selector where the field lives on the page
     * @param value    the user's value, never {@code null}
     * @throws FieldFillException    if the interaction cannot be completed
     * @throws WizardRunnerException if a wait times out
     */
    FieldReport handle(FieldContext ctx, String fieldId, ElementSelector selector, Object value);
}
