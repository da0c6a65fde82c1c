package wizardrunner.runner;

import org.openqa.selenium.WebDriverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wizardrunner.model.ElementSelector;
import wizardrunner.model.WizardField;

/**
 * Dispatches each declared field to the handler for its interaction kind.
 *
 * <p>A field without a value is skipped unless it is required, in which case
 * the fill fails. Failures from waits and from the driver surface as
 * {@link FieldFillException} carrying the field id and selector.
 */
public class FieldExecutor {

    private static final Logger log = LoggerFactory.getLogger(FieldExecutor.class);

    private final FillHandler fill = new FillHandler();
    private final FillEnterHandler fillEnter = new FillEnterHandler();
    private final ClickHandler click = new ClickHandler();
    private final JavascriptClickHandler javascriptClick = new JavascriptClickHandler();
    private final SelectHandler select = new SelectHandler();
    private final GroupHandler group = new GroupHandler();

    /**
     * Fills one field, then pauses for the field settle time.
     *
     * @param value the user's value for the field, or {@code null} if none was given
     * @throws FieldFillException         if the field cannot be filled
     * @throws ExecutionTimeoutException  passed through untouched
     */
    public FieldReport execute(FieldContext ctx, WizardField field, Object value) {
        String fieldId = field.getFieldId();
        ElementSelector selector = field.toElementSelector();

        if (value == null) {
            if (field.isRequired()) {
                throw new FieldFillException(fieldId, selector.toString(), "required value missing");
            }
            log.debug("No value for optional field '{}'; skipping", fieldId);
            return FieldReport.skipped(fieldId, field.getInteraction());
        }

        log.info("Filling '{}' ({})", fieldId, field.getInteraction());
        FieldReport report;
        try {
            report = switch (field.getInteraction()) {
                case FILL             -> fill.handle(ctx, fieldId, selector, value);
                case FILL_ENTER       -> fillEnter.handle(ctx, fieldId, selector, value);
                case CLICK            -> click.handle(ctx, fieldId, selector, value);
                case JAVASCRIPT_CLICK -> javascriptClick.handle(ctx, fieldId, selector, value);
                case SELECT           -> select.handle(ctx, fieldId, selector, value);
                case GROUP            -> group.handle(ctx, field, value);
            };
        } catch (FieldFillException | ExecutionTimeoutException e) {
            throw e;
        } catch (WizardRunnerException | WebDriverException | UnsupportedOperationException e) {
            // Select raises UnsupportedOperationException for a disabled control
            throw asFieldFailure(fieldId, selector, e);
        }
        Pacing.settle(ctx.sleeper(), ctx.fieldSettle());
        return report;
    }

    static FieldFillException asFieldFailure(String fieldId, ElementSelector selector, RuntimeException e) {
        return new FieldFillException(fieldId, selector.toString(),
                NavigationException.firstLine(e.getMessage()), e);
    }
}
