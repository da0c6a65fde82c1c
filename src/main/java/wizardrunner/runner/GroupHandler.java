package wizardrunner.runner;

import org.openqa.selenium.WebDriverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wizardrunner.model.ElementSelector;
import wizardrunner.model.SubField;
import wizardrunner.model.UserData;
import wizardrunner.model.WizardField;

import java.util.List;
import java.util.Map;

/**
 * Handles repeatable {@code group} fields. The value is a list of item
 * records; each item runs one add, fill sub-fields, save cycle.
 *
 * <p>An empty list skips the group outright: neither the add control nor any
 * sub-field is touched.
 */
public class GroupHandler {

    private static final Logger log = LoggerFactory.getLogger(GroupHandler.class);

    private final FillHandler fill = new FillHandler();
    private final FillEnterHandler fillEnter = new FillEnterHandler();
    private final ClickHandler click = new ClickHandler();
    private final JavascriptClickHandler javascriptClick = new JavascriptClickHandler();
    private final SelectHandler select = SelectHandler.valueStrategies();

    /**
     * @return a report carrying the number of items added
     * @throws FieldFillException if the value is malformed, violates the item
     *                            count range, or any control cannot be used
     */
    public FieldReport handle(FieldContext ctx, WizardField field, Object value) {
        String fieldId = field.getFieldId();
        ElementSelector add = field.getAddSelector();

        List<Map<String, Object>> items;
        try {
            items = UserData.asRecords(value);
        } catch (IllegalArgumentException e) {
            throw new FieldFillException(fieldId, String.valueOf(add), e.getMessage());
        }

        if (items.isEmpty()) {
            log.debug("Group '{}' has no items; skipping", fieldId);
            return FieldReport.group(fieldId, 0);
        }
        checkItemCount(field, items.size());

        log.debug("Group '{}': adding {} item(s)", fieldId, items.size());
        for (int i = 0; i < items.size(); i++) {
            String itemPath = fieldId + "[" + i + "]";
            Map<String, Object> item = items.get(i);

            clickControl(ctx, itemPath, add, "add");
            Pacing.settle(ctx.sleeper(), ctx.groupItemSettle());

            for (SubField sub : field.getSubFields()) {
                fillSubField(ctx, itemPath, sub, item.get(sub.getFieldId()));
            }

            clickControl(ctx, itemPath, field.getSaveSelector(), "save");
            Pacing.settle(ctx.sleeper(), ctx.groupItemSettle());
            log.debug("Group '{}': item {}/{} saved", fieldId, i + 1, items.size());
        }
        return FieldReport.group(fieldId, items.size());
    }

    private void checkItemCount(WizardField field, int count) {
        Integer min = field.getMinItems();
        Integer max = field.getMaxItems();
        if (min != null && count < min) {
            throw new FieldFillException(field.getFieldId(), String.valueOf(field.getAddSelector()),
                    count + " item(s) given but at least " + min + " required");
        }
        if (max != null && count > max) {
            throw new FieldFillException(field.getFieldId(), String.valueOf(field.getAddSelector()),
                    count + " item(s) given but at most " + max + " allowed");
        }
    }

    private void fillSubField(FieldContext ctx, String itemPath, SubField sub, Object value) {
        String subPath = itemPath + "." + sub.getFieldId();
        ElementSelector selector = sub.toElementSelector();
        if (value == null) {
            if (sub.isRequired()) {
                throw new FieldFillException(subPath, selector.toString(), "required value missing");
            }
            log.warn("No value for sub-field '{}'; leaving it empty", subPath);
            return;
        }
        try {
            switch (sub.getInteraction()) {
                case FILL             -> fill.handle(ctx, subPath, selector, value);
                case FILL_ENTER       -> fillEnter.handle(ctx, subPath, selector, value);
                case CLICK            -> click.handle(ctx, subPath, selector, value);
                case JAVASCRIPT_CLICK -> javascriptClick.handle(ctx, subPath, selector, value);
                case SELECT           -> select.handle(ctx, subPath, selector, value);
                case GROUP            -> throw new FieldFillException(subPath, selector.toString(),
                        "groups cannot be nested");
            }
        } catch (FieldFillException | ExecutionTimeoutException e) {
            throw e;
        } catch (WizardRunnerException | WebDriverException e) {
            throw FieldExecutor.asFieldFailure(subPath, selector, e);
        }
        Pacing.settle(ctx.sleeper(), ctx.fieldSettle());
    }

    private void clickControl(FieldContext ctx, String itemPath, ElementSelector control, String role) {
        try {
            Selectors.resolveClickable(control, ctx.waits()).click();
        } catch (WizardRunnerException | WebDriverException e) {
            throw new FieldFillException(itemPath, String.valueOf(control),
                    "could not click " + role + " control: " + NavigationException.firstLine(e.getMessage()), e);
        }
    }
}
