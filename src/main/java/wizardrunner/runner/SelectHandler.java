package wizardrunner.runner;

import org.openqa.selenium.By;
import org.openqa.selenium.WebDriverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wizardrunner.model.ElementSelector;
import wizardrunner.model.UserData;

import java.util.ArrayList;
import java.util.List;

/**
 * Handles {@code select} fields on native dropdowns by trying a fixed list of
 * {@link SelectStrategy strategies} in order:
 * <ol>
 *   <li>option value as given</li>
 *   <li>option value with apostrophes normalized</li>
 *   <li>visible label as given</li>
 *   <li>visible label with apostrophes normalized</li>
 * </ol>
 *
 * <p>Each strategy is bounded by the select-strategy timeout, so exhausting
 * all of them costs a small multiple of that bound. A disabled select or
 * option is retried within that bound, since its options may still be
 * loading from an earlier answer. A normalized strategy is
 * skipped when normalizing leaves the value unchanged. The first strategy that
 * selects an option is recorded on the {@link FieldReport}.
 */
public class SelectHandler implements FieldHandler {

    private static final Logger log = LoggerFactory.getLogger(SelectHandler.class);

    private final List<SelectStrategy> strategies;

    /** Value then normalized value, used inside repeatable groups. */
    static SelectHandler valueStrategies() {
        return new SelectHandler(List.of(SelectStrategy.VALUE, SelectStrategy.VALUE_NORMALIZED));
    }

    public SelectHandler() {
        this(List.of(SelectStrategy.values()));
    }

    SelectHandler(List<SelectStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    List<SelectStrategy> getStrategies() { return strategies; }

    @Override
    public FieldReport handle(FieldContext ctx, String fieldId, ElementSelector selector, Object value) {
        String raw = UserData.asText(value);
        By by = Selectors.toBy(selector);
        List<String> attempted = new ArrayList<>();
        WebDriverException lastError = null;

        for (SelectStrategy strategy : strategies) {
            String candidate = strategy.candidate(raw);
            if (strategy.isNormalized() && candidate.equals(raw)) {
                log.debug("Skipping {} for '{}': nothing to normalize", strategy.displayName(), fieldId);
                continue;
            }
            attempted.add(strategy.displayName());
            try {
                boolean selected = ctx.waits().attemptWithin(ctx.selectStrategyTimeout(),
                        d -> strategy.apply(ctx.dropdowns().open(d.findElement(by)), candidate));
                if (selected) {
                    log.info("Selected '{}' in '{}' using strategy {}", candidate, fieldId, strategy.displayName());
                    return FieldReport.selected(fieldId, strategy);
                }
                log.debug("Strategy {} found no option '{}' in '{}' within {}ms",
                        strategy.displayName(), candidate, fieldId, ctx.selectStrategyTimeout().toMillis());
            } catch (WebDriverException e) {
                lastError = e;
                log.debug("Strategy {} failed for '{}': {}", strategy.displayName(), fieldId,
                        NavigationException.firstLine(e.getMessage()));
            }
        }

        throw new FieldFillException(fieldId, selector.toString(), attempted,
                "no enabled dropdown option matched '" + raw + "'", lastError);
    }
}
