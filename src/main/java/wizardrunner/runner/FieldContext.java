package wizardrunner.runner;

import org.openqa.selenium.WebDriver;
import org.openqa.selenium.support.ui.Sleeper;

import java.time.Duration;

/**
 * Per-execution context handed to every {@link FieldHandler} call, so the
 * handlers themselves stay stateless.
 *
 * @param driver                the live session
 * @param waits                 explicit waits bounded by the page-operation timeout
 * @param sleeper               settle pauses
 * @param selectStrategyTimeout bound for one dropdown selection strategy
 * @param fieldSettle           pause after each filled field
 * @param typeaheadSettle       pause after the commit keystroke of a typeahead
 * @param groupItemSettle       pause after each group add or save click
 * @param dropdowns             wraps a located element as a {@link Dropdown}
 */
public record FieldContext(WebDriver driver,
                           WaitStrategy waits,
                           Sleeper sleeper,
                           Duration selectStrategyTimeout,
                           Duration fieldSettle,
                           Duration typeaheadSettle,
                           Duration groupItemSettle,
                           DropdownFactory dropdowns) {

    static FieldContext of(BrowserSession session, RunnerConfig config, TimeoutBudget budget,
                           Sleeper sleeper, DropdownFactory dropdowns) {
        return new FieldContext(session.driver(), session.waits(), sleeper,
                budget.selectStrategy(),
                config.getFieldSettle(),
                config.getTypeaheadSettle(),
                config.getGroupItemSettle(),
                dropdowns);
    }
}
