package wizardrunner.runner;

import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.support.ui.Sleeper;

import java.time.Duration;
import java.util.function.Consumer;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * Builds {@link FieldContext}s around mocked collaborators for handler tests.
 */
final class Contexts {

    static final Duration SELECT_TIMEOUT = Duration.ofMillis(50);

    private Contexts() { }

    /** Context with no settle pauses. */
    static FieldContext of(WebDriver driver, WaitStrategy wait, Sleeper sleeper, DropdownFactory dropdowns) {
        return new FieldContext(driver, wait, sleeper, SELECT_TIMEOUT,
                Duration.ZERO, Duration.ZERO, Duration.ZERO, dropdowns);
    }

    /**
     * Makes a mocked {@link WaitStrategy#attemptWithin} run the action once
     * against {@code driver}, reporting a missing element as a timed-out attempt.
     */
    @SuppressWarnings("unchecked")
    static void runAttemptsOnce(WaitStrategy wait, WebDriver driver) {
        when(wait.attemptWithin(any(Duration.class), any(Consumer.class))).thenAnswer(inv -> {
            Consumer<WebDriver> action = inv.getArgument(1);
            try {
                action.accept(driver);
                return true;
            } catch (NoSuchElementException e) {
                return false;
            }
        });
    }
}
