package wizardrunner.runner;

import org.openqa.selenium.support.ui.Sleeper;

import java.time.Duration;

/**
 * Fixed settle pauses between interactions, routed through a Selenium
 * {@link Sleeper} so tests can replace real sleeping.
 */
final class Pacing {

    private Pacing() { }

    static void settle(Sleeper sleeper, Duration pause) {
        if (pause.isZero() || pause.isNegative()) return;
        try {
            sleeper.sleep(pause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WizardRunnerException("Interrupted while pausing " + pause.toMillis() + "ms", e);
        }
    }
}
