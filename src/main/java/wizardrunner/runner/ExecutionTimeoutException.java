package wizardrunner.runner;

import java.time.Duration;

/**
 * The whole-execution budget ran out before the named step could start.
 */
public class ExecutionTimeoutException extends WizardRunnerException {

    private final String step;

    public ExecutionTimeoutException(String step, Duration budget, Duration elapsed) {
        super(ErrorKind.EXECUTION_TIMEOUT,
                "Execution exceeded its " + budget.toSeconds() + "s budget before " + step
                        + " (elapsed " + elapsed.toMillis() + "ms)",
                null);
        this.step = step;
    }

    public String getStep() { return step; }
}
