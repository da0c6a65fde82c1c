package wizardrunner.runner;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Tracks the total execution budget. The runner calls {@link #check(String)}
 * before every navigation attempt, page transition and field.
 */
public final class ExecutionDeadline {

    private final Clock clock;
    private final Instant start;
    private final Duration budget;

    public ExecutionDeadline(Clock clock, Duration budget) {
        this.clock = clock;
        this.start = clock.instant();
        this.budget = budget;
    }

    /**
     * @throws ExecutionTimeoutException if the budget is already spent
     */
    public void check(String step) {
        Duration elapsed = elapsed();
        if (elapsed.compareTo(budget) >= 0) {
            throw new ExecutionTimeoutException(step, budget, elapsed);
        }
    }

    public Duration elapsed() {
        return Duration.between(start, clock.instant());
    }

    public Duration remaining() {
        Duration left = budget.minus(elapsed());
        return left.isNegative() ? Duration.ZERO : left;
    }
}
