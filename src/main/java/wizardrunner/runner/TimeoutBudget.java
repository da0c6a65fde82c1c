package wizardrunner.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * The nested timeout bounds of one execution, innermost first:
 * select strategy &lt; page operation &lt; navigation attempt &lt; single
 * browser command &lt; whole execution &lt; the caller's request.
 *
 * <p>The browser-command bound caps every WebDriver call, including a page
 * load that blocks inside {@code get}, so it sits above the navigation
 * attempt. The execution deadline is only checked between steps, so one
 * command may still be in flight when it lapses; the caller's bound must
 * cover the total plus that command.
 *
 * <p>{@link #verify()} rejects any ordering where an outer bound does not
 * exceed the bound it contains.
 */
public record TimeoutBudget(Duration selectStrategy,
                            Duration operation,
                            Duration navigationAttempt,
                            Duration browserCommand,
                            Duration totalExecution,
                            Duration hostRequest) {

    private static final Logger log = LoggerFactory.getLogger(TimeoutBudget.class);

    /**
     * @throws IllegalStateException naming the first pair out of order
     */
    public void verify() {
        requireLess("select strategy", selectStrategy, "page operation", operation);
        requireLess("page operation", operation, "navigation attempt", navigationAttempt);
        requireLess("navigation attempt", navigationAttempt, "browser command", browserCommand);
        requireLess("browser command", browserCommand, "total execution", totalExecution);
        requireLess("total execution", totalExecution, "host request", hostRequest);
        requireLess("total execution plus one browser command", totalExecution.plus(browserCommand),
                "host request", hostRequest);
    }

    /** Logs a warning when the total budget cannot cover a full navigation retry sequence. */
    public void warnIfNavigationExceedsTotal(NavigationRetryPolicy policy) {
        Duration worst = policy.worstCase();
        if (worst.compareTo(totalExecution) > 0) {
            log.warn("Navigation worst case {}s exceeds total execution budget {}s; late retries will be cut short",
                    worst.toSeconds(), totalExecution.toSeconds());
        }
    }

    private static void requireLess(String innerName, Duration inner, String outerName, Duration outer) {
        if (inner.isNegative() || inner.isZero()) {
            throw new IllegalStateException(innerName + " timeout must be positive, got " + inner.toMillis() + "ms");
        }
        if (inner.compareTo(outer) >= 0) {
            throw new IllegalStateException(String.format(
                    "Timeout hierarchy violated: %s (%dms) must be shorter than %s (%dms)",
                    innerName, inner.toMillis(), outerName, outer.toMillis()));
        }
    }
}
