package wizardrunner.runner;

import java.time.Duration;

/**
 * Bounded retry for loading the wizard's start page: one first attempt plus
 * {@code maxRetries} more, each bounded by {@code attemptTimeout} and preceded
 * by {@code delay}.
 */
public record NavigationRetryPolicy(int maxRetries, Duration delay, Duration attemptTimeout) {

    public int maxAttempts() {
        return maxRetries + 1;
    }

    /** Longest time the whole sequence can take when every attempt times out. */
    public Duration worstCase() {
        return attemptTimeout.multipliedBy(maxAttempts()).plus(delay.multipliedBy(maxRetries));
    }
}
