package wizardrunner.runner;

import java.util.List;

/**
 * Chooses which captured screenshots travel back with a result. Capture is
 * always complete; only the response is trimmed.
 */
public final class ScreenshotRetention {

    public enum Outcome { SUCCESS, FAILURE }

    /** Final state after a successful production run. */
    static final int PRODUCTION_SUCCESS_KEEP = 1;

    /** Failure state plus the step before it. */
    static final int PRODUCTION_FAILURE_KEEP = 2;

    private ScreenshotRetention() { }

    /**
     * @return every item in DEBUG mode; otherwise the trailing one (success)
     *         or two (failure), oldest first
     */
    public static <T> List<T> select(ExecutionMode mode, Outcome outcome, List<T> captured) {
        if (mode == ExecutionMode.DEBUG) {
            return List.copyOf(captured);
        }
        int keep = outcome == Outcome.SUCCESS ? PRODUCTION_SUCCESS_KEEP : PRODUCTION_FAILURE_KEEP;
        int from = Math.max(0, captured.size() - keep);
        return List.copyOf(captured.subList(from, captured.size()));
    }
}
