package wizardrunner.runner;

/**
 * Decides how many screenshots travel back with a result.
 */
public enum ExecutionMode {
    /** Interactive runs: every captured screenshot is returned. */
    DEBUG,
    /** Unattended runs: only the last one or two screenshots are returned. */
    PRODUCTION
}
