package wizardrunner.runner;

/**
 * States of one wizard execution. {@code STARTED} is only entered when the
 * wizard declares a start action; {@code FAILED} is reachable from any state.
 */
public enum ExecutionState {
    INIT,
    NAVIGATED,
    STARTED,
    PAGE,
    RESULTS,
    DONE,
    FAILED
}
