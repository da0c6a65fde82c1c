package wizardrunner.runner;

/**
 * Failure categories reported on an {@link ExecutionResult}.
 */
public enum ErrorKind {
    SCHEMA_VALIDATION,
    NAVIGATION,
    FIELD_FILL,
    EXECUTION_TIMEOUT,
    INTERNAL
}
