package wizardrunner.runner;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import wizardrunner.validation.ValidationResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one wizard execution, successful or not.
 *
 * <p>Failed results carry an {@link ErrorKind}, a message and the retained
 * screenshots; results rejected by validation also carry the full
 * {@link ValidationResult} and no screenshots, since no browser was opened.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"success", "wizard_id", "final_state", "failed_state", "error_type", "error",
        "pages_completed", "execution_time_ms", "navigation_attempts", "results",
        "field_reports", "validation", "mode", "screenshot_count", "screenshots"})
public final class ExecutionResult {

    @JsonProperty("success")
    private final boolean success;

    @JsonProperty("wizard_id")
    private final String wizardId;

    @JsonProperty("final_state")
    private final ExecutionState finalState;

    @JsonProperty("failed_state")
    private final ExecutionState failedState;

    @JsonProperty("error_type")
    private final ErrorKind errorType;

    @JsonProperty("error")
    private final String error;

    @JsonProperty("pages_completed")
    private final int pagesCompleted;

    @JsonProperty("execution_time_ms")
    private final long executionTimeMs;

    @JsonProperty("navigation_attempts")
    private final int navigationAttempts;

    @JsonProperty("results")
    private final Map<String, Object> results;

    @JsonProperty("field_reports")
    private final List<FieldReport> fieldReports;

    @JsonProperty("validation")
    private final ValidationResult validation;

    @JsonProperty("mode")
    private final ExecutionMode mode;

    @JsonProperty("screenshot_count")
    private final int screenshotCount;

    @JsonProperty("screenshots")
    private final List<Screenshot> screenshots;

    private ExecutionResult(Builder b) {
        this.success            = b.errorType == null;
        this.wizardId           = b.wizardId;
        this.finalState         = success ? ExecutionState.DONE : ExecutionState.FAILED;
        this.failedState        = success ? null : b.state;
        this.errorType          = b.errorType;
        this.error              = b.error;
        this.pagesCompleted     = b.pagesCompleted;
        this.executionTimeMs    = b.executionTimeMs;
        this.navigationAttempts = b.navigationAttempts;
        this.results            = b.results != null ? Collections.unmodifiableMap(new LinkedHashMap<>(b.results)) : null;
        this.fieldReports       = List.copyOf(b.fieldReports);
        this.validation         = b.validation;
        this.mode               = b.mode;
        this.screenshotCount    = b.screenshotCount;
        this.screenshots        = List.copyOf(b.screenshots);
    }

    /** Result for user data rejected before any browser was started. */
    static ExecutionResult rejected(String wizardId, ValidationResult validation,
                                    ExecutionMode mode, long executionTimeMs) {
        return new Builder(wizardId, mode)
                .state(ExecutionState.INIT)
                .failure(ErrorKind.SCHEMA_VALIDATION, validation.summary())
                .validation(validation)
                .executionTimeMs(executionTimeMs)
                .build();
    }

    // ── Getters ────────────────────────────────────────────────────────────

    public boolean             isSuccess()             { return success; }
    public String              getWizardId()           { return wizardId; }
    public ExecutionState      getFinalState()         { return finalState; }
    public ExecutionState      getFailedState()        { return failedState; }
    public ErrorKind           getErrorType()          { return errorType; }
    public String              getError()              { return error; }
    public int                 getPagesCompleted()     { return pagesCompleted; }
    public long                getExecutionTimeMs()    { return executionTimeMs; }
    public int                 getNavigationAttempts() { return navigationAttempts; }
    public Map<String, Object> getResults()            { return results; }
    public List<FieldReport>   getFieldReports()       { return fieldReports; }
    public ValidationResult    getValidation()         { return validation; }
    public ExecutionMode       getMode()               { return mode; }
    public int                 getScreenshotCount()    { return screenshotCount; }
    public List<Screenshot>    getScreenshots()        { return screenshots; }

    @Override
    public String toString() {
        return success
                ? String.format("ExecutionResult{SUCCESS %s, %d page(s), %dms}",
                        wizardId, pagesCompleted, executionTimeMs)
                : String.format("ExecutionResult{FAILED %s in %s after %d page(s): %s %s}",
                        wizardId, failedState, pagesCompleted, errorType, error);
    }

    // ── Builder ────────────────────────────────────────────────────────────

    /**
     * Accumulates the state of a run in progress. Not thread-safe; each
     * execution owns its own builder.
     */
    static final class Builder {

        private final String wizardId;
        private final ExecutionMode mode;
        private ExecutionState state = ExecutionState.INIT;
        private ErrorKind errorType;
        private String error;
        private int pagesCompleted;
        private long executionTimeMs;
        private int navigationAttempts;
        private Map<String, Object> results;
        private final List<FieldReport> fieldReports = new ArrayList<>();
        private ValidationResult validation;
        private int screenshotCount;
        private List<Screenshot> screenshots = List.of();

        Builder(String wizardId, ExecutionMode mode) {
            this.wizardId = wizardId;
            this.mode = mode;
        }

        Builder state(ExecutionState s)         { this.state = s; return this; }
        Builder pageCompleted()                 { this.pagesCompleted++; return this; }
        Builder navigationAttempts(int n)       { this.navigationAttempts = n; return this; }
        Builder fieldReport(FieldReport r)      { this.fieldReports.add(r); return this; }
        Builder results(Map<String, Object> r)  { this.results = r; return this; }
        Builder validation(ValidationResult v)  { this.validation = v; return this; }
        Builder executionTimeMs(long ms)        { this.executionTimeMs = ms; return this; }

        Builder failure(ErrorKind kind, String message) {
            this.errorType = kind;
            this.error = message;
            return this;
        }

        /** Records the total captured and the subset retained for the response. */
        Builder screenshots(int captured, List<Screenshot> retained) {
            this.screenshotCount = captured;
            this.screenshots = retained;
            return this;
        }

        String wizardId()      { return wizardId; }
        ExecutionState state() { return state; }

        ExecutionResult build() {
            return new ExecutionResult(this);
        }
    }
}
