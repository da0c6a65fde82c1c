package wizardrunner.runner;

import java.util.List;

/**
 * A field, group item or page control could not be interacted with.
 * Carries the field id, the selector used and, for dropdowns, every
 * selection strategy that was tried.
 */
public class FieldFillException extends WizardRunnerException {

    private final String fieldId;
    private final String selector;
    private final List<String> attemptedStrategies;

    public FieldFillException(String fieldId, String selector, String reason) {
        this(fieldId, selector, List.of(), reason, null);
    }

    public FieldFillException(String fieldId, String selector, String reason, Throwable cause) {
        this(fieldId, selector, List.of(), reason, cause);
    }

    public FieldFillException(String fieldId, String selector, List<String> attemptedStrategies,
                              String reason, Throwable cause) {
        super(ErrorKind.FIELD_FILL, buildMessage(fieldId, selector, attemptedStrategies, reason), cause);
        this.fieldId = fieldId;
        this.selector = selector;
        this.attemptedStrategies = List.copyOf(attemptedStrategies);
    }

    public String getFieldId()                 { return fieldId; }
    public String getSelector()                { return selector; }
    public List<String> getAttemptedStrategies() { return attemptedStrategies; }

    private static String buildMessage(String fieldId, String selector, List<String> strategies, String reason) {
        StringBuilder sb = new StringBuilder("Field '").append(fieldId).append("'");
        if (selector != null) sb.append(" (").append(selector).append(")");
        sb.append(": ").append(reason);
        if (!strategies.isEmpty()) {
            sb.append(" [tried: ").append(String.join(", ", strategies)).append("]");
        }
        return sb.toString();
    }
}
