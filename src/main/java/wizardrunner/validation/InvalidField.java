package wizardrunner.validation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A present property whose value breaks a schema constraint.
 *
 * <p>{@code path} pinpoints nested violations inside group items
 * (e.g. {@code $.loans[1].amount}); {@code fieldId} is always the top-level
 * property the violation belongs to.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class InvalidField {

    @JsonProperty("field_id")
    private final String fieldId;

    @JsonProperty("path")
    private final String path;

    @JsonProperty("provided_value")
    private final JsonNode providedValue;

    /** Schema keyword that failed: pattern, enum, type, minimum, ... */
    @JsonProperty("constraint")
    private final String constraint;

    /** The expected constraint in readable form, e.g. {@code one of ["USA","Canada"]}. */
    @JsonProperty("expected")
    private final String expected;

    @JsonProperty("reason")
    private final String reason;

    public InvalidField(String fieldId, String path, JsonNode providedValue,
                        String constraint, String expected, String reason) {
        this.fieldId       = fieldId;
        this.path          = path;
        this.providedValue = providedValue;
        this.constraint    = constraint;
        this.expected      = expected;
        this.reason        = reason;
    }

    public String   getFieldId()       { return fieldId; }
    public String   getPath()          { return path; }
    public JsonNode getProvidedValue() { return providedValue; }
    public String   getConstraint()    { return constraint; }
    public String   getExpected()      { return expected; }
    public String   getReason()        { return reason; }

    @Override
    public String toString() {
        return String.format("InvalidField{%s %s: %s, expected %s}", fieldId, constraint, providedValue, expected);
    }
}
