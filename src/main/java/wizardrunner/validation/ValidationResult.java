package wizardrunner.validation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of checking user data against a data schema. Lists every violation
 * found; {@link #isValid()} is true only when both lists are empty.
 */
public final class ValidationResult {

    @JsonProperty("valid")
    private final boolean valid;

    @JsonProperty("missing_fields")
    private final List<MissingField> missingFields;

    @JsonProperty("invalid_fields")
    private final List<InvalidField> invalidFields;

    public ValidationResult(List<MissingField> missingFields, List<InvalidField> invalidFields) {
        this.missingFields = List.copyOf(missingFields);
        this.invalidFields = List.copyOf(invalidFields);
        this.valid = this.missingFields.isEmpty() && this.invalidFields.isEmpty();
    }

    public boolean            isValid()          { return valid; }
    public List<MissingField> getMissingFields() { return missingFields; }
    public List<InvalidField> getInvalidFields() { return invalidFields; }

    /** Field ids of the missing properties, in schema order. */
    public List<String> missingFieldIds() {
        return missingFields.stream().map(MissingField::getFieldId).collect(Collectors.toList());
    }

    /** One-line summary suitable for an error message. */
    public String summary() {
        if (valid) return "user data conforms to schema";
        return String.format("user data failed validation: missing %s, invalid %s",
                missingFieldIds(),
                invalidFields.stream().map(InvalidField::getFieldId).distinct().collect(Collectors.toList()));
    }

    @Override
    public String toString() {
        return "ValidationResult{" + summary() + "}";
    }
}
