package wizardrunner.validation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A required property absent from the user data, with the schema hints a
 * caller needs to collect it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class MissingField {

    @JsonProperty("field_id")
    private final String fieldId;

    @JsonProperty("description")
    private final String description;

    @JsonProperty("type")
    private final String type;

    @JsonProperty("pattern")
    private final String pattern;

    @JsonProperty("enum")
    private final JsonNode allowedValues;

    @JsonProperty("examples")
    private final JsonNode examples;

    public MissingField(String fieldId, String description, String type, String pattern,
                        JsonNode allowedValues, JsonNode examples) {
        this.fieldId       = fieldId;
        this.description   = description;
        this.type          = type;
        this.pattern       = pattern;
        this.allowedValues = allowedValues;
        this.examples      = examples;
    }

    public String   getFieldId()       { return fieldId; }
    public String   getDescription()   { return description; }
    public String   getType()          { return type; }
    public String   getPattern()       { return pattern; }
    public JsonNode getAllowedValues() { return allowedValues; }
    public JsonNode getExamples()      { return examples; }

    @Override
    public String toString() {
        return "MissingField{" + fieldId + (pattern != null ? ", pattern=" + pattern : "") + "}";
    }
}
