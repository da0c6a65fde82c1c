package wizardrunner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One input inside a repeatable group item. The {@code fieldId} is the key of
 * the value inside each item record.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SubField {

    @JsonProperty("field_id")
    private String fieldId;

    @JsonProperty("label")
    private String label;

    @JsonProperty("selector")
    private String selector;

    @JsonProperty("selector_type")
    private SelectorType selectorType = SelectorType.CSS;

    @JsonProperty("interaction")
    private InteractionType interaction;

    @JsonProperty("required")
    private boolean required;

    public SubField() {}

    public SubField(String fieldId, String selector, InteractionType interaction) {
        this.fieldId = fieldId;
        this.selector = selector;
        this.interaction = interaction;
    }

    // ── Getters ──────────────────────────────────────────────────────────

    public String          getFieldId()      { return fieldId; }
    public String          getLabel()        { return label; }
    public String          getSelector()     { return selector; }
    public SelectorType    getSelectorType() { return selectorType; }
    public InteractionType getInteraction()  { return interaction; }
    public boolean         isRequired()      { return required; }

    // ── Setters ──────────────────────────────────────────────────────────

    public void setFieldId(String fieldId)                { this.fieldId = fieldId; }
    public void setLabel(String label)                    { this.label = label; }
    public void setSelector(String selector)              { this.selector = selector; }
    public void setInteraction(InteractionType type)      { this.interaction = type; }
    public void setRequired(boolean required)             { this.required = required; }
    public void setSelectorType(SelectorType selectorType) {
        this.selectorType = selectorType != null ? selectorType : SelectorType.CSS;
    }

    @JsonIgnore
    public ElementSelector toElementSelector() {
        return new ElementSelector(selector, selectorType);
    }

    @Override
    public String toString() {
        return String.format("SubField{%s, %s %s}", fieldId, interaction, toElementSelector());
    }
}
