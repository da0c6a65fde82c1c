package wizardrunner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * A declared input on a wizard page. {@code fieldId} is the key the user data
 * supplies the value under and the property name in the data schema.
 *
 * <p>Group fields ({@link InteractionType#GROUP}) also carry the add control,
 * the save control, the ordered sub-field descriptors and the allowed item
 * count range.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WizardField {

    /** Save control used when a group does not declare one. */
    public static final String DEFAULT_SAVE_TEXT = "Save";

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

    // ── Group-only attributes ───────────────────────────────────────────

    @JsonProperty("add_selector")
    private ElementSelector addSelector;

    @JsonProperty("save_selector")
    private ElementSelector saveSelector;

    @JsonProperty("sub_fields")
    private List<SubField> subFields = new ArrayList<>();

    @JsonProperty("min_items")
    private Integer minItems;

    @JsonProperty("max_items")
    private Integer maxItems;

    public WizardField() {}

    public WizardField(String fieldId, String selector, InteractionType interaction) {
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
    public ElementSelector getAddSelector()  { return addSelector; }
    public List<SubField>  getSubFields()    { return subFields; }
    public Integer         getMinItems()     { return minItems; }
    public Integer         getMaxItems()     { return maxItems; }

    /** The group's save control, falling back to the visible text "Save". */
    public ElementSelector getSaveSelector() {
        return saveSelector != null ? saveSelector : ElementSelector.text(DEFAULT_SAVE_TEXT);
    }

    // ── Setters ──────────────────────────────────────────────────────────

    public void setFieldId(String fieldId)               { this.fieldId = fieldId; }
    public void setLabel(String label)                   { this.label = label; }
    public void setSelector(String selector)             { this.selector = selector; }
    public void setInteraction(InteractionType type)     { this.interaction = type; }
    public void setRequired(boolean required)            { this.required = required; }
    public void setAddSelector(ElementSelector add)      { this.addSelector = add; }
    public void setSaveSelector(ElementSelector save)    { this.saveSelector = save; }
    public void setMinItems(Integer minItems)            { this.minItems = minItems; }
    public void setMaxItems(Integer maxItems)            { this.maxItems = maxItems; }
    public void setSelectorType(SelectorType selectorType) {
        this.selectorType = selectorType != null ? selectorType : SelectorType.CSS;
    }
    public void setSubFields(List<SubField> subFields) {
        this.subFields = subFields != null ? new ArrayList<>(subFields) : new ArrayList<>();
    }

    // ── Convenience ──────────────────────────────────────────────────────

    @JsonIgnore
    public boolean isGroup() {
        return interaction == InteractionType.GROUP;
    }

    @JsonIgnore
    public ElementSelector toElementSelector() {
        return new ElementSelector(selector, selectorType);
    }

    @Override
    public String toString() {
        return String.format("WizardField{%s, %s %s%s}", fieldId, interaction,
                toElementSelector(), required ? ", required" : "");
    }
}
