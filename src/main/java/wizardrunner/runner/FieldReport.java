package wizardrunner.runner;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import wizardrunner.model.InteractionType;

/**
 * What happened to one declared field during an execution.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class FieldReport {

    public enum Outcome {
        @JsonProperty("filled")  FILLED,
        @JsonProperty("clicked") CLICKED,
        @JsonProperty("skipped") SKIPPED
    }

    @JsonProperty("field_id")
    private final String fieldId;

    @JsonProperty("interaction")
    private final InteractionType interaction;

    @JsonProperty("outcome")
    private final Outcome outcome;

    @JsonProperty("select_strategy")
    private final SelectStrategy selectStrategy;

    @JsonProperty("items_added")
    private final Integer itemsAdded;

    private FieldReport(String fieldId, InteractionType interaction, Outcome outcome,
                        SelectStrategy selectStrategy, Integer itemsAdded) {
        this.fieldId = fieldId;
        this.interaction = interaction;
        this.outcome = outcome;
        this.selectStrategy = selectStrategy;
        this.itemsAdded = itemsAdded;
    }

    static FieldReport filled(String fieldId, InteractionType interaction) {
        return new FieldReport(fieldId, interaction, Outcome.FILLED, null, null);
    }

    static FieldReport clicked(String fieldId, InteractionType interaction) {
        return new FieldReport(fieldId, interaction, Outcome.CLICKED, null, null);
    }

    static FieldReport skipped(String fieldId, InteractionType interaction) {
        return new FieldReport(fieldId, interaction, Outcome.SKIPPED, null, null);
    }

    static FieldReport selected(String fieldId, SelectStrategy strategy) {
        return new FieldReport(fieldId, InteractionType.SELECT, Outcome.FILLED, strategy, null);
    }

    static FieldReport group(String fieldId, int itemsAdded) {
        return new FieldReport(fieldId, InteractionType.GROUP,
                itemsAdded == 0 ? Outcome.SKIPPED : Outcome.FILLED, null, itemsAdded);
    }

    public String          getFieldId()        { return fieldId; }
    public InteractionType getInteraction()    { return interaction; }
    public Outcome         getOutcome()        { return outcome; }
    public SelectStrategy  getSelectStrategy() { return selectStrategy; }
    public Integer         getItemsAdded()     { return itemsAdded; }

    @Override
    public String toString() {
        return String.format("FieldReport{%s %s %s%s%s}", fieldId, interaction, outcome,
                selectStrategy != null ? " via " + selectStrategy.displayName() : "",
                itemsAdded != null ? " items=" + itemsAdded : "");
    }
}
