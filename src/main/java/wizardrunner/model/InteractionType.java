package wizardrunner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The closed set of interactions a wizard field can declare.
 * Every constant has exactly one handler in the runner.
 */
public enum InteractionType {

    /** Set the text of an input directly. */
    @JsonProperty("fill")
    FILL,

    /** Set the text, then send ENTER so typeahead inputs register the choice. */
    @JsonProperty("fill_enter")
    FILL_ENTER,

    /** Ordinary visibility-gated click. */
    @JsonProperty("click")
    CLICK,

    /** Click dispatched through JavaScript, for controls hidden under a label. */
    @JsonProperty("javascript_click")
    JAVASCRIPT_CLICK,

    /** Single-value dropdown with multi-strategy option matching. */
    @JsonProperty("select")
    SELECT,

    /** Repeatable group: add, fill sub-fields, save, once per item. */
    @JsonProperty("group")
    GROUP
}
