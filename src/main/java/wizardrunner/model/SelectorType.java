package wizardrunner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How a recorded selector string is interpreted when locating an element.
 */
public enum SelectorType {

    /** Raw CSS selector, used as-is. */
    @JsonProperty("css")
    CSS,

    /** Element id; normalized to carry the {@code #} prefix before use. */
    @JsonProperty("id")
    ID,

    /** Exact visible text of the element. */
    @JsonProperty("text")
    TEXT
}
