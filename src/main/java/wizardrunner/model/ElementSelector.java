package wizardrunner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A selector string paired with its {@link SelectorType}.
 *
 * <p>Base type for the controls a wizard clicks outside of field filling
 * (start action, continue button, group save control).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ElementSelector {

    @JsonProperty("selector")
    private String selector;

    @JsonProperty("selector_type")
    private SelectorType selectorType = SelectorType.CSS;

    public ElementSelector() {}

    public ElementSelector(String selector, SelectorType selectorType) {
        this.selector = selector;
        this.selectorType = selectorType != null ? selectorType : SelectorType.CSS;
    }

    public static ElementSelector css(String selector)  { return new ElementSelector(selector, SelectorType.CSS); }
    public static ElementSelector id(String selector)   { return new ElementSelector(selector, SelectorType.ID); }
    public static ElementSelector text(String selector) { return new ElementSelector(selector, SelectorType.TEXT); }

    public String       getSelector()     { return selector; }
    public SelectorType getSelectorType() { return selectorType; }

    public void setSelector(String selector) { this.selector = selector; }
    public void setSelectorType(SelectorType selectorType) {
        this.selectorType = selectorType != null ? selectorType : SelectorType.CSS;
    }

    /**
     * Returns the selector ready for use: id selectors always carry the
     * {@code #} prefix whether or not the source document included it.
     */
    @JsonIgnore
    public String normalizedSelector() {
        return normalize(selector, selectorType);
    }

    static String normalize(String selector, SelectorType type) {
        if (selector == null) return null;
        String trimmed = selector.trim();
        if (type == SelectorType.ID && !trimmed.startsWith("#")) {
            return "#" + trimmed;
        }
        return trimmed;
    }

    @Override
    public String toString() {
        return String.format("%s='%s'", selectorType, normalizedSelector());
    }
}
