package wizardrunner.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The control that advances a wizard page once its fields are filled.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ContinueButton extends ElementSelector {

    /** Button caption as shown to the user, informational only. */
    @JsonProperty("text")
    private String text;

    public ContinueButton() {}

    public ContinueButton(String selector, SelectorType selectorType) {
        super(selector, selectorType);
    }

    public String getText()            { return text; }
    public void   setText(String text) { this.text = text; }
}
