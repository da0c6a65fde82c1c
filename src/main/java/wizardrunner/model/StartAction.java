package wizardrunner.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Optional control clicked once after navigation to open the wizard.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StartAction extends ElementSelector {

    @JsonProperty("description")
    private String description;

    public StartAction() {}

    public StartAction(String selector, SelectorType selectorType) {
        super(selector, selectorType);
    }

    public String getDescription()             { return description; }
    public void   setDescription(String desc)  { this.description = desc; }
}
