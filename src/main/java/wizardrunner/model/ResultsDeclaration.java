package wizardrunner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Where the results live on the terminal page, as declared by whoever
 * recorded the wizard. Named selectors are extracted in declaration order;
 * {@code wholePage} adds the full body text.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResultsDeclaration {

    @JsonProperty("whole_page")
    private boolean wholePage;

    @JsonProperty("fields")
    private Map<String, ElementSelector> fields = new LinkedHashMap<>();

    public ResultsDeclaration() {}

    /** Declaration equivalent to having none: the whole page text. */
    public static ResultsDeclaration wholePage() {
        ResultsDeclaration d = new ResultsDeclaration();
        d.setWholePage(true);
        return d;
    }

    public boolean                      isWholePage() { return wholePage; }
    public Map<String, ElementSelector> getFields()   { return fields; }

    public void setWholePage(boolean wholePage) { this.wholePage = wholePage; }
    public void setFields(Map<String, ElementSelector> fields) {
        this.fields = fields != null ? new LinkedHashMap<>(fields) : new LinkedHashMap<>();
    }

    /** True when the body text belongs in the payload. */
    @JsonIgnore
    public boolean includesBodyText() {
        return wholePage || fields.isEmpty();
    }
}
