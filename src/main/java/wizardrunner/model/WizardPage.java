package wizardrunner.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * One page of a wizard: fields filled in declared order, then the continue
 * control is clicked.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WizardPage {

    @JsonProperty("page_number")
    private int pageNumber;

    @JsonProperty("page_title")
    private String pageTitle;

    @JsonProperty("url_pattern")
    private String urlPattern;

    @JsonProperty("fields")
    private List<WizardField> fields = new ArrayList<>();

    @JsonProperty("continue_button")
    private ContinueButton continueButton;

    public WizardPage() {}

    public WizardPage(int pageNumber, ContinueButton continueButton, List<WizardField> fields) {
        this.pageNumber = pageNumber;
        this.continueButton = continueButton;
        setFields(fields);
    }

    public int               getPageNumber()     { return pageNumber; }
    public String            getPageTitle()      { return pageTitle; }
    public String            getUrlPattern()     { return urlPattern; }
    public List<WizardField> getFields()         { return fields; }
    public ContinueButton    getContinueButton() { return continueButton; }

    public void setPageNumber(int pageNumber)             { this.pageNumber = pageNumber; }
    public void setPageTitle(String pageTitle)            { this.pageTitle = pageTitle; }
    public void setUrlPattern(String urlPattern)          { this.urlPattern = urlPattern; }
    public void setContinueButton(ContinueButton button)  { this.continueButton = button; }
    public void setFields(List<WizardField> fields) {
        this.fields = fields != null ? new ArrayList<>(fields) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return String.format("WizardPage{%d '%s', fields=%d}", pageNumber,
                pageTitle != null ? pageTitle : "", fields.size());
    }
}
