package wizardrunner.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Declarative description of one wizard: where it starts, the ordered pages
 * and their fields, and where the results are on the terminal page.
 *
 * <p>Produced by the discovery side and loaded through {@link WizardIO};
 * treated as read-only for the duration of an execution.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WizardStructure {

    @JsonProperty("wizard_id")
    private String wizardId;

    @JsonProperty("name")
    @JsonAlias("wizard_name")
    private String name;

    @JsonProperty("url")
    private String url;

    /** Optional redundancy check against {@code pages.size()}. */
    @JsonProperty("total_pages")
    private Integer totalPages;

    @JsonProperty("start_action")
    private StartAction startAction;

    @JsonProperty("pages")
    private List<WizardPage> pages = new ArrayList<>();

    @JsonProperty("results")
    private ResultsDeclaration results;

    public WizardStructure() {}

    // ── Getters ──────────────────────────────────────────────────────────

    public String             getWizardId()    { return wizardId; }
    public String             getName()        { return name; }
    public String             getUrl()         { return url; }
    public Integer            getTotalPages()  { return totalPages; }
    public StartAction        getStartAction() { return startAction; }
    public List<WizardPage>   getPages()       { return pages; }
    public ResultsDeclaration getResults()     { return results; }

    // ── Setters ──────────────────────────────────────────────────────────

    public void setWizardId(String wizardId)            { this.wizardId = wizardId; }
    public void setName(String name)                    { this.name = name; }
    public void setUrl(String url)                      { this.url = url; }
    public void setTotalPages(Integer totalPages)       { this.totalPages = totalPages; }
    public void setStartAction(StartAction startAction) { this.startAction = startAction; }
    public void setResults(ResultsDeclaration results)  { this.results = results; }
    public void setPages(List<WizardPage> pages) {
        this.pages = pages != null ? new ArrayList<>(pages) : new ArrayList<>();
    }

    // ── Convenience ──────────────────────────────────────────────────────

    @JsonIgnore
    public int getPageCount() {
        return pages.size();
    }

    /** The results declaration, or the whole-page default when none was given. */
    @JsonIgnore
    public ResultsDeclaration effectiveResults() {
        return results != null ? results : ResultsDeclaration.wholePage();
    }

    /** Finds a top-level field by id across all pages. */
    public Optional<WizardField> findField(String fieldId) {
        for (WizardPage page : pages) {
            for (WizardField field : page.getFields()) {
                if (field.getFieldId() != null && field.getFieldId().equals(fieldId)) {
                    return Optional.of(field);
                }
            }
        }
        return Optional.empty();
    }

    /** All fields marked required, in page order. */
    @JsonIgnore
    public List<WizardField> getRequiredFields() {
        List<WizardField> required = new ArrayList<>();
        for (WizardPage page : pages) {
            for (WizardField field : page.getFields()) {
                if (field.isRequired()) required.add(field);
            }
        }
        return required;
    }

    @Override
    public String toString() {
        return String.format("WizardStructure{id='%s', pages=%d, url='%s'}", wizardId, pages.size(), url);
    }
}
