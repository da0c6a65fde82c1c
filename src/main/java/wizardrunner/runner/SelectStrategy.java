package wizardrunner.runner;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Ways of matching a data value to a dropdown option, in the order they are tried.
 */
public enum SelectStrategy {
    @JsonProperty("value")            VALUE(false, false),
    @JsonProperty("value_normalized") VALUE_NORMALIZED(false, true),
    @JsonProperty("label")            LABEL(true, false),
    @JsonProperty("label_normalized") LABEL_NORMALIZED(true, true);

    private final boolean byLabel;
    private final boolean normalized;

    SelectStrategy(boolean byLabel, boolean normalized) {
        this.byLabel = byLabel;
        this.normalized = normalized;
    }

    public boolean isByLabel()    { return byLabel; }
    public boolean isNormalized() { return normalized; }

    /** The string this strategy offers to the dropdown for {@code raw}. */
    String candidate(String raw) {
        return normalized ? Punctuation.normalize(raw) : raw;
    }

    void apply(Dropdown dropdown, String candidate) {
        if (byLabel) {
            dropdown.selectByLabel(candidate);
        } else {
            dropdown.selectByValue(candidate);
        }
    }

    String displayName() {
        return name().toLowerCase();
    }
}
