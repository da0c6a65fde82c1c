package wizardrunner.model;

import java.nio.file.Path;

/**
 * No wizard structure or data schema exists for the requested wizard id.
 */
public class WizardNotFoundException extends RuntimeException {

    private final String wizardId;

    public WizardNotFoundException(String wizardId, String what, Path expected) {
        super("No " + what + " for wizard '" + wizardId + "' (expected " + expected + ")");
        this.wizardId = wizardId;
    }

    public String getWizardId() { return wizardId; }
}
