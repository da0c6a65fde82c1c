package wizardrunner;

import com.fasterxml.jackson.databind.JsonNode;
import wizardrunner.model.WizardIO;
import wizardrunner.model.WizardStructure;

import java.io.IOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;

/**
 * Locates the wizard documents under {@code src/test/resources/wizards}.
 */
public final class Fixtures {

    public static final String TWO_PAGE = "two-page";
    public static final String LOAN_ESTIMATOR = "loan-estimator";

    private Fixtures() { }

    public static Path resource(String name) {
        URL url = Fixtures.class.getResource("/" + name);
        if (url == null) {
            throw new IllegalStateException("Test resource not found: " + name);
        }
        try {
            return Path.of(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    public static Path wizardsRoot() {
        return resource("wizards");
    }

    public static WizardStructure structure(String wizardId) throws IOException {
        return WizardIO.readStructure(wizardsRoot().resolve("wizard-structures").resolve(wizardId + ".json"));
    }

    public static JsonNode schema(String wizardId) throws IOException {
        return WizardIO.readSchema(wizardsRoot().resolve("data-schemas").resolve(wizardId + "-schema.json"));
    }
}
