package wizardrunner.model;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Wizard documents stored on disk:
 * <pre>
 *   {root}/wizard-structures/{wizardId}.json
 *   {root}/data-schemas/{wizardId}-schema.json
 * </pre>
 */
public class WizardCatalog {

    private static final Logger log = LoggerFactory.getLogger(WizardCatalog.class);

    static final String STRUCTURES_DIR = "wizard-structures";
    static final String SCHEMAS_DIR    = "data-schemas";
    static final String SCHEMA_SUFFIX  = "-schema.json";

    /** Wizard ids become file names, so path separators and dots are refused. */
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9_-]+");

    private final Path root;

    public WizardCatalog(Path root) {
        this.root = root;
    }

    public Path getRoot() { return root; }

    /**
     * Summaries of every readable wizard, sorted by id. Unreadable or invalid
     * documents are skipped with a warning.
     */
    public List<WizardSummary> list() {
        Path dir = root.resolve(STRUCTURES_DIR);
        List<WizardSummary> summaries = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            log.warn("Wizard directory not found: {}", dir.toAbsolutePath());
            return summaries;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*.json")) {
            for (Path file : files) {
                try {
                    WizardStructure wizard = WizardIO.readStructure(file);
                    summaries.add(new WizardSummary(wizard.getWizardId(), wizard.getName(),
                            wizard.getUrl(), wizard.getPageCount(),
                            Files.exists(schemaPath(wizard.getWizardId()))));
                } catch (IOException | WizardStructureException | IllegalArgumentException e) {
                    log.warn("Skipping unreadable wizard file {}: {}", file.getFileName(), e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + dir, e);
        }
        summaries.sort(Comparator.comparing(WizardSummary::wizardId));
        return summaries;
    }

    /**
     * @throws WizardNotFoundException  if there is no structure file for the id
     * @throws WizardStructureException if the file is not a valid wizard
     */
    public WizardStructure loadStructure(String wizardId) throws IOException {
        Path file = structurePath(wizardId);
        if (!Files.isRegularFile(file)) {
            throw new WizardNotFoundException(wizardId, "wizard structure", file);
        }
        return WizardIO.readStructure(file);
    }

    /**
     * @throws WizardNotFoundException if there is no schema file for the id
     */
    public JsonNode loadSchema(String wizardId) throws IOException {
        Path file = schemaPath(wizardId);
        if (!Files.isRegularFile(file)) {
            throw new WizardNotFoundException(wizardId, "data schema", file);
        }
        return WizardIO.readSchema(file);
    }

    Path structurePath(String wizardId) {
        return root.resolve(STRUCTURES_DIR).resolve(checkId(wizardId) + ".json");
    }

    Path schemaPath(String wizardId) {
        return root.resolve(SCHEMAS_DIR).resolve(checkId(wizardId) + SCHEMA_SUFFIX);
    }

    private static String checkId(String wizardId) {
        if (wizardId == null || !SAFE_ID.matcher(wizardId).matches()) {
            throw new IllegalArgumentException("Invalid wizard id: '" + wizardId + "'");
        }
        return wizardId;
    }

    /** One line of {@link #list()}. */
    public record WizardSummary(String wizardId, String name, String url, int pageCount, boolean hasSchema) { }
}
