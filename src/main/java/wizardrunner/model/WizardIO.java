package wizardrunner.model;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads wizard structures, data schemas and user data from JSON.
 *
 * <p>Wizard structures are validated twice before they are handed out: first
 * against the bundled {@code wizard-structure-schema.json}, then against the
 * rules a schema cannot express (sequential page numbers, unique field ids,
 * well-formed groups). Every problem is reported in one
 * {@link WizardStructureException}.
 */
public class WizardIO {

    private static final Logger log = LoggerFactory.getLogger(WizardIO.class);
    private static final String STRUCTURE_SCHEMA_RESOURCE = "/wizard-structure-schema.json";

    /** Singleton ObjectMapper; thread-safe after configuration. */
    private static final ObjectMapper MAPPER;

    static {
        MAPPER = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /** Loaded once from classpath; null if the schema resource is missing. */
    private static volatile JsonSchema STRUCTURE_SCHEMA = null;

    private WizardIO() {}

    // ── Wizard structures ─────────────────────────────────────────────────

    /**
     * Reads and validates a {@link WizardStructure} from a JSON file.
     *
     * @throws IOException               if the file cannot be read
     * @throws WizardStructureException  if the document is invalid
     */
    public static WizardStructure readStructure(Path path) throws IOException {
        log.debug("Reading wizard structure from: {}", path);
        WizardStructure wizard = parseStructure(Files.readString(path), path.toString());
        log.info("Loaded wizard '{}' with {} page(s) from {}", wizard.getWizardId(),
                wizard.getPageCount(), path);
        return wizard;
    }

    /**
     * Parses and validates a {@link WizardStructure} from a JSON string.
     *
     * @throws WizardStructureException if the document is unparseable or invalid
     */
    public static WizardStructure parseStructure(String json, String source) {
        JsonNode tree;
        try {
            tree = MAPPER.readTree(json);
        } catch (IOException e) {
            throw new WizardStructureException("Cannot parse wizard structure " + source + ": "
                    + e.getMessage(), e);
        }

        List<String> problems = new ArrayList<>(schemaProblems(tree));
        if (!problems.isEmpty()) {
            throw new WizardStructureException(source, problems);
        }

        WizardStructure wizard;
        try {
            wizard = MAPPER.treeToValue(tree, WizardStructure.class);
        } catch (IOException e) {
            throw new WizardStructureException("Cannot map wizard structure " + source + ": "
                    + e.getMessage(), e);
        }

        problems.addAll(semanticProblems(wizard));
        if (!problems.isEmpty()) {
            throw new WizardStructureException(source, problems);
        }
        return wizard;
    }

    // ── Schemas and user data ─────────────────────────────────────────────

    /** Reads a data schema document as a JSON tree. */
    public static JsonNode readSchema(Path path) throws IOException {
        log.debug("Reading data schema from: {}", path);
        return MAPPER.readTree(Files.readString(path));
    }

    /** Reads a user data object from a JSON file. */
    public static UserData readUserData(Path path) throws IOException {
        log.debug("Reading user data from: {}", path);
        return MAPPER.readValue(Files.readString(path), UserData.class);
    }

    /** Parses a user data object from a JSON string. */
    public static UserData parseUserData(String json) throws IOException {
        return MAPPER.readValue(json, UserData.class);
    }

    /** Returns the shared ObjectMapper (for use in tests and other modules). */
    public static ObjectMapper getMapper() { return MAPPER; }

    // ── Validation ────────────────────────────────────────────────────────

    private static List<String> schemaProblems(JsonNode tree) {
        JsonSchema schema = getStructureSchema();
        if (schema == null) {
            log.warn("wizard-structure-schema.json not found on classpath; skipping schema validation");
            return List.of();
        }
        List<String> problems = new ArrayList<>();
        Set<ValidationMessage> errors = schema.validate(tree);
        for (ValidationMessage error : errors) {
            problems.add(error.getMessage());
        }
        return problems;
    }

    /** Rules the JSON schema cannot express. Package-private for tests. */
    static List<String> semanticProblems(WizardStructure wizard) {
        List<String> problems = new ArrayList<>();

        String url = wizard.getUrl();
        if (url == null || !(url.startsWith("http://") || url.startsWith("https://"))) {
            problems.add("url must start with http:// or https:// (got '" + url + "')");
        }

        List<WizardPage> pages = wizard.getPages();
        if (pages.isEmpty()) {
            problems.add("wizard declares no pages");
        }
        if (wizard.getTotalPages() != null && wizard.getTotalPages() != pages.size()) {
            problems.add("total_pages (" + wizard.getTotalPages() + ") does not match page count ("
                    + pages.size() + ")");
        }

        Set<String> seenIds = new HashSet<>();
        for (int i = 0; i < pages.size(); i++) {
            WizardPage page = pages.get(i);
            if (page.getPageNumber() != i + 1) {
                problems.add("page at position " + (i + 1) + " has page_number " + page.getPageNumber()
                        + "; page numbers must run 1.." + pages.size() + " in order");
            }
            if (page.getContinueButton() == null || isBlank(page.getContinueButton().getSelector())) {
                problems.add("page " + page.getPageNumber() + " has no continue_button selector");
            }
            for (WizardField field : page.getFields()) {
                if (!seenIds.add(field.getFieldId())) {
                    problems.add("duplicate field_id '" + field.getFieldId() + "'");
                }
                if (field.isGroup()) {
                    problems.addAll(groupProblems(field));
                }
            }
        }
        return problems;
    }

    private static List<String> groupProblems(WizardField field) {
        List<String> problems = new ArrayList<>();
        String id = field.getFieldId();
        if (field.getAddSelector() == null || isBlank(field.getAddSelector().getSelector())) {
            problems.add("group field '" + id + "' has no add_selector");
        }
        if (field.getSubFields().isEmpty()) {
            problems.add("group field '" + id + "' has no sub_fields");
        }
        Set<String> subIds = new HashSet<>();
        for (SubField sub : field.getSubFields()) {
            if (sub.getInteraction() == InteractionType.GROUP) {
                problems.add("sub-field '" + sub.getFieldId() + "' of group '" + id + "' cannot itself be a group");
            }
            if (!subIds.add(sub.getFieldId())) {
                problems.add("duplicate sub-field '" + sub.getFieldId() + "' in group '" + id + "'");
            }
        }
        Integer min = field.getMinItems();
        Integer max = field.getMaxItems();
        if (min != null && max != null && min > max) {
            problems.add("group field '" + id + "' has min_items " + min + " > max_items " + max);
        }
        return problems;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static JsonSchema getStructureSchema() {
        if (STRUCTURE_SCHEMA == null) {
            synchronized (WizardIO.class) {
                if (STRUCTURE_SCHEMA == null) {
                    try (InputStream is = WizardIO.class.getResourceAsStream(STRUCTURE_SCHEMA_RESOURCE)) {
                        if (is == null) {
                            log.warn("Schema resource not found: {}", STRUCTURE_SCHEMA_RESOURCE);
                            return null;
                        }
                        JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
                        STRUCTURE_SCHEMA = factory.getSchema(is);
                        log.debug("Wizard structure schema loaded from classpath: {}", STRUCTURE_SCHEMA_RESOURCE);
                    } catch (IOException e) {
                        log.warn("Failed to load wizard structure schema: {}", e.getMessage());
                    }
                }
            }
        }
        return STRUCTURE_SCHEMA;
    }
}
