package wizardrunner.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wizardrunner.model.UserData;
import wizardrunner.model.WizardIO;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks user data against a draft-07 data schema before any browser work.
 *
 * <p>All violations are collected. Required properties missing at the top
 * level become {@link MissingField}s carrying the schema's description and
 * pattern; every other violation becomes an {@link InvalidField} carrying the
 * offending value and the expected constraint. {@link #validate} never throws:
 * an unusable schema is itself reported as an invalid entry.
 */
public class SchemaValidator {

    private static final Logger log = LoggerFactory.getLogger(SchemaValidator.class);

    /** Matches one segment of a legacy JSON path: {@code .name}, {@code ['name']} or {@code [3]}. */
    private static final Pattern PATH_SEGMENT =
            Pattern.compile("\\.([^.\\[]+)|\\['([^']*)'\\]|\\[(\\d+)\\]");

    private static final String SCHEMA_FIELD = "(schema)";

    private final JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
    private final ObjectMapper mapper = WizardIO.getMapper();

    /**
     * Validates {@code userData} against {@code schema}.
     *
     * @param schema   the data schema (draft-07 JSON Schema)
     * @param userData values keyed by field id
     * @return every violation found; never {@code null}
     */
    public ValidationResult validate(JsonNode schema, UserData userData) {
        JsonNode data = mapper.valueToTree(userData != null ? userData.asMap() : Map.of());
        try {
            List<MissingField> missing = missingFields(schema, data);
            Set<String> missingIds = new HashSet<>();
            missing.forEach(m -> missingIds.add(m.getFieldId()));

            JsonSchema compiled = factory.getSchema(schema);
            Set<ValidationMessage> messages = compiled.validate(data);

            List<InvalidField> invalid = new ArrayList<>();
            List<ValidationMessage> ordered = new ArrayList<>(messages);
            ordered.sort(Comparator.comparing(ValidationMessage::getPath)
                    .thenComparing(ValidationMessage::getType));
            for (ValidationMessage message : ordered) {
                List<Object> path = parsePath(message.getPath());
                if (path.isEmpty()) {
                    // Root-level violations (required, additionalProperties) carry no field path
                    if (!"required".equals(message.getType())) {
                        invalid.add(new InvalidField("$", "$", null, message.getType(), null, message.getMessage()));
                    }
                    continue;
                }
                String fieldId = String.valueOf(path.get(0));
                if (missingIds.contains(fieldId)) {
                    continue;
                }
                invalid.add(toInvalidField(fieldId, message, path, schema, data));
            }

            ValidationResult result = new ValidationResult(missing, invalid);
            if (result.isValid()) {
                log.info("User data validation passed ({} field(s))", data.size());
            } else {
                log.warn("User data validation failed; {} missing, {} invalid",
                        missing.size(), invalid.size());
            }
            return result;
        } catch (Exception e) {
            log.error("Data schema could not be applied: {}", e.getMessage(), e);
            return new ValidationResult(List.of(), List.of(new InvalidField(
                    SCHEMA_FIELD, "$", null, "schema", null,
                    "Schema could not be applied: " + e.getMessage())));
        }
    }

    // ── Missing fields ───────────────────────────────────────────────────

    private List<MissingField> missingFields(JsonNode schema, JsonNode data) {
        List<MissingField> missing = new ArrayList<>();
        JsonNode required = schema.path("required");
        if (!required.isArray()) return missing;

        for (JsonNode idNode : required) {
            String fieldId = idNode.asText();
            JsonNode value = data.get(fieldId);
            if (value != null && !value.isNull()) continue;

            JsonNode prop = schema.path("properties").path(fieldId);
            missing.add(new MissingField(
                    fieldId,
                    textOrDefault(prop.get("description"), "No description"),
                    textOrNull(prop.get("type")),
                    textOrNull(prop.get("pattern")),
                    prop.get("enum"),
                    prop.get("examples")));
        }
        return missing;
    }

    // ── Invalid fields ───────────────────────────────────────────────────

    private InvalidField toInvalidField(String fieldId, ValidationMessage message, List<Object> path,
                                        JsonNode schema, JsonNode data) {
        String keyword = message.getType();
        JsonNode provided = nodeAt(data, path);
        JsonNode subSchema = schemaAt(schema, path);
        return new InvalidField(
                fieldId,
                message.getPath(),
                provided.isMissingNode() ? null : provided,
                keyword,
                describeConstraint(keyword, subSchema),
                message.getMessage());
    }

    /** Renders the constraint named by {@code keyword} from the sub-schema that failed. */
    static String describeConstraint(String keyword, JsonNode subSchema) {
        if (subSchema == null || subSchema.isMissingNode()) return null;
        return switch (keyword) {
            case "pattern"   -> "pattern " + subSchema.path("pattern").asText();
            case "enum"      -> "one of " + subSchema.path("enum");
            case "const"     -> "exactly " + subSchema.path("const");
            case "type"      -> "type " + (subSchema.get("type") != null ? subSchema.get("type").toString().replace("\"", "") : "?");
            case "minimum"   -> ">= " + subSchema.path("minimum").asText();
            case "maximum"   -> "<= " + subSchema.path("maximum").asText();
            case "minLength" -> "length >= " + subSchema.path("minLength").asText();
            case "maxLength" -> "length <= " + subSchema.path("maxLength").asText();
            case "minItems"  -> "at least " + subSchema.path("minItems").asText() + " item(s)";
            case "maxItems"  -> "at most " + subSchema.path("maxItems").asText() + " item(s)";
            case "format"    -> "format " + subSchema.path("format").asText();
            case "required"  -> "required " + subSchema.path("required");
            default          -> null;
        };
    }

    // ── Path helpers ─────────────────────────────────────────────────────

    /** Splits {@code $.loans[1].amount} into {@code ["loans", 1, "amount"]}. */
    static List<Object> parsePath(String path) {
        List<Object> segments = new ArrayList<>();
        if (path == null || !path.startsWith("$")) return segments;
        Matcher m = PATH_SEGMENT.matcher(path.substring(1));
        while (m.find()) {
            if (m.group(1) != null)      segments.add(m.group(1));
            else if (m.group(2) != null) segments.add(m.group(2));
            else                         segments.add(Integer.parseInt(m.group(3)));
        }
        return segments;
    }

    private static JsonNode nodeAt(JsonNode root, List<Object> path) {
        JsonNode node = root;
        for (Object segment : path) {
            node = segment instanceof Integer i ? node.path(i) : node.path((String) segment);
        }
        return node;
    }

    private static JsonNode schemaAt(JsonNode schema, List<Object> path) {
        JsonNode node = schema;
        for (Object segment : path) {
            if (node == null || node.isMissingNode()) return MissingNode.getInstance();
            node = segment instanceof Integer ? node.path("items") : node.path("properties").path((String) segment);
        }
        return node;
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : (node.isTextual() ? node.asText() : node.toString());
    }

    private static String textOrDefault(JsonNode node, String fallback) {
        String text = textOrNull(node);
        return text != null ? text : fallback;
    }
}
