package healrun.model;

import com.fasterxml.jackson.core.type.TypeReference;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads and writes the JSON documents exchanged with the generator and the
 * reporting layer: generated test cases, execution policies, explicit suite
 * assignments, execution plans and execution results.
 *
 * <p>Test-case files are validated against {@code testcases-schema.json}
 * before deserialization.
 */
public final class PlanIO {

    private static final Logger log = LoggerFactory.getLogger(PlanIO.class);
    private static final String CASES_SCHEMA_RESOURCE = "/testcases-schema.json";

    /** Singleton ObjectMapper, thread-safe after configuration. */
    private static final ObjectMapper MAPPER;

    static {
        MAPPER = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    private static volatile JsonSchema casesSchema;

    private PlanIO() {}

    // ── Test cases ────────────────────────────────────────────────────────

    /**
     * Reads generated test cases from a JSON file holding either an array of
     * cases or an object with a {@code cases} array.
     *
     * @throws IOException          if the file cannot be read or parsed
     * @throws PlanFormatException  if the document violates the test-case schema
     */
    public static List<TestCase> readCases(Path path) throws IOException {
        log.debug("Reading test cases from: {}", path);
        JsonNode root = MAPPER.readTree(Files.readString(path));
        JsonNode casesNode = root.isObject() && root.has("cases") ? root.get("cases") : root;
        validateCases(casesNode, path.toString());
        List<TestCase> cases = MAPPER.convertValue(casesNode, new TypeReference<List<TestCase>>() {});
        log.info("Loaded {} test case(s) from {}", cases.size(), path);
        return cases;
    }

    public static List<TestCase> casesFromJson(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        JsonNode casesNode = root.isObject() && root.has("cases") ? root.get("cases") : root;
        validateCases(casesNode, "<inline>");
        return MAPPER.convertValue(casesNode, new TypeReference<List<TestCase>>() {});
    }

    // ── Policy & assignments ──────────────────────────────────────────────

    /**
     * Reads an {@link ExecutionPolicy}. Accepts the bare policy object or a
     * rules document with an {@code execution} section.
     */
    public static ExecutionPolicy readPolicy(Path path) throws IOException {
        return policyFromJson(Files.readString(path));
    }

    public static ExecutionPolicy policyFromJson(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        if (root == null || root.isNull() || root.isMissingNode()) {
            return ExecutionPolicy.smart();
        }
        if (!root.isObject()) {
            throw new PlanFormatException("Execution policy must be a JSON object");
        }
        JsonNode node = root.has("execution") ? root.get("execution") : root;
        return MAPPER.convertValue(node, ExecutionPolicy.class);
    }

    /** Reads a {@code caseName -> suiteName} map. */
    public static Map<String, String> readAssignments(Path path) throws IOException {
        JsonNode root = MAPPER.readTree(Files.readString(path));
        if (root == null || !root.isObject()) {
            throw new PlanFormatException("Suite assignments must be a JSON object of caseName -> suiteName");
        }
        return MAPPER.convertValue(root, new TypeReference<LinkedHashMap<String, String>>() {});
    }

    // ── Plans & results ───────────────────────────────────────────────────

    public static void writePlan(ExecutionPlan plan, Path path) throws IOException {
        createParent(path);
        MAPPER.writeValue(path.toFile(), plan);
        log.info("Wrote execution plan ({} suite(s), {} case(s)) to {}",
                plan.suites().size(), plan.totalCases(), path);
    }

    public static void writeResults(List<ExecutionResult> results, Path path) throws IOException {
        createParent(path);
        MAPPER.writeValue(path.toFile(), results);
        log.info("Wrote {} execution result(s) to {}", results.size(), path);
    }

    public static List<ExecutionResult> readResults(Path path) throws IOException {
        return MAPPER.readValue(path.toFile(), new TypeReference<List<ExecutionResult>>() {});
    }

    // ── Schema validation ─────────────────────────────────────────────────

    private static void validateCases(JsonNode casesNode, String source) {
        JsonSchema schema = getCasesSchema();
        if (schema == null) {
            log.warn("testcases-schema.json not found on classpath — skipping schema validation");
            return;
        }
        Set<ValidationMessage> errors = schema.validate(casesNode);
        if (!errors.isEmpty()) {
            StringBuilder sb = new StringBuilder("Schema validation failed for ").append(source).append(":\n");
            errors.forEach(e -> sb.append("  ").append(e.getMessage()).append("\n"));
            throw new PlanFormatException(sb.toString());
        }
    }

    private static JsonSchema getCasesSchema() {
        if (casesSchema == null) {
            synchronized (PlanIO.class) {
                if (casesSchema == null) {
                    try (InputStream is = PlanIO.class.getResourceAsStream(CASES_SCHEMA_RESOURCE)) {
                        if (is == null) {
                            log.warn("Schema resource not found: {}", CASES_SCHEMA_RESOURCE);
                            return null;
                        }
                        JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
                        casesSchema = factory.getSchema(is);
                        log.debug("JSON schema loaded from classpath: {}", CASES_SCHEMA_RESOURCE);
                    } catch (IOException e) {
                        log.warn("Failed to load schema: {}", e.getMessage());
                    }
                }
            }
        }
        return casesSchema;
    }

    private static void createParent(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    // ── Exceptions ────────────────────────────────────────────────────────

    /** Input document is structurally invalid. */
    public static class PlanFormatException extends RuntimeException {
        public PlanFormatException(String msg) { super(msg); }
    }
}
