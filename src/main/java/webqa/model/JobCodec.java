package webqa.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Set;

/**
 * Decodes queue messages into {@link TestCaseJob} objects.
 *
 * <p>Every message is validated against {@code job-schema.json} before binding,
 * so missing required keys surface as a {@link MalformedJobException} listing
 * each violation rather than as a null halfway through a run.
 */
public final class JobCodec {

    private static final Logger log = LoggerFactory.getLogger(JobCodec.class);
    private static final String SCHEMA_RESOURCE = "/job-schema.json";

    /** Singleton ObjectMapper, thread-safe after configuration. */
    private static final ObjectMapper MAPPER;

    static {
        MAPPER = new ObjectMapper()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /** Loaded once from classpath; null if the schema resource is missing. */
    private static volatile JsonSchema jobSchema = null;

    private JobCodec() {}

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Parses, validates and binds a job message.
     *
     * @param json raw message body
     * @return the decoded job
     * @throws MalformedJobException if the body is not valid JSON, violates the
     *                               schema, or cannot be bound
     */
    public static TestCaseJob decode(String json) throws MalformedJobException {
        if (json == null || json.isBlank()) {
            throw new MalformedJobException("Empty job message");
        }

        JsonNode tree;
        try {
            tree = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedJobException("Job message is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (tree == null || !tree.isObject()) {
            throw new MalformedJobException("Job message must be a JSON object");
        }

        validateSchema(tree);

        try {
            TestCaseJob job = MAPPER.treeToValue(tree, TestCaseJob.class);
            log.debug("Decoded {}", job);
            return job;
        } catch (JsonProcessingException e) {
            throw new MalformedJobException("Job message cannot be bound: " + e.getOriginalMessage(), e);
        }
    }

    /** Serializes a job, used by tests and tooling that enqueue jobs. */
    public static String encode(TestCaseJob job) throws IOException {
        return MAPPER.writeValueAsString(job);
    }

    /** Returns the shared ObjectMapper (for HTTP payloads and tests). */
    public static ObjectMapper getMapper() { return MAPPER; }

    // ── Schema validation ─────────────────────────────────────────────────

    private static void validateSchema(JsonNode tree) throws MalformedJobException {
        JsonSchema schema = getSchema();
        if (schema == null) {
            log.warn("job-schema.json not found on classpath, skipping schema validation");
            return;
        }
        Set<ValidationMessage> errors = schema.validate(tree);
        if (!errors.isEmpty()) {
            StringBuilder sb = new StringBuilder("Job message failed schema validation:");
            errors.forEach(e -> sb.append("\n  ").append(e.getMessage()));
            throw new MalformedJobException(sb.toString());
        }
    }

    private static JsonSchema getSchema() {
        if (jobSchema == null) {
            synchronized (JobCodec.class) {
                if (jobSchema == null) {
                    try (InputStream is = JobCodec.class.getResourceAsStream(SCHEMA_RESOURCE)) {
                        if (is == null) {
                            log.warn("Schema resource not found: {}", SCHEMA_RESOURCE);
                            return null;
                        }
                        JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
                        jobSchema = factory.getSchema(is);
                        log.debug("Job schema loaded from classpath: {}", SCHEMA_RESOURCE);
                    } catch (IOException e) {
                        log.warn("Failed to load job schema: {}", e.getMessage());
                    }
                }
            }
        }
        return jobSchema;
    }
}
