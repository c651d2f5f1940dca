package webqa.reporting;

import webqa.WorkerConfig;
import webqa.model.JobCodec;
import webqa.model.ParameterSet;
import webqa.model.RunStatus;
import webqa.model.VisualStatus;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Client for the run-record store.
 *
 * <ul>
 *   <li>{@code POST /results}: creates a run record and returns its {@code id}</li>
 *   <li>{@code PUT /results/{id}/final-status}: writes the outcome, retried a
 *       bounded number of times</li>
 * </ul>
 * Network failures and an unusable base URL are logged and reported through
 * the return value; no method throws.
 */
public class RunRecordClient {

    private static final Logger log = LoggerFactory.getLogger(RunRecordClient.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final ObjectMapper MAPPER = JobCodec.getMapper();

    static final String IDEMPOTENCY_HEADER = "Idempotency-Key";

    private final HttpUrl baseUrl;
    private final OkHttpClient httpClient;
    private final int maxAttempts;
    private final long retryDelayMs;

    /**
     * @param baseUrl      store root URL, e.g. {@code http://localhost:8002}
     * @param timeoutSec   connect/read/write timeout per call
     * @param maxAttempts  attempts for the final-status write (at least 1)
     * @param retryDelayMs pause between final-status attempts
     */
    public RunRecordClient(String baseUrl, int timeoutSec, int maxAttempts, long retryDelayMs) {
        this.baseUrl      = parseBaseUrl(baseUrl, "RunRecordClient");
        this.maxAttempts  = Math.max(1, maxAttempts);
        this.retryDelayMs = Math.max(0, retryDelayMs);
        this.httpClient   = new OkHttpClient.Builder()
                .connectTimeout(timeoutSec, TimeUnit.SECONDS)
                .readTimeout(timeoutSec, TimeUnit.SECONDS)
                .writeTimeout(timeoutSec, TimeUnit.SECONDS)
                .build();
    }

    public static RunRecordClient fromConfig(WorkerConfig config) {
        return new RunRecordClient(config.getResultsUrl(), config.getHttpTimeoutSec(),
                config.getFinalStatusMaxAttempts(), config.getFinalStatusRetryDelayMs());
    }

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Creates a run record.
     *
     * @param idempotencyKey sent as {@code Idempotency-Key} so a redelivered job
     *                       can be deduplicated by the store
     * @return the new record's id, or empty on any failure
     */
    public Optional<String> createRun(String objective, String testCaseId, ParameterSet parameters,
                                      String idempotencyKey) {
        if (baseUrl == null) {
            log.error("RunRecordClient: no usable run-record store URL, cannot create run for '{}'", testCaseId);
            return Optional.empty();
        }
        ObjectNode body = MAPPER.createObjectNode();
        body.put("objective", objective);
        body.put("test_case_id", testCaseId);
        body.set("parameters", MAPPER.valueToTree(parameters));

        try (Response response = httpClient.newCall(new Request.Builder()
                .url(baseUrl.newBuilder().addPathSegment("results").build())
                .header(IDEMPOTENCY_HEADER, idempotencyKey)
                .header("Accept", "application/json")
                .post(RequestBody.create(body.toString(), JSON))
                .build()).execute()) {
            String responseBody = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                log.error("RunRecordClient: create run for '{}' failed with HTTP {}: {}",
                        testCaseId, response.code(), responseBody);
                return Optional.empty();
            }
            JsonNode id = MAPPER.readTree(responseBody).path("id");
            if (id.isMissingNode() || id.isNull() || id.asText().isBlank()) {
                log.error("RunRecordClient: create run response missing 'id': {}", responseBody);
                return Optional.empty();
            }
            log.info("RunRecordClient: run record {} created for '{}' [{}]",
                    id.asText(), testCaseId, parameters.getDatasetName());
            return Optional.of(id.asText());
        } catch (IOException e) {
            log.error("RunRecordClient: create run for '{}' failed: {}", testCaseId, e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.error("RunRecordClient: create run for '{}' failed unexpectedly: {}", testCaseId, e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * Writes the run's final outcome. Network errors and 5xx responses are
     * retried; a 4xx response is final.
     *
     * @return {@code true} once the store accepted the write
     */
    public boolean updateFinalStatus(String runId, RunStatus status, VisualStatus visualStatus,
                                     String failureReason) {
        if (baseUrl == null) {
            log.error("RunRecordClient: no usable run-record store URL, final status {} / {} of run {} lost "
                    + "(reason: {})", status, visualStatus, runId, failureReason);
            return false;
        }
        if (runId == null || runId.isBlank()) {
            log.error("RunRecordClient: final status {} / {} has no run id (reason: {})",
                    status, visualStatus, failureReason);
            return false;
        }
        ObjectNode body = MAPPER.createObjectNode();
        body.put("status", status.name());
        body.put("visual_status", visualStatus.wireValue());
        if (failureReason == null) {
            body.putNull("failure_reason");
        } else {
            body.put("failure_reason", failureReason);
        }

        Request request = new Request.Builder()
                .url(finalStatusUrl(runId))
                .put(RequestBody.create(body.toString(), JSON))
                .build();

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try (Response response = httpClient.newCall(request).execute()) {
                if (response.isSuccessful()) {
                    log.info("RunRecordClient: final status {} / {} written for run {}",
                            status, visualStatus, runId);
                    return true;
                }
                if (response.code() < 500) {
                    log.error("RunRecordClient: final status {} / {} for run {} rejected with HTTP {}, "
                            + "not retrying (reason: {})", status, visualStatus, runId, response.code(), failureReason);
                    return false;
                }
                log.warn("RunRecordClient: final status for run {} rejected with HTTP {} (attempt {}/{})",
                        runId, response.code(), attempt, maxAttempts);
            } catch (IOException e) {
                log.warn("RunRecordClient: final status for run {} failed (attempt {}/{}): {}",
                        runId, attempt, maxAttempts, e.getMessage());
            } catch (RuntimeException e) {
                log.error("RunRecordClient: final status for run {} failed unexpectedly: {}",
                        runId, e.getMessage(), e);
                return false;
            }
            if (attempt < maxAttempts && !pause()) {
                break;
            }
        }
        log.error("RunRecordClient: giving up on final status for run {} ({} / {}, reason: {})",
                runId, status, visualStatus, failureReason);
        return false;
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    /** The run id is a single path segment, percent-encoded. */
    HttpUrl finalStatusUrl(String runId) {
        return baseUrl.newBuilder()
                .addPathSegment("results")
                .addPathSegment(runId)
                .addPathSegment("final-status")
                .build();
    }

    private boolean pause() {
        try {
            Thread.sleep(retryDelayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /** Parses a collaborator base URL; logs and returns null when it is not an http(s) URL. */
    static HttpUrl parseBaseUrl(String url, String client) {
        HttpUrl parsed = url == null ? null : HttpUrl.parse(url.strip());
        if (parsed == null) {
            log.error("{}: base URL '{}' is not a valid http(s) URL, calls will be skipped", client, url);
        }
        return parsed;
    }
}
