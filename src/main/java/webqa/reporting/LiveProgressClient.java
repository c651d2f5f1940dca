package webqa.reporting;

import webqa.WorkerConfig;

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
import java.util.concurrent.TimeUnit;

/**
 * Fire-and-forget client for the live-progress channel: per-run updates on
 * {@code POST /update/{run_id}} and global notifications on
 * {@code POST /notify/broadcast}. Failures are logged, never thrown.
 */
public class LiveProgressClient {

    private static final Logger log = LoggerFactory.getLogger(LiveProgressClient.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final HttpUrl baseUrl;
    private final OkHttpClient httpClient;

    public LiveProgressClient(String baseUrl, int timeoutSec) {
        this.baseUrl    = RunRecordClient.parseBaseUrl(baseUrl, "LiveProgressClient");
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(timeoutSec, TimeUnit.SECONDS)
                .readTimeout(timeoutSec, TimeUnit.SECONDS)
                .writeTimeout(timeoutSec, TimeUnit.SECONDS)
                .build();
    }

    public static LiveProgressClient fromConfig(WorkerConfig config) {
        return new LiveProgressClient(config.getRealtimeUrl(), config.getHttpTimeoutSec());
    }

    /** @return {@code true} if the channel accepted the update */
    public boolean sendUpdate(String runId, ObjectNode message) {
        return post(message, "update", runId);
    }

    /** @return {@code true} if the channel accepted the notification */
    public boolean broadcast(ObjectNode message) {
        return post(message, "notify", "broadcast");
    }

    private boolean post(ObjectNode message, String... segments) {
        String path = "/" + String.join("/", segments);
        if (baseUrl == null) {
            log.warn("LiveProgressClient: no usable channel URL, dropping POST {}", path);
            return false;
        }
        try {
            HttpUrl.Builder url = baseUrl.newBuilder();
            for (String segment : segments) {
                url.addPathSegment(segment);
            }
            Request request = new Request.Builder()
                    .url(url.build())
                    .post(RequestBody.create(message.toString(), JSON))
                    .build();
            try (Response response = httpClient.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    log.warn("LiveProgressClient: POST {} failed with HTTP {}", path, response.code());
                    return false;
                }
                log.debug("LiveProgressClient: POST {} {}", path, message.path("type").asText());
                return true;
            }
        } catch (IOException | RuntimeException e) {
            log.warn("LiveProgressClient: POST {} failed: {}", path, e.getMessage());
            return false;
        }
    }
}
