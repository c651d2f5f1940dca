package webqa;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Reads {@code config.properties} from the classpath and exposes typed worker
 * configuration values with sensible defaults.
 *
 * <p>All values can be overridden by placing a {@code config.local.properties}
 * file on the classpath (higher priority, not committed to VCS).
 */
public class WorkerConfig {

    private static final Logger log = LoggerFactory.getLogger(WorkerConfig.class);

    private static final String CONFIG_FILE       = "config.properties";
    private static final String CONFIG_LOCAL_FILE = "config.local.properties";

    /** Worker flavour: which queue it consumes and whether the browser is headed. */
    public enum Mode { STANDARD, LIVE_VIEW }

    // Property keys
    public static final String KEY_MODE               = "worker.mode";
    public static final String KEY_BROWSER            = "player.browser";
    static final String        KEY_EXPLICIT_WAIT      = "player.explicit.wait.sec";
    static final String        KEY_PAGE_LOAD_TIMEOUT  = "player.page.load.timeout.sec";
    static final String        KEY_STEP_TIMEOUT       = "player.step.timeout.sec";
    static final String        KEY_LIVE_STEP_DELAY    = "player.live.view.step.delay.ms";
    static final String        KEY_TRACING_ENABLED    = "player.tracing.enabled";
    static final String        KEY_VISUAL_THRESHOLD   = "visual.threshold";
    static final String        KEY_VISUAL_TOLERANCE   = "visual.channel.tolerance";
    static final String        KEY_STORAGE_ROOT       = "storage.root";
    static final String        KEY_RESULTS_URL        = "reporting.results.url";
    static final String        KEY_REALTIME_URL       = "reporting.realtime.url";
    static final String        KEY_HTTP_TIMEOUT       = "reporting.http.timeout.sec";
    static final String        KEY_FINAL_MAX_ATTEMPTS = "reporting.final.status.max.attempts";
    static final String        KEY_FINAL_RETRY_DELAY  = "reporting.final.status.retry.delay.ms";
    public static final String KEY_BOOTSTRAP_SERVERS  = "queue.bootstrap.servers";
    static final String        KEY_GROUP_ID           = "queue.group.id";
    static final String        KEY_TOPIC_STANDARD     = "queue.topic.standard";
    static final String        KEY_TOPIC_LIVE         = "queue.topic.live";
    static final String        KEY_RECONNECT_BACKOFF  = "queue.reconnect.backoff.ms";
    static final String        KEY_POLL_TIMEOUT       = "queue.poll.timeout.ms";
    static final String        KEY_MAX_POLL_INTERVAL  = "queue.max.poll.interval.ms";
    static final String        KNOWN_ELEMENT_PREFIX   = "locator.known.";

    // Defaults
    private static final String  DEFAULT_BROWSER            = "chrome";
    private static final int     DEFAULT_EXPLICIT_WAIT      = 10;
    private static final int     DEFAULT_PAGE_LOAD_TIMEOUT  = 60;
    private static final int     DEFAULT_STEP_TIMEOUT       = 120;
    private static final long    DEFAULT_LIVE_STEP_DELAY    = 50L;
    private static final boolean DEFAULT_TRACING_ENABLED    = true;
    private static final double  DEFAULT_VISUAL_THRESHOLD   = 0.01;
    private static final int     DEFAULT_VISUAL_TOLERANCE   = 10;
    private static final String  DEFAULT_STORAGE_ROOT       = "object-store";
    private static final String  DEFAULT_RESULTS_URL        = "http://localhost:8002";
    private static final String  DEFAULT_REALTIME_URL       = "http://localhost:8003";
    private static final int     DEFAULT_HTTP_TIMEOUT       = 10;
    private static final int     DEFAULT_FINAL_MAX_ATTEMPTS = 3;
    private static final long    DEFAULT_FINAL_RETRY_DELAY  = 1000L;
    private static final String  DEFAULT_BOOTSTRAP_SERVERS  = "localhost:9092";
    private static final String  DEFAULT_GROUP_ID           = "execution-agents";
    private static final String  DEFAULT_TOPIC_STANDARD     = "execution_queue";
    private static final String  DEFAULT_TOPIC_LIVE         = "live_execution_queue";
    private static final long    DEFAULT_RECONNECT_BACKOFF  = 5000L;
    private static final long    DEFAULT_POLL_TIMEOUT       = 1000L;
    private static final int     DEFAULT_MAX_POLL_INTERVAL  = 1_800_000;

    private final Properties props;

    /**
     * Loads configuration from the classpath.
     * {@code config.local.properties} values override {@code config.properties}.
     *
     * @throws IllegalStateException if the base config.properties cannot be loaded
     */
    public WorkerConfig() {
        props = new Properties();

        // Load base config, required
        try (InputStream base = getClass().getClassLoader()
                .getResourceAsStream(CONFIG_FILE)) {
            if (base == null) {
                throw new IOException("Classpath resource not found: " + CONFIG_FILE);
            }
            props.load(base);
            log.debug("Loaded base config from {}", CONFIG_FILE);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load " + CONFIG_FILE, e);
        }

        // Load local overrides, optional
        try (InputStream local = getClass().getClassLoader()
                .getResourceAsStream(CONFIG_LOCAL_FILE)) {
            if (local != null) {
                props.load(local);
                log.debug("Applied local overrides from {}", CONFIG_LOCAL_FILE);
            }
        } catch (IOException e) {
            log.warn("Failed to read {}, using base config only: {}", CONFIG_LOCAL_FILE, e.getMessage());
        }
    }

    /** Package-private constructor for tests: accepts an already-populated {@link Properties}. */
    WorkerConfig(Properties props) {
        this.props = props;
    }

    /** Creates a config from explicit properties, used by tests in other packages. */
    public static WorkerConfig of(Properties props) {
        return new WorkerConfig(props);
    }

    /** Overrides a single value at runtime (CLI options take precedence over files). */
    public void override(String key, String value) {
        if (value != null && !value.isBlank()) {
            props.setProperty(key, value.trim());
        }
    }

    // ── Worker ─────────────────────────────────────────────────────────────

    /** Worker mode (default: STANDARD). Accepts {@code standard} or {@code live-view}. */
    public Mode getMode() {
        String raw = props.getProperty(KEY_MODE);
        if (raw == null || raw.isBlank()) return Mode.STANDARD;
        String normalized = raw.trim().toUpperCase().replace('-', '_');
        try {
            return Mode.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid worker mode '{}', using STANDARD", raw);
            return Mode.STANDARD;
        }
    }

    public boolean isLiveViewMode() {
        return getMode() == Mode.LIVE_VIEW;
    }

    // ── Player ─────────────────────────────────────────────────────────────

    /** Browser to launch: chrome, firefox or edge (default: chrome). */
    public String getBrowser() {
        return props.getProperty(KEY_BROWSER, DEFAULT_BROWSER).trim().toLowerCase();
    }

    /** Explicit visibility wait in seconds (default: 10). */
    public int getExplicitWaitSec() {
        return getInt(KEY_EXPLICIT_WAIT, DEFAULT_EXPLICIT_WAIT);
    }

    /** Page-load timeout in seconds (default: 60). */
    public int getPageLoadTimeoutSec() {
        return getInt(KEY_PAGE_LOAD_TIMEOUT, DEFAULT_PAGE_LOAD_TIMEOUT);
    }

    /** Upper bound for one step, navigation included (default: 120). */
    public Duration getStepTimeout() {
        return Duration.ofSeconds(getInt(KEY_STEP_TIMEOUT, DEFAULT_STEP_TIMEOUT));
    }

    /** Pause between steps in live-view mode so a watcher can follow (default: 50). */
    public long getLiveViewStepDelayMs() {
        return getLong(KEY_LIVE_STEP_DELAY, DEFAULT_LIVE_STEP_DELAY);
    }

    /** Whether a trace bundle is uploaded with failure artifacts (default: true). */
    public boolean isTracingEnabled() {
        return getBool(KEY_TRACING_ENABLED, DEFAULT_TRACING_ENABLED);
    }

    // ── Visual regression ─────────────────────────────────────────────────

    /** Maximum fraction of differing pixels still considered a match (default: 0.01). */
    public double getVisualThreshold() {
        return getDouble(KEY_VISUAL_THRESHOLD, DEFAULT_VISUAL_THRESHOLD);
    }

    /** Per-channel difference (0-255) below which a pixel counts as equal (default: 10). */
    public int getVisualChannelTolerance() {
        return getInt(KEY_VISUAL_TOLERANCE, DEFAULT_VISUAL_TOLERANCE);
    }

    /** Root directory of the file-system object store (default: "object-store"). */
    public String getStorageRoot() {
        return props.getProperty(KEY_STORAGE_ROOT, DEFAULT_STORAGE_ROOT).trim();
    }

    /**
     * Extra well-known elements declared as {@code locator.known.<LogicalName>=<css>}.
     * Merged over the built-in table by the locator resolver.
     */
    public Map<String, String> getKnownElements() {
        Map<String, String> known = new LinkedHashMap<>();
        for (String key : props.stringPropertyNames()) {
            if (key.startsWith(KNOWN_ELEMENT_PREFIX) && key.length() > KNOWN_ELEMENT_PREFIX.length()) {
                String css = props.getProperty(key);
                if (css != null && !css.isBlank()) {
                    known.put(key.substring(KNOWN_ELEMENT_PREFIX.length()), css.trim());
                }
            }
        }
        return known;
    }

    // ── Reporting ─────────────────────────────────────────────────────────

    public String getResultsUrl() {
        return props.getProperty(KEY_RESULTS_URL, DEFAULT_RESULTS_URL).trim();
    }

    public String getRealtimeUrl() {
        return props.getProperty(KEY_REALTIME_URL, DEFAULT_REALTIME_URL).trim();
    }

    /** Connect/read/write timeout for collaborator HTTP calls (default: 10). */
    public int getHttpTimeoutSec() {
        return getInt(KEY_HTTP_TIMEOUT, DEFAULT_HTTP_TIMEOUT);
    }

    /** Attempts for the final-status write before giving up (default: 3). */
    public int getFinalStatusMaxAttempts() {
        return Math.max(1, getInt(KEY_FINAL_MAX_ATTEMPTS, DEFAULT_FINAL_MAX_ATTEMPTS));
    }

    public long getFinalStatusRetryDelayMs() {
        return getLong(KEY_FINAL_RETRY_DELAY, DEFAULT_FINAL_RETRY_DELAY);
    }

    // ── Queue ─────────────────────────────────────────────────────────────

    public String getBootstrapServers() {
        return props.getProperty(KEY_BOOTSTRAP_SERVERS, DEFAULT_BOOTSTRAP_SERVERS).trim();
    }

    public String getGroupId() {
        return props.getProperty(KEY_GROUP_ID, DEFAULT_GROUP_ID).trim();
    }

    public String getStandardTopic() {
        return props.getProperty(KEY_TOPIC_STANDARD, DEFAULT_TOPIC_STANDARD).trim();
    }

    public String getLiveViewTopic() {
        return props.getProperty(KEY_TOPIC_LIVE, DEFAULT_TOPIC_LIVE).trim();
    }

    /** Topic this worker consumes, chosen by {@link #getMode()}. */
    public String getTopic() {
        return isLiveViewMode() ? getLiveViewTopic() : getStandardTopic();
    }

    /** Fixed delay between broker reconnection attempts (default: 5000). */
    public long getReconnectBackoffMs() {
        return getLong(KEY_RECONNECT_BACKOFF, DEFAULT_RECONNECT_BACKOFF);
    }

    public Duration getPollTimeout() {
        return Duration.ofMillis(getLong(KEY_POLL_TIMEOUT, DEFAULT_POLL_TIMEOUT));
    }

    /** Longest time a single job may take before the broker reassigns it (default: 30 min). */
    public int getMaxPollIntervalMs() {
        return getInt(KEY_MAX_POLL_INTERVAL, DEFAULT_MAX_POLL_INTERVAL);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private int getInt(String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private long getLong(String key, long defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid long for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private double getDouble(String key, double defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid number for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private boolean getBool(String key, boolean defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        return Boolean.parseBoolean(raw.trim());
    }
}
