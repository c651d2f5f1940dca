package webqa.player;

import webqa.model.Artifact;
import webqa.model.Run;
import webqa.model.Step;
import webqa.storage.ObjectKeys;
import webqa.storage.ObjectStore;

import org.openqa.selenium.WebDriver;
import org.openqa.selenium.logging.LogEntries;
import org.openqa.selenium.logging.LogEntry;
import org.openqa.selenium.logging.LogType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Uploads diagnostic artifacts when a run fails.
 *
 * <p>Artifacts land under the run's prefix:
 * <ul>
 *   <li>{@code failure.png}: screenshot of the page at the moment of failure</li>
 *   <li>{@code trace.zip}: {@code page-source.html}, {@code console.log} and
 *       {@code context.txt} (URL, timestamp, step, reason), when tracing is on</li>
 * </ul>
 * Capture happens at most once per run. Individual artifact failures are
 * logged as warnings and do not abort collection.
 */
public class ArtifactCapture {

    private static final Logger log = LoggerFactory.getLogger(ArtifactCapture.class);

    private static final DateTimeFormatter TIMESTAMP_FMT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private final ObjectStore store;
    private final boolean tracingEnabled;
    private final Clock clock;

    public ArtifactCapture(ObjectStore store, boolean tracingEnabled) {
        this(store, tracingEnabled, Clock.systemUTC());
    }

    public ArtifactCapture(ObjectStore store, boolean tracingEnabled, Clock clock) {
        this.store          = store;
        this.tracingEnabled = tracingEnabled;
        this.clock          = clock;
    }

    /**
     * Captures failure artifacts for {@code run}. Never throws.
     *
     * @param driver     live session, may be null when the browser never started
     * @param failedStep step that failed, or null for navigation failures
     * @param reason     failure reason written to the trace context
     */
    public void capture(WebDriver driver, Run run, Step failedStep, String reason) {
        if (!run.claimFailureCapture()) {
            log.debug("ArtifactCapture: artifacts already captured for {}", run);
            return;
        }
        if (driver == null) {
            log.warn("ArtifactCapture: no browser session for {}, nothing to capture", run);
            return;
        }
        log.info("ArtifactCapture: capturing failure artifacts under {}", run.getArtifactsPath());
        captureScreenshot(driver, run);
        if (tracingEnabled) {
            captureTrace(driver, run, failedStep, reason);
        }
    }

    // ── Private helpers ──────────────────────────────────────────────────

    private void captureScreenshot(WebDriver driver, Run run) {
        String key = ObjectKeys.artifact(run.getArtifactsPath(), ObjectKeys.FAILURE_SCREENSHOT);
        try {
            byte[] png = Screenshots.capturePng(driver);
            store.put(key, png, "image/png");
            run.addArtifact(new Artifact(key, Artifact.Kind.FAILURE_SCREENSHOT));
            log.info("ArtifactCapture: screenshot saved to {}", key);
        } catch (Exception e) {
            log.warn("ArtifactCapture: failed to capture screenshot: {}", e.getMessage());
        }
    }

    private void captureTrace(WebDriver driver, Run run, Step failedStep, String reason) {
        String key = ObjectKeys.artifact(run.getArtifactsPath(), ObjectKeys.TRACE);
        try {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            try (ZipOutputStream zip = new ZipOutputStream(buffer)) {
                String source = pageSource(driver);
                if (source != null) {
                    writeEntry(zip, "page-source.html", source);
                }
                List<String> console = consoleLines(driver);
                if (console != null) {
                    writeEntry(zip, "console.log", String.join("\n", console));
                }
                writeEntry(zip, "context.txt", context(driver, run, failedStep, reason));
            }
            store.put(key, buffer.toByteArray(), "application/zip");
            run.addArtifact(new Artifact(key, Artifact.Kind.TRACE));
            log.info("ArtifactCapture: trace saved to {}", key);
        } catch (Exception e) {
            log.warn("ArtifactCapture: failed to capture trace: {}", e.getMessage());
        }
    }

    private static void writeEntry(ZipOutputStream zip, String name, String content) throws IOException {
        zip.putNextEntry(new ZipEntry(name));
        zip.write(content.getBytes(StandardCharsets.UTF_8));
        zip.closeEntry();
    }

    private String pageSource(WebDriver driver) {
        try {
            String source = driver.getPageSource();
            if (source == null) {
                log.warn("ArtifactCapture: getPageSource() returned null, skipping page-source");
            }
            return source;
        } catch (Exception e) {
            log.warn("ArtifactCapture: failed to capture page source: {}", e.getMessage());
            return null;
        }
    }

    private List<String> consoleLines(WebDriver driver) {
        try {
            LogEntries entries = driver.manage().logs().get(LogType.BROWSER);
            if (entries == null) {
                return null;
            }
            List<String> lines = new ArrayList<>();
            for (LogEntry entry : entries) {
                lines.add(String.format("[%s] [%s] %s",
                        TIMESTAMP_FMT.format(Instant.ofEpochMilli(entry.getTimestamp())),
                        entry.getLevel(),
                        entry.getMessage()));
            }
            return lines;
        } catch (Exception e) {
            // GeckoDriver does not expose browser logs
            log.warn("ArtifactCapture: failed to capture console logs (driver may not support this): {}",
                    e.getMessage());
            return null;
        }
    }

    private String context(WebDriver driver, Run run, Step failedStep, String reason) {
        String url;
        try {
            url = driver.getCurrentUrl();
        } catch (Exception e) {
            log.debug("ArtifactCapture: current URL unavailable: {}", e.getMessage());
            url = "(unknown)";
        }
        String step = failedStep == null
                ? "(navigation)"
                : failedStep.getStepNumber() + " " + failedStep.getAction() + " '" + failedStep.getTargetElement() + "'";

        return String.join("\n",
                "=== WebQA Failure Context ===",
                "Captured at   : " + TIMESTAMP_FMT.format(clock.instant()),
                "Test case     : " + run.getTestCaseId(),
                "Dataset       : " + run.getDatasetName(),
                "Run id        : " + run.getRunId(),
                "Current URL   : " + url,
                "Step          : " + step,
                "Reason        : " + reason);
    }
}
