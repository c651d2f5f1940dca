package webqa.storage;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Builds object-store keys for baselines and run artifacts.
 *
 * <pre>
 * baselines/{run_identity}/{step_name}.png
 * runs/{test_case_id}/{dataset_slug}-{timestamp}/failure.png | trace.zip | visual_failure.png
 * </pre>
 *
 * Every path segment is sanitised to {@code [A-Za-z0-9_-]}.
 */
public final class ObjectKeys {

    public static final String FAILURE_SCREENSHOT = "failure.png";
    public static final String TRACE              = "trace.zip";
    public static final String VISUAL_FAILURE     = "visual_failure.png";

    private static final DateTimeFormatter SLUG_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss.SSS'Z'").withZone(ZoneOffset.UTC);

    private ObjectKeys() { }

    /** Stable identity shared by every execution of a (test case, dataset) pair. */
    public static String runIdentity(String testCaseId, String datasetName) {
        return sanitize(testCaseId) + "-" + sanitize(datasetName);
    }

    public static String baseline(String runIdentity, String stepName) {
        return "baselines/" + sanitize(runIdentity) + "/" + sanitize(stepName) + ".png";
    }

    /**
     * Artifact prefix for one run. Computed once when the run starts so that
     * every artifact of that run lands under the same directory, while a
     * redelivered job gets a fresh one.
     */
    public static String runPrefix(String testCaseId, String datasetName, Clock clock) {
        return "runs/" + sanitize(testCaseId) + "/"
                + sanitize(datasetName) + "-" + SLUG_TIMESTAMP.format(clock.instant()).replace('.', '_');
    }

    public static String artifact(String runPrefix, String fileName) {
        return runPrefix + "/" + fileName;
    }

    public static String sanitize(String value) {
        if (value == null || value.isBlank()) return "_";
        return value.trim().replaceAll("[^a-zA-Z0-9_\\-]", "_");
    }
}
