package webqa.player;

import webqa.model.Run;
import webqa.model.VisualStatus;
import webqa.storage.ObjectKeys;
import webqa.storage.ObjectStore;

import org.openqa.selenium.WebDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Optional;

/**
 * Pixel-diff visual regression against baselines kept in an {@link ObjectStore}.
 *
 * <h3>Baseline lifecycle</h3>
 * <ul>
 *   <li>No baseline at {@code baselines/{run_identity}/{step}.png}: the current
 *       screenshot becomes the baseline and the check reports
 *       {@link VisualStatus#BASELINE_CREATED}, which never fails a run.</li>
 *   <li>Baseline present: compared pixel by pixel; {@code PASS} when the share
 *       of differing pixels is at most {@code threshold}, otherwise
 *       {@code FAIL} and the current screenshot is uploaded as the run's
 *       {@code visual_failure.png}.</li>
 * </ul>
 * Baselines are created with put-if-absent and never overwritten here.
 * The check only reads {@code run}'s identity and artifact path; recording
 * the result on the run is the caller's job.
 *
 * <p>If the object store cannot be read the check is skipped and reports
 * {@code N/A}: an unreachable store must not turn into a test failure.
 */
public class VisualRegression {

    private static final Logger log = LoggerFactory.getLogger(VisualRegression.class);

    /** Default maximum allowed pixel difference ratio (1%). */
    public static final double DEFAULT_THRESHOLD = 0.01;

    /** Default per-channel noise tolerance, absorbs anti-aliasing and font hinting. */
    public static final int DEFAULT_CHANNEL_TOLERANCE = 10;

    private static final String PNG = "image/png";

    private final ObjectStore store;
    private final double threshold;
    private final int channelTolerance;

    public VisualRegression(ObjectStore store) {
        this(store, DEFAULT_THRESHOLD, DEFAULT_CHANNEL_TOLERANCE);
    }

    public VisualRegression(ObjectStore store, double threshold, int channelTolerance) {
        this.store            = store;
        this.threshold        = threshold;
        this.channelTolerance = channelTolerance;
    }

    // ── Check ─────────────────────────────────────────────────────────────────

    /**
     * Screenshots the current page and checks it against the baseline for
     * ({@code run}'s identity, {@code stepName}).
     *
     * @return the check result; {@code status} is never null
     * @throws StepFailureException if the screenshot cannot be taken or decoded
     */
    public VisualCheckResult check(WebDriver driver, Run run, String stepName) {
        String identity    = ObjectKeys.runIdentity(run.getTestCaseId(), run.getDatasetName());
        String baselineKey = ObjectKeys.baseline(identity, stepName);
        byte[] currentPng  = Screenshots.capturePng(driver);

        Optional<byte[]> baseline;
        try {
            baseline = store.get(baselineKey);
            if (baseline.isEmpty()) {
                if (store.putIfAbsent(baselineKey, currentPng, PNG)) {
                    log.info("VisualRegression: baseline created for '{}' at {}", stepName, baselineKey);
                    return new VisualCheckResult(VisualStatus.BASELINE_CREATED, 0.0, threshold, baselineKey, null);
                }
                // Another worker created it between our read and write: compare against theirs.
                baseline = store.get(baselineKey);
            }
        } catch (IOException e) {
            log.error("VisualRegression: object store unavailable for {}, skipping check: {}",
                    baselineKey, e.getMessage());
            return new VisualCheckResult(VisualStatus.NOT_APPLICABLE, 0.0, threshold, baselineKey, null);
        }
        if (baseline.isEmpty()) {
            log.error("VisualRegression: baseline {} vanished during check, skipping", baselineKey);
            return new VisualCheckResult(VisualStatus.NOT_APPLICABLE, 0.0, threshold, baselineKey, null);
        }

        DiffResult diff;
        try {
            diff = pixelDiff(baseline.get(), currentPng, channelTolerance);
        } catch (IOException e) {
            throw new StepFailureException("Visual check for '" + stepName + "' could not decode images: "
                    + e.getMessage(), e);
        }
        log.info("VisualRegression: '{}' diff ratio = {} (threshold: {}, pixels: {}/{})",
                stepName, String.format("%.4f", diff.diffRatio()), String.format("%.4f", threshold),
                diff.diffPixels(), diff.totalPixels());

        if (diff.isPassed(threshold)) {
            return new VisualCheckResult(VisualStatus.PASS, diff.diffRatio(), threshold, baselineKey, null);
        }
        String artifactKey = uploadMismatch(run, currentPng);
        return new VisualCheckResult(VisualStatus.FAIL, diff.diffRatio(), threshold, baselineKey, artifactKey);
    }

    /** Uploads the mismatching screenshot; the caller records the returned key on the run. */
    private String uploadMismatch(Run run, byte[] currentPng) {
        String key = ObjectKeys.artifact(run.getArtifactsPath(), ObjectKeys.VISUAL_FAILURE);
        try {
            store.put(key, currentPng, PNG);
            log.info("VisualRegression: mismatch screenshot uploaded to {}", key);
            return key;
        } catch (IOException e) {
            log.warn("VisualRegression: could not upload mismatch screenshot {}: {}", key, e.getMessage());
            return null;
        }
    }

    // ── Pixel diff engine ─────────────────────────────────────────────────────

    /**
     * Performs a pixel-by-pixel comparison of two PNG byte arrays.
     *
     * <p>Pixels inside the common area differ when any RGB channel differs by
     * more than {@code channelTolerance}. When dimensions differ, every pixel
     * outside the common area counts as differing.
     */
    public static DiffResult pixelDiff(byte[] baselinePng, byte[] currentPng, int channelTolerance)
            throws IOException {
        BufferedImage baseline = ImageIO.read(new ByteArrayInputStream(baselinePng));
        BufferedImage current  = ImageIO.read(new ByteArrayInputStream(currentPng));

        if (baseline == null || current == null) {
            throw new IOException("Could not decode one or both PNG images");
        }

        int commonWidth  = Math.min(baseline.getWidth(),  current.getWidth());
        int commonHeight = Math.min(baseline.getHeight(), current.getHeight());
        long total = (long) Math.max(baseline.getWidth(), current.getWidth())
                * Math.max(baseline.getHeight(), current.getHeight());
        long diff  = total - (long) commonWidth * commonHeight;

        for (int y = 0; y < commonHeight; y++) {
            for (int x = 0; x < commonWidth; x++) {
                int bRgb = baseline.getRGB(x, y);
                int cRgb = current.getRGB(x, y);
                if (bRgb != cRgb && isSignificantDiff(bRgb, cRgb, channelTolerance)) {
                    diff++;
                }
            }
        }

        return new DiffResult(diff, total);
    }

    /**
     * Returns {@code true} if the two RGB values differ by more than the noise
     * tolerance on any channel.
     */
    private static boolean isSignificantDiff(int rgb1, int rgb2, int tolerance) {
        int dr = Math.abs(((rgb1 >> 16) & 0xFF) - ((rgb2 >> 16) & 0xFF));
        int dg = Math.abs(((rgb1 >>  8) & 0xFF) - ((rgb2 >>  8) & 0xFF));
        int db = Math.abs(( rgb1        & 0xFF) - ( rgb2        & 0xFF));
        return dr > tolerance || dg > tolerance || db > tolerance;
    }

    // ── Result records ─────────────────────────────────────────────────────────

    /** Result of a pixel diff comparison. */
    public record DiffResult(long diffPixels, long totalPixels) {
        /** Returns the fraction of pixels that differ (0.0 = identical, 1.0 = all different). */
        public double diffRatio() {
            return totalPixels == 0 ? 0.0 : (double) diffPixels / totalPixels;
        }
        public boolean isPassed(double threshold) { return diffRatio() <= threshold; }
    }

    /**
     * Outcome of {@link #check}.
     *
     * @param status      PASS, FAIL, BASELINE_CREATED, or N/A when the store was unreachable
     * @param diffRatio   share of differing pixels (0 when no comparison happened)
     * @param threshold   threshold the ratio was compared against
     * @param baselineKey object-store key of the baseline
     * @param artifactKey key of the uploaded mismatch screenshot, or null
     */
    public record VisualCheckResult(VisualStatus status, double diffRatio, double threshold,
                                    String baselineKey, String artifactKey) { }
}
