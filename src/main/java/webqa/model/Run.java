package webqa.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * In-process state of one (test case, parameter set) execution.
 *
 * <p>Status moves {@code RUNNING → PASS | FAIL} once; later transitions are
 * ignored so the first failure reason is the one reported. Visual status is
 * folded with {@link VisualStatus#merge}.
 *
 * <p>A run is confined to the worker thread that owns the job; it is not
 * thread-safe.
 */
public class Run {

    private String runId;
    private final String testCaseId;
    private final String datasetName;
    private final boolean liveView;
    private final String artifactsPath;

    private RunStatus status = RunStatus.RUNNING;
    private VisualStatus visualStatus = VisualStatus.NOT_APPLICABLE;
    private String failureReason;
    private boolean failureCaptured;

    private final List<Artifact> artifacts = new ArrayList<>();

    public Run(String runId, String testCaseId, String datasetName, boolean liveView, String artifactsPath) {
        this.runId         = runId;
        this.testCaseId    = testCaseId;
        this.datasetName   = datasetName;
        this.liveView      = liveView;
        this.artifactsPath = artifactsPath;
    }

    // ── Getters ──────────────────────────────────────────────────────────

    public String       getRunId()         { return runId; }
    public String       getTestCaseId()    { return testCaseId; }
    public String       getDatasetName()   { return datasetName; }
    public boolean      isLiveView()       { return liveView; }
    public String       getArtifactsPath() { return artifactsPath; }
    public RunStatus    getStatus()        { return status; }
    public VisualStatus getVisualStatus()  { return visualStatus; }
    public String       getFailureReason() { return failureReason; }

    public List<Artifact> getArtifacts() {
        return Collections.unmodifiableList(artifacts);
    }

    /** Keys of the visual-diff artifacts uploaded for this run. */
    public List<String> getVisualArtifacts() {
        return artifacts.stream()
                .filter(a -> a.kind() == Artifact.Kind.VISUAL_DIFF)
                .map(Artifact::key)
                .toList();
    }

    public boolean hasRunId() {
        return runId != null && !runId.isBlank();
    }

    /** Set once the run record has been created in the run-record store. */
    public void assignRunId(String runId) {
        this.runId = runId;
    }

    // ── Transitions ──────────────────────────────────────────────────────

    /**
     * Moves the run to {@code FAIL}.
     *
     * @return {@code true} if this call performed the transition
     */
    public boolean fail(String reason) {
        if (status.isTerminal()) return false;
        status = RunStatus.FAIL;
        failureReason = reason;
        return true;
    }

    public void recordVisualStatus(VisualStatus result) {
        visualStatus = visualStatus.merge(result);
    }

    /**
     * Folds in one visual check. A mismatch screenshot key is kept as the
     * run's single {@code VISUAL_DIFF} artifact.
     */
    public void recordVisualCheck(VisualStatus result, String diffKey) {
        recordVisualStatus(result);
        if (diffKey != null && !hasArtifact(Artifact.Kind.VISUAL_DIFF)) {
            addArtifact(new Artifact(diffKey, Artifact.Kind.VISUAL_DIFF));
        }
    }

    /**
     * Settles a run whose steps all completed. Passes unless a visual check
     * failed; a run without visual checks reports visual {@code PASS}.
     */
    public void complete() {
        if (status.isTerminal()) return;
        if (visualStatus == VisualStatus.FAIL) {
            fail("Visual regression detected");
            return;
        }
        if (visualStatus == VisualStatus.NOT_APPLICABLE) {
            visualStatus = VisualStatus.PASS;
        }
        status = RunStatus.PASS;
    }

    public void addArtifact(Artifact artifact) {
        artifacts.add(artifact);
    }

    /**
     * Claims the one failure-artifact capture this run is allowed.
     *
     * @return {@code true} the first time only
     */
    public boolean claimFailureCapture() {
        if (failureCaptured) return false;
        failureCaptured = true;
        return true;
    }

    public boolean hasArtifact(Artifact.Kind kind) {
        return artifacts.stream().anyMatch(a -> a.kind() == kind);
    }

    @Override
    public String toString() {
        return String.format("Run{id=%s, testCase='%s', dataset='%s', status=%s, visual=%s}",
                runId, testCaseId, datasetName, status, visualStatus);
    }
}
