package webqa.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A queued test case: what to open, which elements exist, which datasets to
 * run and which steps to execute.
 *
 * <p>Decoded by {@link JobCodec}. Collections are exposed read-only; the job is
 * treated as immutable once it leaves the queue.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TestCaseJob {

    @JsonProperty("test_case_id")
    private String testCaseId;

    @JsonProperty("objective")
    private String objective;

    @JsonProperty("target_url")
    private String targetUrl;

    @JsonProperty("is_live_view")
    private boolean liveView;

    @JsonProperty("ui_blueprint")
    private List<BlueprintElement> uiBlueprint = new ArrayList<>();

    @JsonProperty("parameters")
    private List<ParameterSet> parameters = new ArrayList<>();

    @JsonProperty("steps")
    private List<Step> steps = new ArrayList<>();

    /** Run record id pre-assigned by the dispatcher; may be null. */
    @JsonProperty("run_id")
    private String runId;

    public TestCaseJob() {}

    // ── Getters ──────────────────────────────────────────────────────────

    public String  getTestCaseId() { return testCaseId; }
    public String  getObjective()  { return objective; }
    public String  getTargetUrl()  { return targetUrl; }
    public boolean isLiveView()    { return liveView; }
    public String  getRunId()      { return runId; }

    public List<BlueprintElement> getUiBlueprint() {
        return uiBlueprint == null ? List.of() : Collections.unmodifiableList(uiBlueprint);
    }

    public List<ParameterSet> getParameters() {
        return parameters == null ? List.of() : Collections.unmodifiableList(parameters);
    }

    public List<Step> getSteps() {
        return steps == null ? List.of() : Collections.unmodifiableList(steps);
    }

    // ── Setters ──────────────────────────────────────────────────────────

    public void setTestCaseId(String id)      { this.testCaseId = id; }
    public void setObjective(String o)        { this.objective = o; }
    public void setTargetUrl(String url)      { this.targetUrl = url; }
    public void setLiveView(boolean liveView) { this.liveView = liveView; }
    public void setRunId(String runId)        { this.runId = runId; }

    public void setUiBlueprint(List<BlueprintElement> b) {
        this.uiBlueprint = b != null ? new ArrayList<>(b) : new ArrayList<>();
    }

    public void setParameters(List<ParameterSet> p) {
        this.parameters = p != null ? new ArrayList<>(p) : new ArrayList<>();
    }

    public void setSteps(List<Step> s) {
        this.steps = s != null ? new ArrayList<>(s) : new ArrayList<>();
    }

    // ── Convenience ──────────────────────────────────────────────────────

    /**
     * Parameter sets to execute. A job without parameters still runs once,
     * against {@link ParameterSet#defaultSet()}.
     */
    public List<ParameterSet> effectiveParameters() {
        if (parameters == null || parameters.isEmpty()) {
            return List.of(ParameterSet.defaultSet());
        }
        return getParameters();
    }

    @Override
    public String toString() {
        return String.format("TestCaseJob{id='%s', url='%s', datasets=%d, steps=%d, liveView=%b, runId=%s}",
                testCaseId, targetUrl, effectiveParameters().size(), getSteps().size(), liveView, runId);
    }
}
