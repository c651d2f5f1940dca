package webqa.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One instruction of a test case. Steps run strictly in list order.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Step {

    @JsonProperty("step_number")
    private int stepNumber;

    @JsonProperty("action")
    private StepAction action;

    @JsonProperty("target_element")
    private String targetElement;

    @JsonProperty("data_key")
    private String dataKey;

    @JsonProperty("verifications")
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<Verification> verifications = new ArrayList<>();

    public Step() {}

    public Step(int stepNumber, StepAction action, String targetElement) {
        this.stepNumber    = stepNumber;
        this.action        = action;
        this.targetElement = targetElement;
    }

    // ── Getters ──────────────────────────────────────────────────────────

    public int                getStepNumber()    { return stepNumber; }
    public StepAction         getAction()        { return action; }
    public String             getTargetElement() { return targetElement; }
    public String             getDataKey()       { return dataKey; }
    public List<Verification> getVerifications() {
        return verifications == null ? List.of() : Collections.unmodifiableList(verifications);
    }

    // ── Setters ──────────────────────────────────────────────────────────

    public void setStepNumber(int n)                  { this.stepNumber = n; }
    public void setAction(StepAction action)          { this.action = action; }
    public void setTargetElement(String target)       { this.targetElement = target; }
    public void setDataKey(String dataKey)            { this.dataKey = dataKey; }
    public void setVerifications(List<Verification> v) {
        this.verifications = v != null ? new ArrayList<>(v) : new ArrayList<>();
    }

    // ── Convenience ──────────────────────────────────────────────────────

    public Step withDataKey(String key) {
        this.dataKey = key;
        return this;
    }

    public Step verifying(String targetElement) {
        if (verifications == null) verifications = new ArrayList<>();
        verifications.add(new Verification(targetElement));
        return this;
    }

    public boolean hasVerifications() {
        return verifications != null && !verifications.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("Step{#%d %s '%s'}", stepNumber, action, targetElement);
    }
}
