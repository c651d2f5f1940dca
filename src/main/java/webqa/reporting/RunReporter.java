package webqa.reporting;

import webqa.model.JobCodec;
import webqa.model.ParameterSet;
import webqa.model.Run;
import webqa.model.RunStatus;
import webqa.model.Step;
import webqa.model.TestCaseJob;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes run lifecycle events to the run-record store and, for live-view
 * runs, to the live-progress channel.
 *
 * <table>
 *   <caption>Events</caption>
 *   <tr><th>When</th><th>Run-record store</th><th>Live progress</th></tr>
 *   <tr><td>run start</td><td>create record if the run has no id</td><td>{@code run_start} (live view)</td></tr>
 *   <tr><td>step</td><td>-</td><td>{@code step_result} (live view)</td></tr>
 *   <tr><td>run end</td><td>final status</td><td>{@code run_end} (live view), broadcast</td></tr>
 * </table>
 *
 * Reporting failures are logged by the clients and never change a run's status.
 */
public class RunReporter {

    private static final Logger log = LoggerFactory.getLogger(RunReporter.class);
    private static final ObjectMapper MAPPER = JobCodec.getMapper();

    private final RunRecordClient records;
    private final LiveProgressClient live;

    public RunReporter(RunRecordClient records, LiveProgressClient live) {
        this.records = records;
        this.live    = live;
    }

    /**
     * Ensures the run has a record id, then announces the run in live view.
     *
     * @param deliveryId identifies the queue delivery; a redelivered message
     *                   reuses its record, a new submission gets a new one
     */
    public void runStarted(Run run, TestCaseJob job, ParameterSet parameters, String deliveryId) {
        if (!run.hasRunId()) {
            String key = idempotencyKey(job, parameters, deliveryId);
            records.createRun(job.getObjective(), job.getTestCaseId(), parameters, key)
                    .ifPresent(run::assignRunId);
            if (!run.hasRunId()) {
                log.warn("RunReporter: no run record for {}, results will not be persisted", run);
            }
        }
        if (!run.isLiveView() || !run.hasRunId()) return;

        ObjectNode msg = message("run_start");
        msg.put("status", RunStatus.RUNNING.name());
        msg.put("test_case_id", run.getTestCaseId());
        msg.put("dataset", run.getDatasetName());
        ArrayNode steps = msg.putArray("steps");
        for (Step step : job.getSteps()) {
            ObjectNode s = steps.addObject();
            s.put("step_number", step.getStepNumber());
            s.put("action", step.getAction() == null ? null : step.getAction().name());
            s.put("target_element", step.getTargetElement());
        }
        live.sendUpdate(run.getRunId(), msg);
    }

    /** Live view only: reports a step moving to RUNNING, PASS or FAIL. */
    public void stepStatus(Run run, Step step, RunStatus status, String reason) {
        if (!run.isLiveView() || !run.hasRunId()) return;

        ObjectNode msg = message("step_result");
        msg.put("step", step.getStepNumber());
        msg.put("action", step.getAction() == null ? null : step.getAction().name());
        msg.put("target_element", step.getTargetElement());
        msg.put("status", status.name());
        if (reason != null) msg.put("reason", reason);
        live.sendUpdate(run.getRunId(), msg);
    }

    /** Persists the final outcome and notifies listeners. */
    public void runFinished(Run run) {
        if (run.hasRunId()) {
            records.updateFinalStatus(run.getRunId(), run.getStatus(), run.getVisualStatus(),
                    run.getFailureReason());
        } else {
            log.error("RunReporter: cannot persist final status of {} without a run id (reason: {})",
                    run, run.getFailureReason());
        }

        if (run.isLiveView() && run.hasRunId()) {
            ObjectNode end = message("run_end");
            end.put("status", run.getStatus().name());
            end.put("visual_status", run.getVisualStatus().wireValue());
            end.put("reason", run.getFailureReason());
            live.sendUpdate(run.getRunId(), end);
        }

        ObjectNode note = message("final_status");
        note.put("run_id", run.getRunId());
        note.put("test_case_id", run.getTestCaseId());
        note.put("dataset", run.getDatasetName());
        note.put("status", run.getStatus().name());
        note.put("visual_status", run.getVisualStatus().wireValue());
        note.put("failure_reason", run.getFailureReason());
        live.broadcast(note);
    }

    static String idempotencyKey(TestCaseJob job, ParameterSet parameters, String deliveryId) {
        return job.getTestCaseId() + ":" + parameters.getDatasetName() + ":" + deliveryId;
    }

    private static ObjectNode message(String type) {
        ObjectNode msg = MAPPER.createObjectNode();
        msg.put("type", type);
        return msg;
    }
}
