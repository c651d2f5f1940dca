package webqa.player;

import webqa.model.Step;
import webqa.model.StepAction;
import webqa.model.VisualStatus;

/**
 * Result of a step that completed. Failures are reported by throwing a
 * {@link StepFailureException} instead.
 *
 * @param stepNumber   number of the step
 * @param action       action performed
 * @param visualStatus outcome of the visual check, {@code N/A} for functional steps
 */
public record StepOutcome(int stepNumber, StepAction action, VisualStatus visualStatus) {

    public static StepOutcome passed(Step step) {
        return new StepOutcome(step.getStepNumber(), step.getAction(), VisualStatus.NOT_APPLICABLE);
    }

    public static StepOutcome visual(Step step, VisualStatus status) {
        return new StepOutcome(step.getStepNumber(), step.getAction(), status);
    }
}
