package webqa.player;

import webqa.model.Step;

/**
 * Strategy interface implemented by every step-action handler.
 *
 * <p>Handlers are stateless; all context (driver, wait, blueprint, dataset,
 * run) is supplied per call so the same handler instance serves every run.
 */
public interface ActionHandler {

    /**
     * Executes {@code step}.
     *
     * @param step     the step to execute
     * @param ctx      live session and job data
     * @param resolver resolves logical names to selectors
     * @return the outcome of a completed step
     * @throws StepFailureException if the step cannot be completed
     */
    StepOutcome handle(Step step, StepContext ctx, LocatorResolver resolver);
}
