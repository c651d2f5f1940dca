package webqa.player;

import webqa.model.Step;
import webqa.model.VisualStatus;

import java.util.Locale;

/**
 * Handles {@code VISUAL_VALIDATION} steps by delegating to
 * {@link VisualRegression}, using the step's target element as the baseline
 * name. The status travels back in the {@link StepOutcome}; a mismatch fails
 * the step with a {@link VisualMismatchException} carrying the result.
 */
public class VisualValidationHandler implements ActionHandler {

    private final VisualRegression visualRegression;

    public VisualValidationHandler(VisualRegression visualRegression) {
        this.visualRegression = visualRegression;
    }

    @Override
    public StepOutcome handle(Step step, StepContext ctx, LocatorResolver resolver) {
        String stepName = HandlerSupport.requireTarget(step);
        ctx.waits().waitForPageLoad();

        VisualRegression.VisualCheckResult result = visualRegression.check(ctx.driver(), ctx.run(), stepName);

        if (result.status() == VisualStatus.FAIL) {
            throw new VisualMismatchException(String.format(Locale.ROOT,
                    "Visual mismatch on '%s': %.2f%% of pixels differ (threshold %.2f%%)",
                    stepName, result.diffRatio() * 100, result.threshold() * 100), result);
        }
        return StepOutcome.visual(step, result.status());
    }
}
