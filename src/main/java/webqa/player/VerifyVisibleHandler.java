package webqa.player;

import webqa.model.Step;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Handles {@code VERIFY_ELEMENT_VISIBLE} steps: resolve and assert visibility, nothing else. */
public class VerifyVisibleHandler implements ActionHandler {

    private static final Logger log = LoggerFactory.getLogger(VerifyVisibleHandler.class);

    @Override
    public StepOutcome handle(Step step, StepContext ctx, LocatorResolver resolver) {
        String target = HandlerSupport.requireTarget(step);
        HandlerSupport.resolveVisible(target, ctx, resolver);
        log.info("'{}' is visible", target);
        return StepOutcome.passed(step);
    }
}
