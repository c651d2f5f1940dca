package webqa.player;

import webqa.model.Step;
import webqa.model.Verification;

import org.openqa.selenium.WebElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles {@code CLICK} steps.
 *
 * <p>Strategy:
 * <ol>
 *   <li>Resolve the target and wait for it to be visible.</li>
 *   <li>Perform the native {@link WebElement#click()}.</li>
 *   <li>Wait for the page to settle. With verifications attached this is
 *       mandatory and every verification element must then be visible; a click
 *       that does not lead to the asserted state fails the step.</li>
 * </ol>
 */
public class ClickHandler implements ActionHandler {

    private static final Logger log = LoggerFactory.getLogger(ClickHandler.class);

    @Override
    public StepOutcome handle(Step step, StepContext ctx, LocatorResolver resolver) {
        String target = HandlerSupport.requireTarget(step);
        WebElement element = HandlerSupport.resolveVisible(target, ctx, resolver);
        log.info("Clicking '{}'", target);
        element.click();

        if (!step.hasVerifications()) {
            try {
                ctx.waits().waitForPageLoad();
            } catch (NavigationTimeoutException e) {
                log.warn("Page still loading after clicking '{}', continuing: {}", target, e.getMessage());
            }
            return StepOutcome.passed(step);
        }

        ctx.waits().waitForPageLoad();
        for (Verification v : step.getVerifications()) {
            verify(target, v, ctx, resolver);
        }
        return StepOutcome.passed(step);
    }

    private void verify(String clicked, Verification v, StepContext ctx, LocatorResolver resolver) {
        if (!v.isElementVisible()) {
            throw new StepFailureException("Unsupported verification type '" + v.getType()
                    + "' after clicking '" + clicked + "'");
        }
        String expected = v.getTargetElement();
        if (expected == null || expected.isBlank()) {
            throw new StepFailureException("Verification after clicking '" + clicked + "' has no target_element");
        }
        try {
            HandlerSupport.resolveVisible(expected, ctx, resolver);
            log.info("Verified '{}' visible after clicking '{}'", expected, clicked);
        } catch (StepFailureException e) {
            throw new StepFailureException(String.format(
                    "Verification failed after clicking '%s': expected element '%s' to be visible (%s)",
                    clicked, expected, e.getMessage()), e);
        }
    }
}
