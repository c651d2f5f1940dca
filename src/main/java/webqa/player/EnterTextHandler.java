package webqa.player;

import webqa.model.Step;

import org.openqa.selenium.WebElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles {@code ENTER_TEXT} steps.
 *
 * <p>Strategy:
 * <ol>
 *   <li>Resolve the target and wait for it to be visible.</li>
 *   <li>Clear the existing value, then type {@code dataset[data_key]}
 *       (empty string when the key is absent).</li>
 *   <li>Log {@code [REDACTED]} instead of the value for password-like fields.</li>
 * </ol>
 */
public class EnterTextHandler implements ActionHandler {

    private static final Logger log = LoggerFactory.getLogger(EnterTextHandler.class);

    @Override
    public StepOutcome handle(Step step, StepContext ctx, LocatorResolver resolver) {
        String target = HandlerSupport.requireTarget(step);
        String value = ctx.dataset().valueFor(step.getDataKey());

        WebElement element = HandlerSupport.resolveVisible(target, ctx, resolver);

        String logValue = HandlerSupport.isSensitive(step.getDataKey(), target) ? "[REDACTED]" : value;
        log.info("Typing into '{}' (data_key={}) value: {}", target, step.getDataKey(), logValue);
        element.clear();
        element.sendKeys(value);
        return StepOutcome.passed(step);
    }
}
