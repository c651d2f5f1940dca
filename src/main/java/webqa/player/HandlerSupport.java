package webqa.player;

import webqa.model.ElementLocator;
import webqa.model.Step;

import org.openqa.selenium.WebElement;

import java.util.Locale;

/**
 * Static helpers shared across {@link ActionHandler} implementations.
 *
 * <p>Centralises the resolve-then-wait pattern:
 * <pre>
 *   ElementLocator locator = resolver.resolve(name, blueprint);
 *   WebElement el = wait.waitForVisible(locator.toBy(), name);
 * </pre>
 */
final class HandlerSupport {

    private HandlerSupport() { }

    /**
     * Resolves a logical name, waits for the element to be visible, and returns
     * the live {@link WebElement}.
     */
    static WebElement resolveVisible(String logicalName, StepContext ctx, LocatorResolver resolver) {
        ElementLocator locator = resolver.resolve(logicalName, ctx.blueprint());
        return ctx.waits().waitForVisible(locator.toBy(), logicalName);
    }

    /** Asserts the step names a target element and returns it. */
    static String requireTarget(Step step) {
        String target = step.getTargetElement();
        if (target == null || target.isBlank()) {
            throw new StepFailureException(step.getAction() + " step " + step.getStepNumber()
                    + " has no target_element");
        }
        return target;
    }

    /** True when a data key or element name suggests the value is a secret. */
    static boolean isSensitive(String... names) {
        for (String name : names) {
            if (name == null) continue;
            String n = name.toLowerCase(Locale.ROOT);
            if (n.contains("pass") || n.contains("secret") || n.contains("token")) {
                return true;
            }
        }
        return false;
    }
}
