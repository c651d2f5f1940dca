package webqa.player;

import webqa.model.Step;
import webqa.model.StepAction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Interprets one {@link Step} against the live page by dispatching on its
 * action to the matching {@link ActionHandler}.
 */
public class StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    private final LocatorResolver resolver;
    private final Map<StepAction, ActionHandler> handlers;

    public StepExecutor(LocatorResolver resolver, VisualRegression visualRegression) {
        this(resolver, defaultHandlers(visualRegression));
    }

    /** Package-private constructor for unit tests: accepts a custom handler table. */
    StepExecutor(LocatorResolver resolver, Map<StepAction, ActionHandler> handlers) {
        this.resolver = resolver;
        this.handlers = new EnumMap<>(handlers);
    }

    private static Map<StepAction, ActionHandler> defaultHandlers(VisualRegression visualRegression) {
        Map<StepAction, ActionHandler> map = new EnumMap<>(StepAction.class);
        map.put(StepAction.ENTER_TEXT,             new EnterTextHandler());
        map.put(StepAction.CLICK,                  new ClickHandler());
        map.put(StepAction.VERIFY_ELEMENT_VISIBLE, new VerifyVisibleHandler());
        map.put(StepAction.VISUAL_VALIDATION,      new VisualValidationHandler(visualRegression));
        return map;
    }

    /**
     * Executes {@code step}.
     *
     * @return the outcome of the completed step
     * @throws StepFailureException if the step fails for any reason
     */
    public StepOutcome execute(Step step, StepContext ctx) {
        StepAction action = step.getAction();
        if (action == null) {
            throw new StepFailureException("Step " + step.getStepNumber() + " has no action");
        }
        ActionHandler handler = handlers.get(action);
        if (handler == null) {
            throw new StepFailureException("No handler registered for action " + action);
        }
        log.info("Step {}: {} on '{}'", step.getStepNumber(), action, step.getTargetElement());
        return handler.handle(step, ctx, resolver);
    }
}
