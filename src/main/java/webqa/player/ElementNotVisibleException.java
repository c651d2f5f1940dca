package webqa.player;

/** A resolved element did not become visible within the explicit wait. */
public class ElementNotVisibleException extends StepFailureException {

    public ElementNotVisibleException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
