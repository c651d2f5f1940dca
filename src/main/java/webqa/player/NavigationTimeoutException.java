package webqa.player;

/** The page did not finish loading within the page-load timeout. */
public class NavigationTimeoutException extends StepFailureException {

    public NavigationTimeoutException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
