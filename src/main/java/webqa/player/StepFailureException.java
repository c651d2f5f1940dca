package webqa.player;

/**
 * Unchecked exception thrown by player components when a step cannot be
 * completed. Any subclass reaching the {@link RunController} fails the run,
 * with {@link #getMessage()} as the reported failure reason.
 */
public class StepFailureException extends RuntimeException {

    public StepFailureException(String msg) {
        super(msg);
    }

    public StepFailureException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
