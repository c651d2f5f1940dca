package webqa.player;

/** A whole step (or the initial navigation) exceeded the step timeout. */
public class StepTimeoutException extends StepFailureException {

    private final boolean taskStillRunning;

    /**
     * @param taskStillRunning the overrunning task ignored cancellation and may
     *                         still be using the browser
     */
    public StepTimeoutException(String msg, boolean taskStillRunning) {
        super(msg);
        this.taskStillRunning = taskStillRunning;
    }

    public boolean isTaskStillRunning() { return taskStillRunning; }
}
