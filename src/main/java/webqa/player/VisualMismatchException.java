package webqa.player;

/** The current page differs from its baseline by more than the threshold. */
public class VisualMismatchException extends StepFailureException {

    private final VisualRegression.VisualCheckResult result;

    public VisualMismatchException(String msg, VisualRegression.VisualCheckResult result) {
        super(msg);
        this.result = result;
    }

    public VisualRegression.VisualCheckResult getResult() { return result; }
}
