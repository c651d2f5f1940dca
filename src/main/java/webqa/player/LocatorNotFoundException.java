package webqa.player;

/** No blueprint entry or well-known mapping yields a selector for a logical name. */
public class LocatorNotFoundException extends StepFailureException {

    private final String targetName;

    public LocatorNotFoundException(String targetName, String detail) {
        super("Locator not found for '" + targetName + "': " + detail);
        this.targetName = targetName;
    }

    public String getTargetName() { return targetName; }
}
