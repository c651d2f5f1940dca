package webqa.model;

/**
 * Actions a test step may perform. Values match the {@code action} field of
 * the job message verbatim.
 */
public enum StepAction {
    ENTER_TEXT,
    CLICK,
    VERIFY_ELEMENT_VISIBLE,
    VISUAL_VALIDATION
}
