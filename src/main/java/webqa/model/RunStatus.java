package webqa.model;

/** Lifecycle of a single run: {@code RUNNING} until it reaches a terminal state. */
public enum RunStatus {
    RUNNING,
    PASS,
    FAIL;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
