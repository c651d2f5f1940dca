package webqa.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of the visual checks of a run.
 *
 * <p>{@link #rank()} orders the statuses by how much they tell the reader:
 * {@code N/A < PASS < BASELINE_CREATED < FAIL}. Aggregating several checks keeps
 * the highest rank, so a single {@code FAIL} always wins.
 */
public enum VisualStatus {

    NOT_APPLICABLE("N/A", 0),
    PASS("PASS", 1),
    BASELINE_CREATED("BASELINE_CREATED", 2),
    FAIL("FAIL", 3);

    private final String wireValue;
    private final int rank;

    VisualStatus(String wireValue, int rank) {
        this.wireValue = wireValue;
        this.rank = rank;
    }

    @JsonValue
    public String wireValue() { return wireValue; }

    public int rank() { return rank; }

    /** Returns whichever of {@code this} and {@code other} ranks higher. */
    public VisualStatus merge(VisualStatus other) {
        if (other == null) return this;
        return other.rank > this.rank ? other : this;
    }

    @JsonCreator
    public static VisualStatus fromWire(String value) {
        for (VisualStatus s : values()) {
            if (s.wireValue.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown visual status: " + value);
    }

    @Override
    public String toString() { return wireValue; }
}
