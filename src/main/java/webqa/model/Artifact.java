package webqa.model;

/**
 * A diagnostic file uploaded to the object store for a run.
 *
 * @param key  object-store key
 * @param kind what the file contains
 */
public record Artifact(String key, Kind kind) {

    public enum Kind { FAILURE_SCREENSHOT, TRACE, VISUAL_DIFF }
}
