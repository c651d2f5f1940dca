package webqa.storage;

import java.io.IOException;
import java.util.Optional;

/**
 * Minimal key/value blob store for baselines and run artifacts.
 *
 * <p>Keys are slash-separated relative paths such as
 * {@code baselines/TC1-default/login.png}. Implementations must be safe for
 * use by several worker processes at once.
 */
public interface ObjectStore {

    /** Returns the object's bytes, or empty when no object exists at {@code key}. */
    Optional<byte[]> get(String key) throws IOException;

    /** Writes (or replaces) the object at {@code key}. */
    void put(String key, byte[] data, String contentType) throws IOException;

    /**
     * Writes the object only if nothing exists at {@code key} yet.
     *
     * @return {@code true} if this call created the object
     */
    boolean putIfAbsent(String key, byte[] data, String contentType) throws IOException;
}
