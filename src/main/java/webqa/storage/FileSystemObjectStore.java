package webqa.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * {@link ObjectStore} backed by a directory tree, typically a volume shared by
 * all workers.
 *
 * <p>Both writes go through a temporary sibling, so readers never observe a
 * half-written PNG and a crash mid-write leaves only a stray {@code .tmp}
 * file. {@link #put} moves the temporary file into place; {@link #putIfAbsent}
 * hard-links it to the key, which fails atomically when the key already
 * exists. The store directory must therefore support hard links.
 */
public class FileSystemObjectStore implements ObjectStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemObjectStore.class);

    private final Path root;

    public FileSystemObjectStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public Optional<byte[]> get(String key) throws IOException {
        Path path = resolve(key);
        try {
            return Optional.of(Files.readAllBytes(path));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
    }

    @Override
    public void put(String key, byte[] data, String contentType) throws IOException {
        Path target = resolve(key);
        Files.createDirectories(target.getParent());
        Path tmp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
        try {
            Files.write(tmp, data);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
        log.debug("ObjectStore: wrote {} ({} bytes, {})", key, data.length, contentType);
    }

    @Override
    public boolean putIfAbsent(String key, byte[] data, String contentType) throws IOException {
        Path target = resolve(key);
        Files.createDirectories(target.getParent());
        Path tmp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
        try {
            Files.write(tmp, data);
            Files.createLink(target, tmp);
            log.debug("ObjectStore: created {} ({} bytes, {})", key, data.length, contentType);
            return true;
        } catch (FileAlreadyExistsException e) {
            log.debug("ObjectStore: {} already exists, leaving it untouched", key);
            return false;
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /** Maps a key to a path under {@link #root}, rejecting keys that escape it. */
    private Path resolve(String key) throws IOException {
        if (key == null || key.isBlank()) {
            throw new IOException("Object key must not be blank");
        }
        Path path = root.resolve(key).normalize();
        if (!path.startsWith(root) || path.equals(root)) {
            throw new IOException("Object key escapes the store root: " + key);
        }
        return path;
    }
}
