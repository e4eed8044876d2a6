package tech.terrareg.platform.storage;

import org.jboss.logging.Logger;
import tech.terrareg.platform.error.PathTraversalException;
import tech.terrareg.platform.error.RegistryException;
import tech.terrareg.platform.error.StorageUnavailableException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Filesystem backend rooted at the data directory.
 *
 * Writes go to a temporary file in the target directory and are moved into place
 * atomically.
 */
public class LocalBlobStorage implements BlobStorage {

    private static final Logger LOG = Logger.getLogger(LocalBlobStorage.class);

    private final Path root;

    public LocalBlobStorage(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    @Override
    public void putBlob(String path, InputStream content) {
        Path target = resolve(path);
        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), ".blob-", ".part");
            Files.copy(content, temp, StandardCopyOption.REPLACE_EXISTING);
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            LOG.debugf("Stored blob %s", path);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new StorageUnavailableException("Failed to write blob " + path, e);
        }
    }

    @Override
    public InputStream getBlob(String path) {
        Path target = resolve(path);
        try {
            return Files.newInputStream(target);
        } catch (NoSuchFileException e) {
            throw RegistryException.notFound("Blob not found: " + path);
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to read blob " + path, e);
        }
    }

    @Override
    public boolean exists(String path) {
        return Files.isRegularFile(resolve(path));
    }

    @Override
    public void deletePrefix(String path) {
        Path target = resolve(path);
        if (!Files.exists(target)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(target)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).toList();
            for (Path p : paths) {
                Files.deleteIfExists(p);
            }
            LOG.debugf("Deleted %d path(s) under %s", paths.size(), path);
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to delete " + path, e);
        }
    }

    @Override
    public String describe() {
        return "local:" + root;
    }

    Path resolve(String path) {
        Path resolved = Path.of(StoragePaths.safeJoinPaths(root.toString(), path)).normalize();
        if (!resolved.startsWith(root)) {
            throw new PathTraversalException("Path escapes storage root: " + path);
        }
        return resolved;
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warnf("Failed to remove temporary file %s: %s", path, e.getMessage());
        }
    }
}
