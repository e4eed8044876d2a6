package tech.terrareg.platform.storage;

import java.io.InputStream;

/**
 * Pluggable blob backend for module archives, provider binaries and staged uploads.
 *
 * Paths are storage keys relative to the backend root, built with {@link StoragePaths}.
 * Backend failures surface as {@link tech.terrareg.platform.error.StorageUnavailableException},
 * which callers treat as retryable.
 */
public interface BlobStorage {

    /**
     * Store the stream at {@code path}. Readers see either the previous blob or the
     * complete new one, never a partial write.
     */
    void putBlob(String path, InputStream content);

    /**
     * Open the blob for reading. The caller closes the stream.
     *
     * @throws tech.terrareg.platform.error.RegistryException with kind NOT_FOUND if absent
     */
    InputStream getBlob(String path);

    boolean exists(String path);

    /**
     * Delete the blob at {@code path} or every blob below it. Missing paths are ignored.
     */
    void deletePrefix(String path);

    /**
     * Iterate the entries of the tar.gz or zip archive stored at {@code path}.
     */
    default ArchiveReader streamArchive(String path) {
        return ArchiveReader.open(getBlob(path));
    }

    /**
     * Human-readable backend description for logs and health checks.
     */
    String describe();
}
