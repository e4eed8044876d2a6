package tech.terrareg.platform.ingestion;

import org.jboss.logging.Logger;
import tech.terrareg.platform.error.StorageUnavailableException;
import tech.terrareg.platform.storage.BlobStorage;
import tech.terrareg.platform.storage.StoragePaths;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Blobs written during one ingestion.
 *
 * Content is first written below a private staging prefix. {@link #promote()}
 * copies it to the canonical keys as the last step of the indexing transaction,
 * backing up any blob it replaces. If the transaction does not commit,
 * {@link #restore(RuntimeException)} puts the replaced blobs back and removes the
 * ones that did not exist before.
 */
public final class StagedBlobs {

    private static final Logger LOG = Logger.getLogger(StagedBlobs.class);

    private final BlobStorage blobStorage;
    private final String prefix;
    private final Map<String, String> staged = new LinkedHashMap<>();
    private final Deque<Promotion> promoted = new ArrayDeque<>();

    private record Promotion(String canonical, String backup) {}

    public StagedBlobs(BlobStorage blobStorage, String prefix) {
        this.blobStorage = blobStorage;
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    /**
     * Write {@code content} to the staging area; it reaches {@code canonical} on {@link #promote()}.
     */
    public void put(String canonical, InputStream content) {
        String key = StoragePaths.safeJoinPaths(prefix, "staged", String.valueOf(staged.size()));
        blobStorage.putBlob(key, content);
        staged.put(canonical, key);
    }

    public boolean isEmpty() {
        return staged.isEmpty();
    }

    /**
     * Copy every staged blob to its canonical key.
     *
     * @throws StorageUnavailableException if a copy fails; keys promoted so far stay recorded for restore
     */
    public void promote() {
        int index = 0;
        for (Map.Entry<String, String> entry : staged.entrySet()) {
            String canonical = entry.getKey();
            String backup = null;
            if (blobStorage.exists(canonical)) {
                backup = StoragePaths.safeJoinPaths(prefix, "previous", String.valueOf(index));
                copy(canonical, backup);
            }
            promoted.push(new Promotion(canonical, backup));
            copy(entry.getValue(), canonical);
            index++;
        }
    }

    /**
     * Undo {@link #promote()} after {@code failure}. Restore errors are attached to it as suppressed.
     */
    public void restore(RuntimeException failure) {
        while (!promoted.isEmpty()) {
            Promotion promotion = promoted.pop();
            try {
                if (promotion.backup() == null) {
                    blobStorage.deletePrefix(promotion.canonical());
                } else {
                    copy(promotion.backup(), promotion.canonical());
                }
            } catch (RuntimeException e) {
                LOG.errorf(e, "Unable to restore %s after failed indexing", promotion.canonical());
                failure.addSuppressed(e);
            }
        }
    }

    /**
     * Remove the staging prefix. Idempotent.
     */
    public void discard() {
        blobStorage.deletePrefix(prefix);
    }

    private void copy(String from, String to) {
        try (InputStream in = blobStorage.getBlob(from)) {
            blobStorage.putBlob(to, in);
        } catch (IOException e) {
            throw new StorageUnavailableException("Unable to copy blob to " + to, e);
        }
    }
}
