package tech.terrareg.platform.storage;

import org.jboss.logging.Logger;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.Delete;
import software.amazon.awssdk.services.s3.model.DeleteObjectsRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.ObjectIdentifier;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;
import tech.terrareg.platform.error.RegistryException;
import tech.terrareg.platform.error.StorageUnavailableException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * S3 backend, selected when the data directory is an {@code s3://bucket/prefix} URL.
 *
 * S3 object writes are atomic per key, so uploads are buffered to a local temp file
 * only to obtain the content length.
 */
public class S3BlobStorage implements BlobStorage {

    private static final Logger LOG = Logger.getLogger(S3BlobStorage.class);
    private static final int DELETE_BATCH_SIZE = 1000;

    private final S3Client s3;
    private final String bucket;
    private final String prefix;

    public S3BlobStorage(S3Client s3, String bucket, String prefix) {
        this.s3 = s3;
        this.bucket = bucket;
        this.prefix = prefix == null ? "" : prefix;
    }

    /**
     * Parse {@code s3://bucket/prefix} into bucket and key prefix.
     */
    public static String[] parseLocation(String location) {
        String withoutScheme = location.substring("s3://".length());
        int slash = withoutScheme.indexOf('/');
        if (slash < 0) {
            return new String[]{withoutScheme, ""};
        }
        return new String[]{withoutScheme.substring(0, slash), withoutScheme.substring(slash + 1)};
    }

    @Override
    public void putBlob(String path, InputStream content) {
        String key = key(path);
        Path temp = null;
        try {
            temp = Files.createTempFile("terrareg-s3-", ".part");
            Files.copy(content, temp, StandardCopyOption.REPLACE_EXISTING);
            s3.putObject(PutObjectRequest.builder().bucket(bucket).key(key).build(), RequestBody.fromFile(temp));
            LOG.debugf("Stored s3://%s/%s", bucket, key);
        } catch (IOException | SdkException e) {
            throw new StorageUnavailableException("Failed to write blob " + path, e);
        } finally {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException e) {
                    LOG.warnf("Failed to remove temporary file %s: %s", temp, e.getMessage());
                }
            }
        }
    }

    @Override
    public InputStream getBlob(String path) {
        try {
            return s3.getObject(GetObjectRequest.builder().bucket(bucket).key(key(path)).build());
        } catch (NoSuchKeyException e) {
            throw RegistryException.notFound("Blob not found: " + path);
        } catch (SdkException e) {
            throw new StorageUnavailableException("Failed to read blob " + path, e);
        }
    }

    @Override
    public boolean exists(String path) {
        try {
            s3.headObject(HeadObjectRequest.builder().bucket(bucket).key(key(path)).build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (SdkException e) {
            throw new StorageUnavailableException("Failed to check blob " + path, e);
        }
    }

    @Override
    public void deletePrefix(String path) {
        String keyPrefix = key(path);
        try {
            List<ObjectIdentifier> batch = new ArrayList<>();
            int deleted = 0;
            for (S3Object object : s3.listObjectsV2Paginator(
                    ListObjectsV2Request.builder().bucket(bucket).prefix(keyPrefix).build()).contents()) {
                // Only the exact key or keys below it as a directory
                if (!object.key().equals(keyPrefix) && !object.key().startsWith(keyPrefix + "/")) {
                    continue;
                }
                batch.add(ObjectIdentifier.builder().key(object.key()).build());
                if (batch.size() == DELETE_BATCH_SIZE) {
                    deleted += flush(batch);
                }
            }
            deleted += flush(batch);
            LOG.debugf("Deleted %d object(s) under s3://%s/%s", deleted, bucket, keyPrefix);
        } catch (SdkException e) {
            throw new StorageUnavailableException("Failed to delete " + path, e);
        }
    }

    @Override
    public String describe() {
        return "s3://" + bucket + (prefix.isEmpty() ? "" : "/" + prefix);
    }

    private int flush(List<ObjectIdentifier> batch) {
        if (batch.isEmpty()) {
            return 0;
        }
        int size = batch.size();
        s3.deleteObjects(DeleteObjectsRequest.builder()
            .bucket(bucket)
            .delete(Delete.builder().objects(new ArrayList<>(batch)).build())
            .build());
        batch.clear();
        return size;
    }

    private String key(String path) {
        return prefix.isEmpty() ? StoragePaths.safeJoinPaths("", path) : StoragePaths.safeJoinPaths(prefix, path);
    }
}
