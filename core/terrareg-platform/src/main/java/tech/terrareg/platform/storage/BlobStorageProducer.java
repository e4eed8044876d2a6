package tech.terrareg.platform.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;
import software.amazon.awssdk.services.s3.S3Client;
import tech.terrareg.platform.config.InfraConfig;

import java.nio.file.Path;

/**
 * Chooses the storage backend from the configured data directory.
 */
@ApplicationScoped
public class BlobStorageProducer {

    private static final Logger LOG = Logger.getLogger(BlobStorageProducer.class);

    @Inject
    InfraConfig infraConfig;

    @Produces
    @Singleton
    BlobStorage blobStorage() {
        String dataDirectory = infraConfig.dataDirectory();
        BlobStorage storage;
        if (dataDirectory.startsWith("s3://")) {
            String[] location = S3BlobStorage.parseLocation(dataDirectory);
            // Region and credentials come from the default AWS provider chains
            storage = new S3BlobStorage(S3Client.builder().build(), location[0], location[1]);
        } else {
            storage = new LocalBlobStorage(Path.of(dataDirectory));
        }
        LOG.infof("Using blob storage %s", storage.describe());
        return storage;
    }
}
