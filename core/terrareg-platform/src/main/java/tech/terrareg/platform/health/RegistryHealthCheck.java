package tech.terrareg.platform.health;

import com.mongodb.client.MongoClient;
import io.quarkus.arc.Unremovable;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.bson.Document;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;
import tech.terrareg.platform.storage.BlobStorage;
import tech.terrareg.platform.storage.StoragePaths;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

/**
 * Readiness: MongoDB answers a ping and the blob store accepts a write.
 */
@Unremovable
@Readiness
@ApplicationScoped
public class RegistryHealthCheck implements HealthCheck {

    static final String CHECK_PATH = StoragePaths.safeJoinPaths(StoragePaths.UPLOAD_ROOT, ".health-check");

    @Inject
    MongoClient mongoClient;

    @Inject
    BlobStorage blobStorage;

    @ConfigProperty(name = "quarkus.mongodb.database")
    String databaseName;

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.named("Terrareg Registry")
            .withData("storage", blobStorage.describe());
        boolean up = true;

        try {
            mongoClient.getDatabase(databaseName).runCommand(new Document("ping", 1));
            builder.withData("database", "reachable");
        } catch (Exception e) {
            up = false;
            builder.withData("database", "unreachable: " + e.getMessage());
        }

        try {
            blobStorage.putBlob(CHECK_PATH, new ByteArrayInputStream("ok".getBytes(StandardCharsets.UTF_8)));
            blobStorage.deletePrefix(CHECK_PATH);
            builder.withData("storage_writable", true);
        } catch (Exception e) {
            up = false;
            builder.withData("storage_writable", false);
            builder.withData("storage_error", String.valueOf(e.getMessage()));
        }

        return builder.status(up).build();
    }
}
