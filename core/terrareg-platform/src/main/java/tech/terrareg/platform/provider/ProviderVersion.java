package tech.terrareg.platform.provider;

import io.quarkus.mongodb.panache.PanacheMongoEntityBase;
import io.quarkus.mongodb.panache.common.MongoEntity;
import org.bson.codecs.pojo.annotations.BsonId;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One release of a provider. Unique per (providerId, version).
 */
@MongoEntity(collection = "provider_versions")
public class ProviderVersion extends PanacheMongoEntityBase {

    @BsonId
    public Long id;

    public Long providerId;

    public String version;

    public boolean beta;

    /**
     * Plugin protocol versions, e.g. "5.0".
     */
    public List<String> protocols = new ArrayList<>(List.of("5.0"));

    /**
     * Key that signed the SHA256SUMS file.
     */
    public Long gpgKeyId;

    public String shasumsRef;

    public String shasumsSignatureRef;

    public boolean published;

    public Instant publishedAt;

    public Instant createdAt = Instant.now();
}
