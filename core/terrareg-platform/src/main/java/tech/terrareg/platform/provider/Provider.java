package tech.terrareg.platform.provider;

import io.quarkus.mongodb.panache.PanacheMongoEntityBase;
import io.quarkus.mongodb.panache.common.MongoEntity;
import org.bson.codecs.pojo.annotations.BsonId;

import java.time.Instant;

/**
 * A Terraform provider hosted under a namespace. Unique per (namespaceId, name).
 */
@MongoEntity(collection = "providers")
public class Provider extends PanacheMongoEntityBase {

    @BsonId
    public Long id;

    public Long namespaceId;

    public String name;

    public String description;

    /**
     * "community" or "official".
     */
    public String tier = "community";

    public Long categoryId;

    public String sourceUrl;

    public Instant createdAt = Instant.now();
}
