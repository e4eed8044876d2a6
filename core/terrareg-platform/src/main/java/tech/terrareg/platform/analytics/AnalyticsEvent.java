package tech.terrareg.platform.analytics;

import io.quarkus.mongodb.panache.PanacheMongoEntityBase;
import io.quarkus.mongodb.panache.common.MongoEntity;
import org.bson.codecs.pojo.annotations.BsonId;

import java.time.Instant;

/**
 * One recorded module download. Append-only.
 */
@MongoEntity(collection = "analytics")
public class AnalyticsEvent extends PanacheMongoEntityBase {

    @BsonId
    public Long id;

    public Long moduleVersionId;

    /**
     * Denormalised so per-module-provider queries do not join through versions.
     */
    public Long moduleProviderId;

    public String analyticsToken;

    /**
     * Environment of the matching analytics auth key, if any.
     */
    public String environment;

    public String terraformVersion;

    public String userAgent;

    public Instant timestamp;
}
