package tech.terrareg.platform.authentication.session;

import io.quarkus.mongodb.panache.PanacheMongoEntityBase;
import io.quarkus.mongodb.panache.common.MongoEntity;
import org.bson.codecs.pojo.annotations.BsonId;

import java.time.Instant;

/**
 * Server-side session. Never returned after {@code expiry}.
 */
@MongoEntity(collection = "sessions")
public class Session extends PanacheMongoEntityBase {

    /**
     * Opaque 256-bit random identifier, base64url encoded.
     */
    @BsonId
    public String id;

    public SessionKind kind = SessionKind.SESSION;

    public Instant expiry;

    /**
     * Serialized provider claims (JSON), or the OAuth state payload for state records.
     */
    public String providerSourceAuth;

    public Instant createdAt;

    public Instant lastAccessedAt;

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiry);
    }
}
