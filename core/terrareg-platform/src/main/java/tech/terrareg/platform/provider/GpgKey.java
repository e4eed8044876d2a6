package tech.terrareg.platform.provider;

import io.quarkus.mongodb.panache.PanacheMongoEntityBase;
import io.quarkus.mongodb.panache.common.MongoEntity;
import org.bson.codecs.pojo.annotations.BsonId;

import java.time.Instant;

/**
 * OpenPGP public key belonging to a namespace, used to sign provider releases.
 * The fingerprint is unique.
 */
@MongoEntity(collection = "gpg_keys")
public class GpgKey extends PanacheMongoEntityBase {

    @BsonId
    public Long id;

    public Long namespaceId;

    public String asciiArmor;

    /**
     * Upper-case hex of the low 64 bits of the fingerprint.
     */
    public String keyId;

    public String fingerprint;

    public String source = "";

    public String sourceUrl;

    public String trustSignature;

    public Instant createdAt = Instant.now();
}
