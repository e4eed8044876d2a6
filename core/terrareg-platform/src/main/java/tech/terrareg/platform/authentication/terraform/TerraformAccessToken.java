package tech.terrareg.platform.authentication.terraform;

import io.quarkus.mongodb.panache.PanacheMongoEntityBase;
import io.quarkus.mongodb.panache.common.MongoEntity;
import org.bson.codecs.pojo.annotations.BsonId;

import java.time.Instant;

/**
 * Access token issued to the Terraform CLI; presented as a Bearer token.
 */
@MongoEntity(collection = "terraform_idp_access_tokens")
public class TerraformAccessToken extends PanacheMongoEntityBase {

    @BsonId
    public String tokenHash;

    /**
     * Salted hash of the username; the stable subject identifier.
     */
    public String subjectId;

    public String username;

    public String providerSourceAuth;

    public Instant createdAt;

    public Instant expiry;
}
