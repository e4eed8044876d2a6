package tech.terrareg.platform.authentication.terraform;

import io.quarkus.mongodb.panache.PanacheMongoEntityBase;
import io.quarkus.mongodb.panache.common.MongoEntity;
import org.bson.codecs.pojo.annotations.BsonId;

import java.time.Instant;

/**
 * Single-use authorization code issued to {@code terraform login}.
 */
@MongoEntity(collection = "terraform_idp_authorization_codes")
public class TerraformAuthorizationCode extends PanacheMongoEntityBase {

    /**
     * SHA-256 hex of the code handed to the client. The raw code is never stored.
     */
    @BsonId
    public String codeHash;

    public String clientId;

    public String redirectUri;

    /**
     * PKCE S256 challenge.
     */
    public String codeChallenge;

    public String username;

    /**
     * Serialized claims of the session that approved the login.
     */
    public String providerSourceAuth;

    public Instant expiry;
}
