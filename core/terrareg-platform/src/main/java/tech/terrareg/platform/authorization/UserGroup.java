package tech.terrareg.platform.authorization;

import io.quarkus.mongodb.panache.PanacheMongoEntityBase;
import io.quarkus.mongodb.panache.common.MongoEntity;
import org.bson.codecs.pojo.annotations.BsonId;

/**
 * A group asserted by an SSO identity provider.
 * Site admin groups hold FULL on every namespace.
 */
@MongoEntity(collection = "user_groups")
public class UserGroup extends PanacheMongoEntityBase {

    @BsonId
    public Long id;

    /**
     * Unique; matched against group names from SAML/OIDC claims.
     */
    public String name;

    public boolean siteAdmin = false;
}
