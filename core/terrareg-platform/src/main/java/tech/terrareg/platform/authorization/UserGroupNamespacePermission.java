package tech.terrareg.platform.authorization;

import io.quarkus.mongodb.panache.PanacheMongoEntityBase;
import io.quarkus.mongodb.panache.common.MongoEntity;
import org.bson.codecs.pojo.annotations.BsonId;

/**
 * Grants a user group a permission level on one namespace.
 * Unique per (userGroupId, namespaceId).
 */
@MongoEntity(collection = "user_group_namespace_permissions")
public class UserGroupNamespacePermission extends PanacheMongoEntityBase {

    @BsonId
    public Long id;

    public Long userGroupId;

    public Long namespaceId;

    public NamespacePermission permissionType;
}
