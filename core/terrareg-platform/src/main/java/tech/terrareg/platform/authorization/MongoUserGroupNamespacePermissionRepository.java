package tech.terrareg.platform.authorization;

import io.quarkus.mongodb.panache.PanacheMongoRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Typed;

import java.util.List;
import java.util.Optional;

/**
 * MongoDB implementation of UserGroupNamespacePermissionRepository.
 */
@ApplicationScoped
@Typed(UserGroupNamespacePermissionRepository.class)
class MongoUserGroupNamespacePermissionRepository
        implements PanacheMongoRepositoryBase<UserGroupNamespacePermission, Long>, UserGroupNamespacePermissionRepository {

    @Override
    public List<UserGroupNamespacePermission> findByUserGroupIds(List<Long> userGroupIds) {
        if (userGroupIds.isEmpty()) {
            return List.of();
        }
        return list("userGroupId in ?1", userGroupIds);
    }

    @Override
    public Optional<UserGroupNamespacePermission> findByGroupAndNamespace(Long userGroupId, Long namespaceId) {
        return find("userGroupId = ?1 and namespaceId = ?2", userGroupId, namespaceId).firstResultOptional();
    }

    @Override
    public long deleteByUserGroupId(Long userGroupId) {
        return delete("userGroupId", userGroupId);
    }

    @Override
    public long deleteByNamespaceId(Long namespaceId) {
        return delete("namespaceId", namespaceId);
    }

    @Override
    public void persist(UserGroupNamespacePermission permission) {
        PanacheMongoRepositoryBase.super.persist(permission);
    }

    @Override
    public void update(UserGroupNamespacePermission permission) {
        PanacheMongoRepositoryBase.super.update(permission);
    }

    @Override
    public boolean deleteById(Long id) {
        return PanacheMongoRepositoryBase.super.deleteById(id);
    }
}
