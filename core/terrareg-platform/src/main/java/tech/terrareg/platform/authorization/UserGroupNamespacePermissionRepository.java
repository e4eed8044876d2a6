package tech.terrareg.platform.authorization;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for UserGroupNamespacePermission entities.
 */
public interface UserGroupNamespacePermissionRepository {

    List<UserGroupNamespacePermission> findByUserGroupIds(List<Long> userGroupIds);
    Optional<UserGroupNamespacePermission> findByGroupAndNamespace(Long userGroupId, Long namespaceId);

    void persist(UserGroupNamespacePermission permission);
    void update(UserGroupNamespacePermission permission);
    boolean deleteById(Long id);
    long deleteByUserGroupId(Long userGroupId);
    long deleteByNamespaceId(Long namespaceId);
}
