package tech.terrareg.platform.authorization;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.terrareg.platform.error.RegistryException;
import tech.terrareg.platform.namespace.Namespace;
import tech.terrareg.platform.namespace.NamespaceRepository;
import tech.terrareg.platform.shared.TsidGenerator;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * User groups and their namespace permissions.
 */
@ApplicationScoped
public class UserGroupService {

    private static final Logger LOG = Logger.getLogger(UserGroupService.class);

    private static final Pattern GROUP_NAME = Pattern.compile("^[\\w .@-]{1,128}$");

    @Inject
    UserGroupRepository userGroupRepository;

    @Inject
    UserGroupNamespacePermissionRepository permissionRepository;

    @Inject
    NamespaceRepository namespaceRepository;

    /**
     * Permissions a member of the given groups holds.
     */
    public record GroupPermissions(boolean siteAdmin, Map<String, NamespacePermission> namespacePermissions) {

        public static final GroupPermissions NONE = new GroupPermissions(false, Map.of());
    }

    /**
     * A group with its grants keyed by namespace name.
     */
    public record GroupView(UserGroup group, Map<String, NamespacePermission> namespacePermissions) {}

    // ========================================
    // Resolution
    // ========================================

    /**
     * Merge the grants of every known group in {@code groupNames}. Unknown names are ignored;
     * where two groups grant the same namespace the stronger permission wins.
     */
    public GroupPermissions resolve(List<String> groupNames) {
        if (groupNames == null || groupNames.isEmpty()) {
            return GroupPermissions.NONE;
        }
        List<UserGroup> groups = userGroupRepository.findByNames(groupNames);
        if (groups.isEmpty()) {
            return GroupPermissions.NONE;
        }
        boolean siteAdmin = groups.stream().anyMatch(g -> g.siteAdmin);

        List<UserGroupNamespacePermission> grants =
            permissionRepository.findByUserGroupIds(groups.stream().map(g -> g.id).toList());
        Map<Long, String> namespaceNames = namespaceNames(grants);

        Map<String, NamespacePermission> merged = new HashMap<>();
        for (UserGroupNamespacePermission grant : grants) {
            String namespace = namespaceNames.get(grant.namespaceId);
            if (namespace != null) {
                merged.merge(namespace, grant.permissionType, NamespacePermission::strongest);
            }
        }
        return new GroupPermissions(siteAdmin, merged);
    }

    // ========================================
    // Administration
    // ========================================

    public List<GroupView> listGroups() {
        List<UserGroup> groups = userGroupRepository.listAll();
        List<UserGroupNamespacePermission> grants =
            permissionRepository.findByUserGroupIds(groups.stream().map(g -> g.id).toList());
        Map<Long, String> namespaceNames = namespaceNames(grants);
        Map<Long, List<UserGroupNamespacePermission>> byGroup =
            grants.stream().collect(Collectors.groupingBy(p -> p.userGroupId));

        return groups.stream()
            .map(group -> {
                Map<String, NamespacePermission> permissions = new LinkedHashMap<>();
                for (UserGroupNamespacePermission grant : byGroup.getOrDefault(group.id, List.of())) {
                    String namespace = namespaceNames.get(grant.namespaceId);
                    if (namespace != null) {
                        permissions.put(namespace, grant.permissionType);
                    }
                }
                return new GroupView(group, permissions);
            })
            .toList();
    }

    public UserGroup createGroup(String name, boolean siteAdmin) {
        if (name == null || !GROUP_NAME.matcher(name).matches()) {
            throw RegistryException.invalidInput("Invalid user group name");
        }
        if (userGroupRepository.findByName(name).isPresent()) {
            throw RegistryException.conflict("User group already exists: " + name);
        }
        UserGroup group = new UserGroup();
        group.id = TsidGenerator.generate();
        group.name = name;
        group.siteAdmin = siteAdmin;
        userGroupRepository.persist(group);
        LOG.infof("Created user group %s (site admin: %s)", name, siteAdmin);
        return group;
    }

    public void deleteGroup(String name) {
        UserGroup group = requireGroup(name);
        long removed = permissionRepository.deleteByUserGroupId(group.id);
        userGroupRepository.deleteById(group.id);
        LOG.infof("Deleted user group %s and %d namespace permissions", name, removed);
    }

    /**
     * Create or replace the group's permission on a namespace.
     */
    public UserGroupNamespacePermission grant(String groupName, String namespaceName, NamespacePermission permission) {
        UserGroup group = requireGroup(groupName);
        Namespace namespace = namespaceRepository.findByName(namespaceName)
            .orElseThrow(() -> RegistryException.notFound("Namespace does not exist: " + namespaceName));

        var existing = permissionRepository.findByGroupAndNamespace(group.id, namespace.id);
        if (existing.isPresent()) {
            UserGroupNamespacePermission grant = existing.get();
            grant.permissionType = permission;
            permissionRepository.update(grant);
            return grant;
        }
        UserGroupNamespacePermission grant = new UserGroupNamespacePermission();
        grant.id = TsidGenerator.generate();
        grant.userGroupId = group.id;
        grant.namespaceId = namespace.id;
        grant.permissionType = permission;
        permissionRepository.persist(grant);
        LOG.infof("Granted %s on %s to user group %s", permission, namespace.name, groupName);
        return grant;
    }

    public void revoke(String groupName, String namespaceName) {
        UserGroup group = requireGroup(groupName);
        Namespace namespace = namespaceRepository.findByName(namespaceName)
            .orElseThrow(() -> RegistryException.notFound("Namespace does not exist: " + namespaceName));
        UserGroupNamespacePermission grant = permissionRepository.findByGroupAndNamespace(group.id, namespace.id)
            .orElseThrow(() -> RegistryException.notFound("Permission does not exist"));
        permissionRepository.deleteById(grant.id);
    }

    private UserGroup requireGroup(String name) {
        return userGroupRepository.findByName(name)
            .orElseThrow(() -> RegistryException.notFound("User group does not exist: " + name));
    }

    private Map<Long, String> namespaceNames(List<UserGroupNamespacePermission> grants) {
        List<Long> ids = grants.stream().map(p -> p.namespaceId).distinct().toList();
        if (ids.isEmpty()) {
            return Map.of();
        }
        return namespaceRepository.findByIds(ids).stream()
            .collect(Collectors.toMap(n -> n.id, n -> n.nameLower, (a, b) -> a));
    }
}
