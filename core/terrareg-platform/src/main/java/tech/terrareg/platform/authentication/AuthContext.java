package tech.terrareg.platform.authentication;

import tech.terrareg.platform.authorization.NamespacePermission;
import tech.terrareg.platform.error.RegistryException;
import tech.terrareg.platform.namespace.Namespace;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable per-request authentication and authorization state.
 *
 * Built once by {@link AuthDispatcher} and passed explicitly to every
 * operation that needs it.
 */
public record AuthContext(
    AuthMethodType providerType,
    String username,
    boolean siteAdmin,
    List<String> userGroupNames,
    Map<String, NamespacePermission> namespacePermissions,
    Set<AuthGrant> grants,
    ProviderClaims claims,
    String terraformAuthToken
) {

    /**
     * Permission key granting its level on every namespace.
     */
    public static final String WILDCARD_NAMESPACE = "*";

    private static final AuthContext NOT_AUTHENTICATED = new AuthContext(
        AuthMethodType.NOT_AUTHENTICATED, null, false, List.of(), Map.of(), Set.of(), new ProviderClaims.None(), null);

    public AuthContext {
        userGroupNames = List.copyOf(userGroupNames);
        namespacePermissions = Map.copyOf(namespacePermissions);
        grants = grants.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(grants));
    }

    public static AuthContext notAuthenticated() {
        return NOT_AUTHENTICATED;
    }

    public boolean isAuthenticated() {
        return providerType != AuthMethodType.NOT_AUTHENTICATED;
    }

    public boolean hasGrant(AuthGrant grant) {
        return grants.contains(grant);
    }

    /**
     * Effective permission on a namespace: site admin and a wildcard entry both
     * count, and the strongest applicable grant wins.
     */
    public Optional<NamespacePermission> effectivePermission(String namespace) {
        if (siteAdmin) {
            return Optional.of(NamespacePermission.FULL);
        }
        NamespacePermission direct = namespace == null ? null : namespacePermissions.get(Namespace.fold(namespace));
        NamespacePermission wildcard = namespacePermissions.get(WILDCARD_NAMESPACE);
        return Optional.ofNullable(NamespacePermission.strongest(direct, wildcard));
    }

    public boolean checkNamespaceAccess(NamespacePermission required, String namespace) {
        return effectivePermission(namespace).map(p -> p.allows(required)).orElse(false);
    }

    public boolean canUploadModuleVersion(String namespace) {
        return hasGrant(AuthGrant.UPLOAD_ANY_NAMESPACE)
            || checkNamespaceAccess(NamespacePermission.UPLOAD, namespace);
    }

    public boolean canPublishModuleVersion(String namespace) {
        return hasGrant(AuthGrant.PUBLISH_ANY_NAMESPACE)
            || checkNamespaceAccess(NamespacePermission.PUBLISH, namespace);
    }

    public void requireNamespaceAccess(NamespacePermission required, String namespace) {
        if (!checkNamespaceAccess(required, namespace)) {
            throw denied(required + " permission required on namespace " + namespace);
        }
    }

    public void requireUpload(String namespace) {
        if (!canUploadModuleVersion(namespace)) {
            throw denied("Upload permission required on namespace " + namespace);
        }
    }

    public void requirePublish(String namespace) {
        if (!canPublishModuleVersion(namespace)) {
            throw denied("Publish permission required on namespace " + namespace);
        }
    }

    public void requireSiteAdmin() {
        if (!siteAdmin) {
            throw denied("Site admin permission required");
        }
    }

    public void requireAuthenticated() {
        if (!isAuthenticated()) {
            throw RegistryException.unauthorized("Authentication required");
        }
    }

    private RegistryException denied(String message) {
        return isAuthenticated() ? RegistryException.forbidden(message) : RegistryException.unauthorized(message);
    }

    public static Builder builder(AuthMethodType providerType) {
        return new Builder(providerType);
    }

    public static class Builder {
        private final AuthMethodType providerType;
        private String username;
        private boolean siteAdmin;
        private List<String> userGroupNames = List.of();
        private Map<String, NamespacePermission> namespacePermissions = Map.of();
        private Set<AuthGrant> grants = Set.of();
        private ProviderClaims claims = new ProviderClaims.None();
        private String terraformAuthToken;

        private Builder(AuthMethodType providerType) {
            this.providerType = providerType;
        }

        public Builder username(String value) { this.username = value; return this; }
        public Builder siteAdmin(boolean value) { this.siteAdmin = value; return this; }
        public Builder userGroupNames(List<String> value) { this.userGroupNames = value; return this; }
        public Builder namespacePermissions(Map<String, NamespacePermission> value) { this.namespacePermissions = value; return this; }
        public Builder grants(Set<AuthGrant> value) { this.grants = value; return this; }
        public Builder claims(ProviderClaims value) { this.claims = value; return this; }
        public Builder terraformAuthToken(String value) { this.terraformAuthToken = value; return this; }

        public AuthContext build() {
            return new AuthContext(providerType, username, siteAdmin, userGroupNames, namespacePermissions,
                grants, claims, terraformAuthToken);
        }
    }
}
