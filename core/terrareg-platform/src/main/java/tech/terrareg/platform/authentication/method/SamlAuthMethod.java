package tech.terrareg.platform.authentication.method;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.terrareg.platform.authentication.ActiveSession;
import tech.terrareg.platform.authentication.AuthContext;
import tech.terrareg.platform.authentication.AuthMethodType;
import tech.terrareg.platform.authentication.ProviderClaims;
import tech.terrareg.platform.authentication.SessionAuth;
import tech.terrareg.platform.authorization.UserGroupService;
import tech.terrareg.platform.config.InfraConfig;

import java.util.Optional;

/**
 * Session created by a completed SAML2 login. Permissions come from the
 * user groups named in the assertion's group attribute.
 */
@ApplicationScoped
public class SamlAuthMethod implements SessionAuth {

    @Inject
    InfraConfig infraConfig;

    @Inject
    UserGroupService userGroupService;

    @Override
    public AuthMethodType type() {
        return AuthMethodType.SAML;
    }

    @Override
    public boolean isEnabled() {
        return infraConfig.saml().isPresent();
    }

    @Override
    public Optional<AuthContext> authenticate(ActiveSession session) {
        if (!(session.claims() instanceof ProviderClaims.Saml saml)) {
            return Optional.empty();
        }
        UserGroupService.GroupPermissions permissions = userGroupService.resolve(saml.groups());
        return Optional.of(AuthContext.builder(type())
            .username(saml.username())
            .siteAdmin(permissions.siteAdmin())
            .userGroupNames(saml.groups())
            .namespacePermissions(permissions.namespacePermissions())
            .claims(saml)
            .build());
    }
}
