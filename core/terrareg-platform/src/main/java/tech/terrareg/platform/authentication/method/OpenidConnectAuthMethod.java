package tech.terrareg.platform.authentication.method;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.terrareg.platform.authentication.ActiveSession;
import tech.terrareg.platform.authentication.AuthContext;
import tech.terrareg.platform.authentication.AuthMethodType;
import tech.terrareg.platform.authentication.ProviderClaims;
import tech.terrareg.platform.authentication.SessionAuth;
import tech.terrareg.platform.authorization.UserGroupService;
import tech.terrareg.platform.config.InfraConfig;

import java.time.Clock;
import java.util.Optional;

/**
 * Session created by a completed OpenID Connect login. Declines once the
 * ID token's expiry has passed even if the session itself is still valid.
 */
@ApplicationScoped
public class OpenidConnectAuthMethod implements SessionAuth {

    private static final Logger LOG = Logger.getLogger(OpenidConnectAuthMethod.class);

    @Inject
    InfraConfig infraConfig;

    @Inject
    UserGroupService userGroupService;

    @Inject
    Clock clock;

    @Override
    public AuthMethodType type() {
        return AuthMethodType.OPENID_CONNECT;
    }

    @Override
    public boolean isEnabled() {
        return infraConfig.oidc().isPresent();
    }

    @Override
    public Optional<AuthContext> authenticate(ActiveSession session) {
        if (!(session.claims() instanceof ProviderClaims.Oidc oidc)) {
            return Optional.empty();
        }
        if (oidc.expiresAt() != null && !clock.instant().isBefore(oidc.expiresAt())) {
            LOG.debugf("OpenID Connect token for %s has expired", oidc.username());
            return Optional.empty();
        }
        UserGroupService.GroupPermissions permissions = userGroupService.resolve(oidc.groups());
        return Optional.of(AuthContext.builder(type())
            .username(oidc.username())
            .siteAdmin(permissions.siteAdmin())
            .userGroupNames(oidc.groups())
            .namespacePermissions(permissions.namespacePermissions())
            .claims(oidc)
            .build());
    }
}
