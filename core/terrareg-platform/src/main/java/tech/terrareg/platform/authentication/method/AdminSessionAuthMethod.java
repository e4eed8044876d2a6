package tech.terrareg.platform.authentication.method;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.terrareg.platform.authentication.ActiveSession;
import tech.terrareg.platform.authentication.AuthContext;
import tech.terrareg.platform.authentication.AuthMethodType;
import tech.terrareg.platform.authentication.ProviderClaims;
import tech.terrareg.platform.authentication.SessionAuth;
import tech.terrareg.platform.config.InfraConfig;

import java.util.Optional;

/**
 * Session created by the admin login endpoint.
 */
@ApplicationScoped
public class AdminSessionAuthMethod implements SessionAuth {

    @Inject
    InfraConfig infraConfig;

    @Override
    public AuthMethodType type() {
        return AuthMethodType.ADMIN_SESSION;
    }

    @Override
    public boolean isEnabled() {
        return infraConfig.adminAuthenticationToken().filter(t -> !t.isEmpty()).isPresent();
    }

    @Override
    public Optional<AuthContext> authenticate(ActiveSession session) {
        if (!(session.claims() instanceof ProviderClaims.AdminSession admin) || !session.cookie().adminAuthenticated()) {
            return Optional.empty();
        }
        return Optional.of(AuthContext.builder(type())
            .username(admin.username())
            .siteAdmin(true)
            .claims(admin)
            .build());
    }
}
