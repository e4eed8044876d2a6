package tech.terrareg.platform.authentication.method;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.terrareg.platform.authentication.AuthContext;
import tech.terrareg.platform.authentication.AuthMethodType;
import tech.terrareg.platform.authentication.ProviderClaims;
import tech.terrareg.platform.authentication.TokenAuth;
import tech.terrareg.platform.config.InfraConfig;

import java.util.List;
import java.util.Optional;

/**
 * {@code X-Terrareg-ApiKey} equal to ADMIN_AUTHENTICATION_TOKEN: built-in site admin.
 */
@ApplicationScoped
public class AdminApiKeyAuthMethod implements TokenAuth {

    static final String USERNAME = "Built-in admin";

    @Inject
    InfraConfig infraConfig;

    @Override
    public AuthMethodType type() {
        return AuthMethodType.ADMIN_API_KEY;
    }

    @Override
    public boolean isEnabled() {
        return infraConfig.adminAuthenticationToken().filter(t -> !t.isEmpty()).isPresent();
    }

    @Override
    public Optional<AuthContext> authenticate(String apiKey) {
        if (!ApiKeyMatcher.matchesAny(apiKey, infraConfig.adminAuthenticationToken().stream().toList())) {
            return Optional.empty();
        }
        return Optional.of(AuthContext.builder(type())
            .username(USERNAME)
            .siteAdmin(true)
            .userGroupNames(List.of())
            .claims(new ProviderClaims.ApiKey(type()))
            .build());
    }
}
