package tech.terrareg.platform.authentication.method;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.terrareg.platform.authentication.AuthContext;
import tech.terrareg.platform.authentication.AuthGrant;
import tech.terrareg.platform.authentication.AuthMethodType;
import tech.terrareg.platform.authentication.ProviderClaims;
import tech.terrareg.platform.authentication.TokenAuth;
import tech.terrareg.platform.config.InfraConfig;

import java.util.Optional;
import java.util.Set;

/**
 * Publish API key: may publish module versions in any namespace, nothing else.
 */
@ApplicationScoped
public class PublishApiKeyAuthMethod implements TokenAuth {

    @Inject
    InfraConfig infraConfig;

    @Override
    public AuthMethodType type() {
        return AuthMethodType.PUBLISH_API_KEY;
    }

    @Override
    public boolean isEnabled() {
        return !infraConfig.publishApiKeys().isEmpty();
    }

    @Override
    public Optional<AuthContext> authenticate(String apiKey) {
        if (!ApiKeyMatcher.matchesAny(apiKey, infraConfig.publishApiKeys())) {
            return Optional.empty();
        }
        return Optional.of(AuthContext.builder(type())
            .username("publish-api-key")
            .grants(Set.of(AuthGrant.PUBLISH_ANY_NAMESPACE))
            .claims(new ProviderClaims.ApiKey(type()))
            .build());
    }
}
