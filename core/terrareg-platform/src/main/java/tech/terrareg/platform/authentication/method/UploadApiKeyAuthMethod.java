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
 * Upload API key: may upload module versions to any namespace, nothing else.
 */
@ApplicationScoped
public class UploadApiKeyAuthMethod implements TokenAuth {

    @Inject
    InfraConfig infraConfig;

    @Override
    public AuthMethodType type() {
        return AuthMethodType.UPLOAD_API_KEY;
    }

    @Override
    public boolean isEnabled() {
        return !infraConfig.uploadApiKeys().isEmpty();
    }

    @Override
    public Optional<AuthContext> authenticate(String apiKey) {
        if (!ApiKeyMatcher.matchesAny(apiKey, infraConfig.uploadApiKeys())) {
            return Optional.empty();
        }
        return Optional.of(AuthContext.builder(type())
            .username("upload-api-key")
            .grants(Set.of(AuthGrant.UPLOAD_ANY_NAMESPACE))
            .claims(new ProviderClaims.ApiKey(type()))
            .build());
    }
}
