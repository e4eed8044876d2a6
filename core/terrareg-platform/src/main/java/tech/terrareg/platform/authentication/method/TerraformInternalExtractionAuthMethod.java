package tech.terrareg.platform.authentication.method;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.terrareg.platform.authentication.AuthContext;
import tech.terrareg.platform.authentication.AuthMethodType;
import tech.terrareg.platform.authentication.BearerAuth;
import tech.terrareg.platform.authentication.ProviderClaims;
import tech.terrareg.platform.config.InfraConfig;
import tech.terrareg.platform.shared.Hashing;

import java.util.Optional;

/**
 * Token used by the ingestion pipeline when terraform fetches modules from this
 * registry. Downloads made with it bypass the analytics requirement and are not recorded.
 */
@ApplicationScoped
public class TerraformInternalExtractionAuthMethod implements BearerAuth {

    @Inject
    InfraConfig infraConfig;

    @Override
    public AuthMethodType type() {
        return AuthMethodType.TERRAFORM_INTERNAL_EXTRACTION;
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public Optional<AuthContext> authenticate(String bearerToken) {
        if (!Hashing.constantTimeEquals(bearerToken, infraConfig.internalExtractionAnalyticsToken())) {
            return Optional.empty();
        }
        return Optional.of(AuthContext.builder(type())
            .username("terrareg-internal-extraction")
            .claims(new ProviderClaims.InternalExtraction())
            .build());
    }
}
