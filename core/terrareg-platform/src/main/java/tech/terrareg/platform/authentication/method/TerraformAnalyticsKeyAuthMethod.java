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
 * Bearer token matching an ANALYTICS_AUTH_KEYS entry. Entries have the form
 * {@code token:environment}; only the token part is compared and the environment
 * is carried for download attribution.
 */
@ApplicationScoped
public class TerraformAnalyticsKeyAuthMethod implements BearerAuth {

    @Inject
    InfraConfig infraConfig;

    @Override
    public AuthMethodType type() {
        return AuthMethodType.TERRAFORM_ANALYTICS_AUTH_KEY;
    }

    @Override
    public boolean isEnabled() {
        return !infraConfig.analyticsAuthKeys().isEmpty();
    }

    @Override
    public Optional<AuthContext> authenticate(String bearerToken) {
        for (String entry : infraConfig.analyticsAuthKeys()) {
            int separator = entry.indexOf(':');
            String key = separator < 0 ? entry : entry.substring(0, separator);
            String environment = separator < 0 ? null : entry.substring(separator + 1);
            if (!key.isEmpty() && Hashing.constantTimeEquals(bearerToken, key)) {
                return Optional.of(AuthContext.builder(type())
                    .claims(new ProviderClaims.AnalyticsKey(environment))
                    .build());
            }
        }
        return Optional.empty();
    }
}
