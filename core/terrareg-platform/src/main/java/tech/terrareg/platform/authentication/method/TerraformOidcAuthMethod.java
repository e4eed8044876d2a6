package tech.terrareg.platform.authentication.method;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.terrareg.platform.authentication.AuthContext;
import tech.terrareg.platform.authentication.AuthGrant;
import tech.terrareg.platform.authentication.AuthMethodType;
import tech.terrareg.platform.authentication.BearerAuth;
import tech.terrareg.platform.authentication.ProviderClaims;
import tech.terrareg.platform.authentication.terraform.TerraformIdpService;

import java.util.Optional;
import java.util.Set;

/**
 * Bearer token issued through {@code terraform login}.
 */
@ApplicationScoped
public class TerraformOidcAuthMethod implements BearerAuth {

    @Inject
    TerraformIdpService terraformIdpService;

    @Override
    public AuthMethodType type() {
        return AuthMethodType.TERRAFORM_OIDC;
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public Optional<AuthContext> authenticate(String bearerToken) {
        return terraformIdpService.validateAccessToken(bearerToken)
            .map(token -> AuthContext.builder(type())
                .username(token.username())
                .grants(Set.of(AuthGrant.TERRAFORM_API))
                .claims(new ProviderClaims.TerraformOidc(token.subjectId(), token.username(), token.upstream()))
                .terraformAuthToken(bearerToken)
                .build());
    }
}
