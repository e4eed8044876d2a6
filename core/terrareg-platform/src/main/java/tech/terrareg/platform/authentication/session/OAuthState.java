package tech.terrareg.platform.authentication.session;

import com.fasterxml.jackson.annotation.JsonProperty;
import tech.terrareg.platform.authentication.AuthMethodType;

/**
 * Payload of an OAuth/OIDC/SAML state record.
 */
public record OAuthState(
    String state,
    @JsonProperty("redirect_url") String redirectUrl,
    @JsonProperty("auth_method") AuthMethodType authMethod,
    @JsonProperty("expires_at") long expiresAt,
    String nonce
) {}
