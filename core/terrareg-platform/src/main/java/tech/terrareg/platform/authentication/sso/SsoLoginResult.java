package tech.terrareg.platform.authentication.sso;

import tech.terrareg.platform.authentication.ProviderClaims;

/**
 * Verified claims from a completed SSO login and where to send the browser next.
 */
public record SsoLoginResult(ProviderClaims claims, String redirectUrl) {}
