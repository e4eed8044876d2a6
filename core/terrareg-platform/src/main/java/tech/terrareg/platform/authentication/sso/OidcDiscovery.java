package tech.terrareg.platform.authentication.sso;

/**
 * The endpoints of an OpenID Connect issuer's discovery document that login needs.
 */
public record OidcDiscovery(
    String issuer,
    String authorizationEndpoint,
    String tokenEndpoint,
    String jwksUri
) {}
