package tech.terrareg.platform.authentication;

/**
 * Credential recognizers, listed in dispatch priority order.
 */
public enum AuthMethodType {
    ADMIN_API_KEY,
    ADMIN_SESSION,
    UPLOAD_API_KEY,
    PUBLISH_API_KEY,
    SAML,
    OPENID_CONNECT,
    TERRAFORM_OIDC,
    TERRAFORM_ANALYTICS_AUTH_KEY,
    TERRAFORM_INTERNAL_EXTRACTION,
    NOT_AUTHENTICATED
}
