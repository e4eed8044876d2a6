package tech.terrareg.platform.authentication;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Per-method claims attached to an {@link AuthContext}.
 *
 * Session-backed variants are serialized to JSON and stored in the session's
 * {@code providerSourceAuth}; the rest only live for one request.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ProviderClaims.AdminSession.class, name = "admin_session"),
    @JsonSubTypes.Type(value = ProviderClaims.ApiKey.class, name = "api_key"),
    @JsonSubTypes.Type(value = ProviderClaims.Saml.class, name = "saml"),
    @JsonSubTypes.Type(value = ProviderClaims.Oidc.class, name = "openid_connect"),
    @JsonSubTypes.Type(value = ProviderClaims.TerraformOidc.class, name = "terraform_oidc"),
    @JsonSubTypes.Type(value = ProviderClaims.AnalyticsKey.class, name = "analytics_key"),
    @JsonSubTypes.Type(value = ProviderClaims.InternalExtraction.class, name = "internal_extraction"),
    @JsonSubTypes.Type(value = ProviderClaims.None.class, name = "none")
})
public sealed interface ProviderClaims {

    record AdminSession(String username) implements ProviderClaims {}

    record ApiKey(AuthMethodType keyType) implements ProviderClaims {}

    record Saml(
        String nameId,
        String username,
        List<String> groups,
        Map<String, List<String>> attributes
    ) implements ProviderClaims {}

    record Oidc(
        String subject,
        String username,
        String email,
        List<String> groups,
        Instant expiresAt,
        Map<String, Object> rawClaims
    ) implements ProviderClaims {}

    /**
     * Terraform CLI token; {@code upstream} holds the claims of the browser
     * session that approved the login.
     */
    record TerraformOidc(String subjectId, String username, ProviderClaims upstream) implements ProviderClaims {}

    record AnalyticsKey(String environment) implements ProviderClaims {}

    record InternalExtraction() implements ProviderClaims {}

    record None() implements ProviderClaims {}
}
