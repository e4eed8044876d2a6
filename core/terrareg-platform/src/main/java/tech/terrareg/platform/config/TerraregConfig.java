package tech.terrareg.platform.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.List;
import java.util.Optional;

/**
 * Raw registry settings, bound to environment variables in application.properties.
 *
 * Nothing reads this mapping directly except {@link ConfigResolver}, which
 * validates it once and publishes {@link DomainConfig} and {@link InfraConfig}.
 */
@ConfigMapping(prefix = "terrareg")
public interface TerraregConfig {

    // ==================== Server ====================

    @WithDefault("5000")
    int listenPort();

    Optional<String> publicUrl();

    Optional<String> domainName();

    Optional<String> databaseUrl();

    @WithDefault("./data")
    String dataDirectory();

    Optional<String> uploadDirectory();

    @WithDefault("104857600")
    long uploadMaxSizeBytes();

    // ==================== Secrets and keys ====================

    Optional<String> secretKey();

    Optional<String> adminAuthenticationToken();

    Optional<List<String>> uploadApiKeys();

    Optional<List<String>> publishApiKeys();

    /**
     * Entries in {@code token:environment} form.
     */
    Optional<List<String>> analyticsAuthKeys();

    @WithDefault("internal-terrareg-analytics-token")
    String internalExtractionAnalyticsToken();

    // ==================== Sessions ====================

    @WithDefault("60")
    int sessionExpiryMins();

    @WithDefault("60")
    int adminSessionExpiryMins();

    @WithDefault("1440")
    int sessionMaxTtlMins();

    @WithDefault("60")
    int sessionCleanupIntervalMins();

    @WithDefault("terrareg_session")
    String sessionCookieName();

    // ==================== SAML ====================

    Optional<String> saml2IdpMetadataUrl();

    Optional<String> saml2EntityId();

    Optional<String> saml2PublicKey();

    Optional<String> saml2PrivateKey();

    @WithDefault("groups")
    String saml2GroupAttribute();

    // ==================== OpenID Connect ====================

    Optional<String> openidConnectIssuer();

    Optional<String> openidConnectClientId();

    Optional<String> openidConnectClientSecret();

    @WithDefault("openid,profile,email")
    List<String> openidConnectScopes();

    @WithDefault("groups")
    String openidConnectGroupsClaim();

    // ==================== Terraform ====================

    Optional<String> terraformPresignedUrlSecret();

    @WithDefault("10")
    int terraformPresignedUrlExpirySeconds();

    @WithDefault("3600")
    int terraformPresignedUrlMaxLifetimeSeconds();

    @WithDefault("3600")
    int terraformOidcIdpSessionExpiry();

    Optional<String> terraformOidcIdpSubjectIdHashSalt();

    // ==================== Timeouts (seconds) ====================

    @WithDefault("60")
    int standardRequestTimeoutSeconds();

    @WithDefault("1800")
    int moduleIndexingTimeoutSeconds();

    @WithDefault("1800")
    int terraformLockTimeoutSeconds();

    @WithDefault("300")
    int gitCloneTimeout();

    // ==================== Domain policy ====================

    @WithDefault("allow")
    String allowModuleHosting();

    @WithDefault("true")
    boolean allowProviderHosting();

    @WithDefault("true")
    boolean autoCreateNamespace();

    @WithDefault("true")
    boolean autoCreateModuleProvider();

    @WithDefault("false")
    boolean autoPublishModuleVersions();

    Optional<List<String>> trustedNamespaces();

    Optional<List<String>> verifiedModuleNamespaces();

    @WithDefault("Trusted")
    String trustedNamespaceLabel();

    @WithDefault("Contributed")
    String contributedNamespaceLabel();

    @WithDefault("Verified")
    String verifiedModuleLabel();

    @WithDefault("analytics token")
    String analyticsTokenPhrase();

    Optional<String> analyticsTokenDescription();

    @WithDefault("my-tf-application")
    String exampleAnalyticsToken();

    @WithDefault("false")
    boolean disableAnalytics();

    @WithDefault("false")
    boolean allowUnidentifiedDownloads();

    @WithDefault("true")
    boolean enableSecurityScanning();

    Optional<String> infracostApiKey();

    Optional<List<String>> requiredModuleMetadataAttributes();

    @WithDefault("tf,tfvars,sh,json")
    List<String> exampleFileExtensions();

    @WithDefault("modules")
    String modulesDirectory();

    @WithDefault("examples")
    String examplesDirectory();
}
