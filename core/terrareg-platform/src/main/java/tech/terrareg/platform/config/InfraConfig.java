package tech.terrareg.platform.config;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Endpoints, secrets, timeouts and session lifetimes. Immutable after startup.
 */
public record InfraConfig(
    int listenPort,
    URI publicUrl,
    String domainName,
    String databaseUrl,
    String dataDirectory,
    String uploadDirectory,
    long uploadMaxSizeBytes,
    byte[] secretKey,
    Optional<String> adminAuthenticationToken,
    List<String> uploadApiKeys,
    List<String> publishApiKeys,
    List<String> analyticsAuthKeys,
    String internalExtractionAnalyticsToken,
    Duration sessionExpiry,
    Duration adminSessionExpiry,
    Duration sessionMaxTtl,
    Duration sessionCleanupInterval,
    String sessionCookieName,
    Optional<SamlSettings> saml,
    Optional<OidcSettings> oidc,
    byte[] presignedUrlSecret,
    Duration presignedUrlExpiry,
    Duration presignedUrlMaxLifetime,
    Duration terraformOidcSessionExpiry,
    String terraformOidcSubjectSalt,
    Duration standardRequestTimeout,
    Duration moduleIndexingTimeout,
    Duration terraformLockTimeout,
    Duration gitCloneTimeout,
    Optional<String> infracostApiKey
) {

    /**
     * SAML2 service provider settings; present only when an IdP metadata URL is configured.
     */
    public record SamlSettings(
        String idpMetadataUrl,
        String entityId,
        String publicKey,
        String privateKey,
        String groupAttribute
    ) {}

    /**
     * OpenID Connect relying party settings; present only when an issuer is configured.
     */
    public record OidcSettings(
        String issuer,
        String clientId,
        String clientSecret,
        List<String> scopes,
        String groupsClaim
    ) {}

    public InfraConfig {
        uploadApiKeys = List.copyOf(uploadApiKeys);
        publishApiKeys = List.copyOf(publishApiKeys);
        analyticsAuthKeys = List.copyOf(analyticsAuthKeys);
    }

    /**
     * Cookies carry the Secure attribute whenever the public URL is https.
     */
    public boolean secureCookies() {
        return "https".equalsIgnoreCase(publicUrl.getScheme());
    }

    /**
     * Host (and non-default port) used in Terraform module source strings.
     */
    public String publicHost() {
        if (domainName != null && !domainName.isBlank()) {
            return domainName;
        }
        int port = publicUrl.getPort();
        return port == -1 ? publicUrl.getHost() : publicUrl.getHost() + ":" + port;
    }

    /**
     * Absolute URL for a server-relative path.
     */
    public String absoluteUrl(String path) {
        String base = publicUrl.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + (path.startsWith("/") ? path : "/" + path);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int listenPort = 5000;
        private URI publicUrl = URI.create("http://localhost:5000");
        private String domainName;
        private String databaseUrl = "mongodb://localhost:27017";
        private String dataDirectory = "./data";
        private String uploadDirectory = "./data/upload";
        private long uploadMaxSizeBytes = 100L * 1024 * 1024;
        private byte[] secretKey = new byte[32];
        private Optional<String> adminAuthenticationToken = Optional.empty();
        private List<String> uploadApiKeys = List.of();
        private List<String> publishApiKeys = List.of();
        private List<String> analyticsAuthKeys = List.of();
        private String internalExtractionAnalyticsToken = "internal-terrareg-analytics-token";
        private Duration sessionExpiry = Duration.ofMinutes(60);
        private Duration adminSessionExpiry = Duration.ofMinutes(60);
        private Duration sessionMaxTtl = Duration.ofHours(24);
        private Duration sessionCleanupInterval = Duration.ofHours(1);
        private String sessionCookieName = "terrareg_session";
        private Optional<SamlSettings> saml = Optional.empty();
        private Optional<OidcSettings> oidc = Optional.empty();
        private byte[] presignedUrlSecret = new byte[32];
        private Duration presignedUrlExpiry = Duration.ofSeconds(10);
        private Duration presignedUrlMaxLifetime = Duration.ofHours(1);
        private Duration terraformOidcSessionExpiry = Duration.ofHours(1);
        private String terraformOidcSubjectSalt = "";
        private Duration standardRequestTimeout = Duration.ofSeconds(60);
        private Duration moduleIndexingTimeout = Duration.ofSeconds(1800);
        private Duration terraformLockTimeout = Duration.ofSeconds(1800);
        private Duration gitCloneTimeout = Duration.ofSeconds(300);
        private Optional<String> infracostApiKey = Optional.empty();

        public Builder listenPort(int value) { this.listenPort = value; return this; }
        public Builder publicUrl(URI value) { this.publicUrl = value; return this; }
        public Builder domainName(String value) { this.domainName = value; return this; }
        public Builder databaseUrl(String value) { this.databaseUrl = value; return this; }
        public Builder dataDirectory(String value) { this.dataDirectory = value; return this; }
        public Builder uploadDirectory(String value) { this.uploadDirectory = value; return this; }
        public Builder uploadMaxSizeBytes(long value) { this.uploadMaxSizeBytes = value; return this; }
        public Builder secretKey(byte[] value) { this.secretKey = value; return this; }
        public Builder adminAuthenticationToken(String value) { this.adminAuthenticationToken = Optional.ofNullable(value); return this; }
        public Builder uploadApiKeys(List<String> value) { this.uploadApiKeys = value; return this; }
        public Builder publishApiKeys(List<String> value) { this.publishApiKeys = value; return this; }
        public Builder analyticsAuthKeys(List<String> value) { this.analyticsAuthKeys = value; return this; }
        public Builder internalExtractionAnalyticsToken(String value) { this.internalExtractionAnalyticsToken = value; return this; }
        public Builder sessionExpiry(Duration value) { this.sessionExpiry = value; return this; }
        public Builder adminSessionExpiry(Duration value) { this.adminSessionExpiry = value; return this; }
        public Builder sessionMaxTtl(Duration value) { this.sessionMaxTtl = value; return this; }
        public Builder sessionCleanupInterval(Duration value) { this.sessionCleanupInterval = value; return this; }
        public Builder sessionCookieName(String value) { this.sessionCookieName = value; return this; }
        public Builder saml(SamlSettings value) { this.saml = Optional.ofNullable(value); return this; }
        public Builder oidc(OidcSettings value) { this.oidc = Optional.ofNullable(value); return this; }
        public Builder presignedUrlSecret(byte[] value) { this.presignedUrlSecret = value; return this; }
        public Builder presignedUrlExpiry(Duration value) { this.presignedUrlExpiry = value; return this; }
        public Builder presignedUrlMaxLifetime(Duration value) { this.presignedUrlMaxLifetime = value; return this; }
        public Builder terraformOidcSessionExpiry(Duration value) { this.terraformOidcSessionExpiry = value; return this; }
        public Builder terraformOidcSubjectSalt(String value) { this.terraformOidcSubjectSalt = value; return this; }
        public Builder standardRequestTimeout(Duration value) { this.standardRequestTimeout = value; return this; }
        public Builder moduleIndexingTimeout(Duration value) { this.moduleIndexingTimeout = value; return this; }
        public Builder terraformLockTimeout(Duration value) { this.terraformLockTimeout = value; return this; }
        public Builder gitCloneTimeout(Duration value) { this.gitCloneTimeout = value; return this; }
        public Builder infracostApiKey(String value) { this.infracostApiKey = Optional.ofNullable(value); return this; }

        public InfraConfig build() {
            return new InfraConfig(
                listenPort, publicUrl, domainName, databaseUrl, dataDirectory, uploadDirectory, uploadMaxSizeBytes,
                secretKey, adminAuthenticationToken, uploadApiKeys, publishApiKeys, analyticsAuthKeys,
                internalExtractionAnalyticsToken, sessionExpiry, adminSessionExpiry, sessionMaxTtl,
                sessionCleanupInterval, sessionCookieName, saml, oidc, presignedUrlSecret, presignedUrlExpiry,
                presignedUrlMaxLifetime, terraformOidcSessionExpiry, terraformOidcSubjectSalt,
                standardRequestTimeout, moduleIndexingTimeout, terraformLockTimeout, gitCloneTimeout,
                infracostApiKey);
        }
    }
}
