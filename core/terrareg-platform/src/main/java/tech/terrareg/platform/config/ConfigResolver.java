package tech.terrareg.platform.config;

import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Validates the raw {@link TerraregConfig} once at startup and publishes the
 * immutable {@link DomainConfig} and {@link InfraConfig} beans.
 *
 * Any violation aborts boot with a {@link ConfigurationException} listing every problem found.
 */
@Startup
@ApplicationScoped
public class ConfigResolver {

    private static final Logger LOG = Logger.getLogger(ConfigResolver.class);

    static final int MIN_SECRET_KEY_BYTES = 32;
    private static final Pattern HEX = Pattern.compile("^(?:[0-9a-fA-F]{2})+$");
    private static final String PRESIGN_KEY_LABEL = "terrareg-presigned-url";

    @Inject
    TerraregConfig config;

    private DomainConfig domainConfig;
    private InfraConfig infraConfig;

    @PostConstruct
    void init() {
        this.domainConfig = resolveDomain(config);
        this.infraConfig = resolveInfra(config);
        LOG.infof("Configuration resolved: public URL %s, module hosting %s, data directory %s",
            infraConfig.publicUrl(), domainConfig.allowModuleHosting(), infraConfig.dataDirectory());
    }

    @Produces
    @Singleton
    DomainConfig domainConfig() {
        return domainConfig;
    }

    @Produces
    @Singleton
    InfraConfig infraConfig() {
        return infraConfig;
    }

    // ==================== Resolution ====================

    public static DomainConfig resolveDomain(TerraregConfig raw) {
        return DomainConfig.builder()
            .allowModuleHosting(ModuleHostingMode.parse(raw.allowModuleHosting()))
            .allowProviderHosting(raw.allowProviderHosting())
            .autoCreateNamespace(raw.autoCreateNamespace())
            .autoCreateModuleProvider(raw.autoCreateModuleProvider())
            .autoPublishModuleVersions(raw.autoPublishModuleVersions())
            .trustedNamespaces(cleanList(raw.trustedNamespaces()))
            .verifiedModuleNamespaces(cleanList(raw.verifiedModuleNamespaces()))
            .trustedNamespaceLabel(raw.trustedNamespaceLabel())
            .contributedNamespaceLabel(raw.contributedNamespaceLabel())
            .verifiedModuleLabel(raw.verifiedModuleLabel())
            .analyticsTokenPhrase(raw.analyticsTokenPhrase())
            .analyticsTokenDescription(raw.analyticsTokenDescription().orElse(""))
            .exampleAnalyticsToken(raw.exampleAnalyticsToken())
            .disableAnalytics(raw.disableAnalytics())
            .allowUnidentifiedDownloads(raw.allowUnidentifiedDownloads())
            .enableSecurityScanning(raw.enableSecurityScanning())
            .requiredModuleMetadataAttributes(cleanList(raw.requiredModuleMetadataAttributes()))
            .exampleFileExtensions(raw.exampleFileExtensions().stream()
                .map(String::trim)
                .map(ext -> ext.startsWith(".") ? ext.substring(1) : ext)
                .filter(ext -> !ext.isEmpty())
                .toList())
            .modulesDirectory(raw.modulesDirectory())
            .examplesDirectory(raw.examplesDirectory())
            .build();
    }

    public static InfraConfig resolveInfra(TerraregConfig raw) {
        List<String> problems = new ArrayList<>();

        byte[] secretKey = null;
        Optional<String> secretKeyValue = nonBlank(raw.secretKey());
        if (secretKeyValue.isEmpty()) {
            problems.add("SECRET_KEY must be set");
        } else {
            secretKey = decodeSecretKey(secretKeyValue.get());
            if (secretKey.length < MIN_SECRET_KEY_BYTES) {
                problems.add("SECRET_KEY must decode to at least " + MIN_SECRET_KEY_BYTES + " bytes");
            }
        }

        Optional<String> databaseUrl = nonBlank(raw.databaseUrl());
        if (databaseUrl.isEmpty()) {
            problems.add("DATABASE_URL must be set");
        }

        URI publicUrl = null;
        Optional<String> publicUrlValue = nonBlank(raw.publicUrl());
        if (publicUrlValue.isEmpty()) {
            problems.add("PUBLIC_URL must be set");
        } else {
            publicUrl = parsePublicUrl(publicUrlValue.get(), problems);
        }

        InfraConfig.SamlSettings saml = resolveSaml(raw, problems);
        InfraConfig.OidcSettings oidc = resolveOidc(raw, problems);

        requirePositive("STANDARD_REQUEST_TIMEOUT_SECONDS", raw.standardRequestTimeoutSeconds(), problems);
        requirePositive("MODULE_INDEXING_TIMEOUT_SECONDS", raw.moduleIndexingTimeoutSeconds(), problems);
        requirePositive("TERRAFORM_LOCK_TIMEOUT_SECONDS", raw.terraformLockTimeoutSeconds(), problems);
        requirePositive("GIT_CLONE_TIMEOUT", raw.gitCloneTimeout(), problems);
        requirePositive("SESSION_EXPIRY_MINS", raw.sessionExpiryMins(), problems);
        requirePositive("ADMIN_SESSION_EXPIRY_MINS", raw.adminSessionExpiryMins(), problems);
        requirePositive("SESSION_MAX_TTL_MINS", raw.sessionMaxTtlMins(), problems);
        requirePositive("SESSION_CLEANUP_INTERVAL_MINS", raw.sessionCleanupIntervalMins(), problems);
        requirePositive("TERRAFORM_PRESIGNED_URL_EXPIRY_SECONDS", raw.terraformPresignedUrlExpirySeconds(), problems);
        requirePositive("TERRAFORM_PRESIGNED_URL_MAX_LIFETIME_SECONDS", raw.terraformPresignedUrlMaxLifetimeSeconds(), problems);
        requirePositive("TERRAFORM_OIDC_IDP_SESSION_EXPIRY", raw.terraformOidcIdpSessionExpiry(), problems);

        if (!problems.isEmpty()) {
            throw new ConfigurationException("Invalid configuration: " + String.join("; ", problems));
        }

        byte[] sessionKey = secretKey;
        byte[] presignSecret = nonBlank(raw.terraformPresignedUrlSecret())
            .map(ConfigResolver::decodeSecretKey)
            .orElseGet(() -> deriveKey(sessionKey, PRESIGN_KEY_LABEL));

        String dataDirectory = stripTrailingSlash(raw.dataDirectory());

        return InfraConfig.builder()
            .listenPort(raw.listenPort())
            .publicUrl(publicUrl)
            .domainName(nonBlank(raw.domainName()).orElse(null))
            .databaseUrl(databaseUrl.get())
            .dataDirectory(dataDirectory)
            .uploadDirectory(nonBlank(raw.uploadDirectory()).orElse(dataDirectory + "/upload"))
            .uploadMaxSizeBytes(raw.uploadMaxSizeBytes())
            .secretKey(secretKey)
            .adminAuthenticationToken(nonBlank(raw.adminAuthenticationToken()).orElse(null))
            .uploadApiKeys(cleanList(raw.uploadApiKeys()))
            .publishApiKeys(cleanList(raw.publishApiKeys()))
            .analyticsAuthKeys(cleanList(raw.analyticsAuthKeys()))
            .internalExtractionAnalyticsToken(raw.internalExtractionAnalyticsToken())
            .sessionExpiry(Duration.ofMinutes(raw.sessionExpiryMins()))
            .adminSessionExpiry(Duration.ofMinutes(raw.adminSessionExpiryMins()))
            .sessionMaxTtl(Duration.ofMinutes(raw.sessionMaxTtlMins()))
            .sessionCleanupInterval(Duration.ofMinutes(raw.sessionCleanupIntervalMins()))
            .sessionCookieName(raw.sessionCookieName())
            .saml(saml)
            .oidc(oidc)
            .presignedUrlSecret(presignSecret)
            .presignedUrlExpiry(Duration.ofSeconds(raw.terraformPresignedUrlExpirySeconds()))
            .presignedUrlMaxLifetime(Duration.ofSeconds(raw.terraformPresignedUrlMaxLifetimeSeconds()))
            .terraformOidcSessionExpiry(Duration.ofSeconds(raw.terraformOidcIdpSessionExpiry()))
            .terraformOidcSubjectSalt(nonBlank(raw.terraformOidcIdpSubjectIdHashSalt()).orElse(""))
            .standardRequestTimeout(Duration.ofSeconds(raw.standardRequestTimeoutSeconds()))
            .moduleIndexingTimeout(Duration.ofSeconds(raw.moduleIndexingTimeoutSeconds()))
            .terraformLockTimeout(Duration.ofSeconds(raw.terraformLockTimeoutSeconds()))
            .gitCloneTimeout(Duration.ofSeconds(raw.gitCloneTimeout()))
            .infracostApiKey(nonBlank(raw.infracostApiKey()).orElse(null))
            .build();
    }

    /**
     * Hex-decoded when the value is valid hex, raw UTF-8 bytes otherwise.
     */
    static byte[] decodeSecretKey(String value) {
        String trimmed = value.trim();
        if (HEX.matcher(trimmed).matches()) {
            return HexFormat.of().parseHex(trimmed);
        }
        return trimmed.getBytes(StandardCharsets.UTF_8);
    }

    private static InfraConfig.SamlSettings resolveSaml(TerraregConfig raw, List<String> problems) {
        Optional<String> metadataUrl = nonBlank(raw.saml2IdpMetadataUrl());
        if (metadataUrl.isEmpty()) {
            return null;
        }
        Optional<String> entityId = nonBlank(raw.saml2EntityId());
        Optional<String> publicKey = nonBlank(raw.saml2PublicKey());
        Optional<String> privateKey = nonBlank(raw.saml2PrivateKey());
        if (entityId.isEmpty()) {
            problems.add("SAML2_ENTITY_ID is required when SAML2_IDP_METADATA_URL is set");
        }
        if (publicKey.isEmpty()) {
            problems.add("SAML2_PUBLIC_KEY is required when SAML2_IDP_METADATA_URL is set");
        }
        if (privateKey.isEmpty()) {
            problems.add("SAML2_PRIVATE_KEY is required when SAML2_IDP_METADATA_URL is set");
        }
        if (entityId.isEmpty() || publicKey.isEmpty() || privateKey.isEmpty()) {
            return null;
        }
        return new InfraConfig.SamlSettings(
            metadataUrl.get(), entityId.get(), publicKey.get(), privateKey.get(), raw.saml2GroupAttribute());
    }

    private static InfraConfig.OidcSettings resolveOidc(TerraregConfig raw, List<String> problems) {
        Optional<String> issuer = nonBlank(raw.openidConnectIssuer());
        if (issuer.isEmpty()) {
            return null;
        }
        Optional<String> clientId = nonBlank(raw.openidConnectClientId());
        Optional<String> clientSecret = nonBlank(raw.openidConnectClientSecret());
        if (clientId.isEmpty() || clientSecret.isEmpty()) {
            problems.add("OPENID_CONNECT_CLIENT_ID and OPENID_CONNECT_CLIENT_SECRET are required when OPENID_CONNECT_ISSUER is set");
            return null;
        }
        return new InfraConfig.OidcSettings(
            stripTrailingSlash(issuer.get()), clientId.get(), clientSecret.get(),
            cleanList(Optional.of(raw.openidConnectScopes())), raw.openidConnectGroupsClaim());
    }

    private static URI parsePublicUrl(String value, List<String> problems) {
        try {
            URI uri = new URI(value.trim());
            String scheme = uri.getScheme();
            if (scheme == null || uri.getHost() == null
                || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                problems.add("PUBLIC_URL must be an absolute http(s) URL");
                return null;
            }
            return uri;
        } catch (URISyntaxException e) {
            problems.add("PUBLIC_URL is not a valid URL: " + e.getMessage());
            return null;
        }
    }

    private static byte[] deriveKey(byte[] secretKey, String label) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secretKey, "HmacSHA256"));
            return mac.doFinal(label.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 not available", e);
        }
    }

    private static void requirePositive(String name, int value, List<String> problems) {
        if (value <= 0) {
            problems.add(name + " must be greater than zero");
        }
    }

    private static Optional<String> nonBlank(Optional<String> value) {
        return value.map(String::trim).filter(v -> !v.isEmpty());
    }

    private static List<String> cleanList(Optional<List<String>> values) {
        return values.orElse(List.of()).stream()
            .map(String::trim)
            .filter(v -> !v.isEmpty())
            .toList();
    }

    private static String stripTrailingSlash(String value) {
        String trimmed = value.trim();
        while (trimmed.length() > 1 && trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
