package tech.terrareg.platform.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("ConfigResolver")
class ConfigResolverTest {

    private static final String SECRET = "0123456789abcdef0123456789abcdef0123456789abcdef0123456789abcdef";

    @Mock
    private TerraregConfig raw;

    @BeforeEach
    void setUp() {
        when(raw.secretKey()).thenReturn(Optional.of(SECRET));
        when(raw.databaseUrl()).thenReturn(Optional.of("mongodb://localhost:27017"));
        when(raw.publicUrl()).thenReturn(Optional.of("https://registry.example.com"));
        when(raw.dataDirectory()).thenReturn("/var/lib/terrareg/");
        when(raw.sessionCookieName()).thenReturn("terrareg_session");
        when(raw.internalExtractionAnalyticsToken()).thenReturn("internal-terrareg-analytics-token");
        when(raw.standardRequestTimeoutSeconds()).thenReturn(10);
        when(raw.moduleIndexingTimeoutSeconds()).thenReturn(300);
        when(raw.terraformLockTimeoutSeconds()).thenReturn(60);
        when(raw.gitCloneTimeout()).thenReturn(300);
        when(raw.sessionExpiryMins()).thenReturn(60);
        when(raw.adminSessionExpiryMins()).thenReturn(60);
        when(raw.sessionMaxTtlMins()).thenReturn(1440);
        when(raw.sessionCleanupIntervalMins()).thenReturn(60);
        when(raw.terraformPresignedUrlExpirySeconds()).thenReturn(10);
        when(raw.terraformPresignedUrlMaxLifetimeSeconds()).thenReturn(300);
        when(raw.terraformOidcIdpSessionExpiry()).thenReturn(3600);
        when(raw.openidConnectScopes()).thenReturn(List.of("openid", "profile"));
    }

    // ==================== Infrastructure ====================

    @Nested
    @DisplayName("resolveInfra")
    class ResolveInfraTests {

        @Test
        @DisplayName("Valid settings resolve with the data directory normalised")
        void resolveInfra_shouldResolve_whenValid() {
            InfraConfig infra = ConfigResolver.resolveInfra(raw);

            assertThat(infra.publicUrl()).isEqualTo(URI.create("https://registry.example.com"));
            assertThat(infra.dataDirectory()).isEqualTo("/var/lib/terrareg");
            assertThat(infra.uploadDirectory()).isEqualTo("/var/lib/terrareg/upload");
            assertThat(infra.secretKey()).hasSize(32);
            assertThat(infra.sessionMaxTtl()).isEqualTo(Duration.ofDays(1));
            assertThat(infra.saml()).isNull();
            assertThat(infra.oidc()).isNull();
        }

        @Test
        @DisplayName("Every missing required setting is reported in one error")
        void resolveInfra_shouldListAllProblems_whenRequiredMissing() {
            when(raw.secretKey()).thenReturn(Optional.empty());
            when(raw.databaseUrl()).thenReturn(Optional.of("  "));
            when(raw.publicUrl()).thenReturn(Optional.empty());

            assertThatThrownBy(() -> ConfigResolver.resolveInfra(raw))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("SECRET_KEY must be set")
                .hasMessageContaining("DATABASE_URL must be set")
                .hasMessageContaining("PUBLIC_URL must be set");
        }

        @Test
        @DisplayName("A secret key shorter than 32 bytes is rejected")
        void resolveInfra_shouldReject_whenSecretKeyShort() {
            when(raw.secretKey()).thenReturn(Optional.of("too-short"));

            assertThatThrownBy(() -> ConfigResolver.resolveInfra(raw))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("at least 32 bytes");
        }

        @Test
        @DisplayName("A relative public URL is rejected")
        void resolveInfra_shouldReject_whenPublicUrlRelative() {
            when(raw.publicUrl()).thenReturn(Optional.of("registry.example.com/path"));

            assertThatThrownBy(() -> ConfigResolver.resolveInfra(raw))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("PUBLIC_URL must be an absolute http(s) URL");
        }

        @Test
        @DisplayName("Non-positive timeouts are rejected")
        void resolveInfra_shouldReject_whenTimeoutNotPositive() {
            when(raw.gitCloneTimeout()).thenReturn(0);

            assertThatThrownBy(() -> ConfigResolver.resolveInfra(raw))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("GIT_CLONE_TIMEOUT must be greater than zero");
        }

        @Test
        @DisplayName("The presign secret is derived from the secret key when unset")
        void resolveInfra_shouldDerivePresignSecret_whenUnset() {
            InfraConfig infra = ConfigResolver.resolveInfra(raw);

            assertThat(infra.presignedUrlSecret()).hasSize(32).isNotEqualTo(infra.secretKey());
            assertThat(ConfigResolver.resolveInfra(raw).presignedUrlSecret()).isEqualTo(infra.presignedUrlSecret());
        }

        @Test
        @DisplayName("SAML needs entity id and both keys once a metadata URL is set")
        void resolveInfra_shouldReject_whenSamlIncomplete() {
            when(raw.saml2IdpMetadataUrl()).thenReturn(Optional.of("https://idp.example.com/metadata"));
            when(raw.saml2EntityId()).thenReturn(Optional.of("terrareg"));

            assertThatThrownBy(() -> ConfigResolver.resolveInfra(raw))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("SAML2_PUBLIC_KEY")
                .hasMessageContaining("SAML2_PRIVATE_KEY");
        }

        @Test
        @DisplayName("OIDC settings are resolved when issuer and client credentials are set")
        void resolveInfra_shouldResolveOidc_whenComplete() {
            when(raw.openidConnectIssuer()).thenReturn(Optional.of("https://idp.example.com/"));
            when(raw.openidConnectClientId()).thenReturn(Optional.of("terrareg"));
            when(raw.openidConnectClientSecret()).thenReturn(Optional.of("secret"));

            InfraConfig infra = ConfigResolver.resolveInfra(raw);

            assertThat(infra.oidc()).isNotNull();
            assertThat(infra.oidc().orElseThrow().issuer()).isEqualTo("https://idp.example.com");
        }
    }

    // ==================== Secret decoding ====================

    @Test
    @DisplayName("Hex secrets are decoded and other values are taken as UTF-8")
    void decodeSecretKey_shouldHandleHexAndText() {
        assertThat(ConfigResolver.decodeSecretKey("0aff")).containsExactly(0x0a, 0xff);
        assertThat(ConfigResolver.decodeSecretKey("not hex"))
            .isEqualTo("not hex".getBytes(StandardCharsets.UTF_8));
    }

    // ==================== Domain ====================

    @Test
    @DisplayName("Domain settings parse hosting mode and clean example extensions")
    void resolveDomain_shouldNormaliseValues() {
        when(raw.allowModuleHosting()).thenReturn("Enforce");
        when(raw.exampleFileExtensions()).thenReturn(List.of(".tf", " tfvars ", ""));
        when(raw.trustedNamespaces()).thenReturn(Optional.of(List.of(" hashicorp ", "")));
        when(raw.analyticsTokenDescription()).thenReturn(Optional.empty());

        DomainConfig domain = ConfigResolver.resolveDomain(raw);

        assertThat(domain.allowModuleHosting()).isEqualTo(ModuleHostingMode.ENFORCE);
        assertThat(domain.exampleFileExtensions()).containsExactly("tf", "tfvars");
        assertThat(domain.trustedNamespaces()).containsExactly("hashicorp");
        assertThat(domain.analyticsTokenDescription()).isEmpty();
    }

    @Test
    @DisplayName("Unknown hosting modes fall back to ALLOW")
    void parseHostingMode_shouldDefaultToAllow() {
        assertThat(ModuleHostingMode.parse("sometimes")).isEqualTo(ModuleHostingMode.ALLOW);
        assertThat(ModuleHostingMode.parse(null)).isEqualTo(ModuleHostingMode.ALLOW);
        assertThat(ModuleHostingMode.parse(" DISALLOW ")).isEqualTo(ModuleHostingMode.DISALLOW);
    }
}
