package tech.terrareg.platform.authentication.sso;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.terrareg.platform.authentication.AuthMethodType;
import tech.terrareg.platform.authentication.session.OAuthState;
import tech.terrareg.platform.config.InfraConfig;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

class SamlLoginServiceTest {

    @Test
    @DisplayName("the AuthnRequest carries the ID the callback expects in InResponseTo")
    void authnRequest_shouldUseStateRequestId() {
        // Arrange
        SamlLoginService service = new SamlLoginService();
        service.infraConfig = InfraConfig.builder().publicUrl(URI.create("https://registry.example.com/")).build();
        service.clock = Clock.fixed(Instant.parse("2024-05-01T08:00:00Z"), ZoneOffset.UTC);
        OAuthState state = new OAuthState("state", "/", AuthMethodType.SAML, 0L, "bm9uY2UtdmFsdWU");
        InfraConfig.SamlSettings saml = new InfraConfig.SamlSettings(
            "https://idp.example.com/metadata", "https://registry.example.com", "", "", "groups");
        SamlIdpMetadata idp = new SamlIdpMetadata("https://idp.example.com", "https://idp.example.com/sso", null);

        // Act
        String request = service.authnRequest(saml, idp, SamlLoginService.requestId(state));

        // Assert
        assertThat(SamlLoginService.requestId(state)).isEqualTo("_bm9uY2UtdmFsdWU");
        assertThat(request)
            .contains("ID=\"_bm9uY2UtdmFsdWU\"")
            .contains("AssertionConsumerServiceURL=\"https://registry.example.com/saml/acs\"");
    }
}
