package tech.terrareg.platform.authentication.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.terrareg.platform.config.InfraConfig;
import tech.terrareg.platform.error.InvalidSessionCookieException;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.*;

class SessionCookieServiceTest {

    private SessionCookieService service;

    @BeforeEach
    void setUp() {
        service = new SessionCookieService();
        service.infraConfig = InfraConfig.builder()
            .secretKey("cookie-secret-for-tests-0123456789".getBytes(StandardCharsets.UTF_8))
            .build();
        service.objectMapper = new ObjectMapper();
        service.init();
    }

    @Test
    @DisplayName("An issued cookie reads back to the same session data")
    void read_shouldReturnEncodedData() {
        String cookie = service.encode(new SessionData("session-1", true, "csrf"));

        SessionData data = service.read(cookie);

        assertThat(data.sessionId()).isEqualTo("session-1");
        assertThat(data.adminAuthenticated()).isTrue();
    }

    @Test
    @DisplayName("Flipping any single byte of the cookie makes it invalid")
    void read_shouldReject_whenAnyByteFlipped() {
        String cookie = service.encode(new SessionData("session-1", false, "csrf"));
        byte[] raw = Base64.getUrlDecoder().decode(cookie);

        for (int i = 0; i < raw.length; i++) {
            byte[] tampered = raw.clone();
            tampered[i] ^= 0x01;
            String value = Base64.getUrlEncoder().withoutPadding().encodeToString(tampered);

            assertThatThrownBy(() -> service.read(value))
                .as("byte %d", i)
                .isInstanceOf(InvalidSessionCookieException.class);
        }
    }

    @Test
    @DisplayName("Garbage and truncated values are invalid, not server errors")
    void read_shouldReject_whenMalformed() {
        assertThatThrownBy(() -> service.read("%%%not-base64%%%")).isInstanceOf(InvalidSessionCookieException.class);
        assertThatThrownBy(() -> service.read("AAAA")).isInstanceOf(InvalidSessionCookieException.class);
    }

    @Test
    @DisplayName("A cookie encrypted with another secret is rejected")
    void read_shouldReject_whenKeyDiffers() {
        CookieCipher other = new CookieCipher("a-different-secret-key-0123456789".getBytes(StandardCharsets.UTF_8));
        String foreign = other.encrypt("{\"session_id\":\"x\"}".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> service.read(foreign)).isInstanceOf(InvalidSessionCookieException.class);
    }
}
