package tech.terrareg.platform.presign;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.terrareg.platform.config.InfraConfig;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class PresignedUrlServiceTest {

    private static final String PATH = "/v1/terrareg/modules/acme/vpc/aws/1.2.3/source.tar.gz";
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private PresignedUrlService service;

    @BeforeEach
    void setUp() {
        service = new PresignedUrlService();
        service.infraConfig = InfraConfig.builder()
            .publicUrl(URI.create("https://registry.example.com"))
            .presignedUrlSecret("presign-secret-for-tests-0123456789".getBytes(StandardCharsets.UTF_8))
            .presignedUrlExpiry(Duration.ofSeconds(10))
            .presignedUrlMaxLifetime(Duration.ofHours(1))
            .build();
        service.clock = Clock.fixed(NOW, ZoneOffset.UTC);
    }

    @Test
    @DisplayName("A freshly signed URL verifies")
    void verify_shouldAccept_whenUrlUntouched() {
        Map<String, String> query = query(service.sign(PATH));

        assertThat(service.verify(PATH, query.get("ts"), query.get("exp"), query.get("sig"))).isTrue();
    }

    @Test
    @DisplayName("Changing the path, a timestamp or the signature is rejected")
    void verify_shouldReject_whenAnyPartTampered() {
        Map<String, String> q = query(service.sign(PATH));
        String flipped = (q.get("sig").charAt(0) == 'a' ? "b" : "a") + q.get("sig").substring(1);

        assertThat(service.verify(PATH.replace("1.2.3", "1.2.4"), q.get("ts"), q.get("exp"), q.get("sig"))).isFalse();
        assertThat(service.verify(PATH, q.get("ts"), String.valueOf(Long.parseLong(q.get("exp")) + 60), q.get("sig"))).isFalse();
        assertThat(service.verify(PATH, q.get("ts"), q.get("exp"), flipped)).isFalse();
        assertThat(service.verify(PATH, "not-a-number", q.get("exp"), q.get("sig"))).isFalse();
        assertThat(service.verify(PATH, null, null, null)).isFalse();
    }

    @Test
    @DisplayName("URLs are accepted up to and including exp, then rejected")
    void verify_shouldRejectAfterExpiry() {
        Map<String, String> q = query(service.sign(PATH));

        service.clock = Clock.fixed(NOW.plusSeconds(10), ZoneOffset.UTC);
        assertThat(service.verify(PATH, q.get("ts"), q.get("exp"), q.get("sig"))).isTrue();

        service.clock = Clock.fixed(NOW.plusSeconds(11), ZoneOffset.UTC);
        assertThat(service.verify(PATH, q.get("ts"), q.get("exp"), q.get("sig"))).isFalse();
    }

    @Test
    @DisplayName("A correctly signed URL whose lifetime exceeds the maximum is rejected")
    void verify_shouldReject_whenLifetimeExceedsMaximum() {
        Map<String, String> q = query(service.sign(PATH, Duration.ofHours(2)));

        assertThat(service.verify(PATH, q.get("ts"), q.get("exp"), q.get("sig"))).isFalse();
    }

    @Test
    @DisplayName("signAbsolute prefixes the public URL")
    void signAbsolute_shouldUsePublicUrl() {
        assertThat(service.signAbsolute(PATH)).startsWith("https://registry.example.com" + PATH + "?ts=");
    }

    private static Map<String, String> query(String signed) {
        Map<String, String> values = new HashMap<>();
        for (String pair : signed.substring(signed.indexOf('?') + 1).split("&")) {
            String[] kv = pair.split("=", 2);
            values.put(kv[0], kv[1]);
        }
        return values;
    }
}
