package tech.terrareg.platform.authentication.session;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.terrareg.platform.config.InfraConfig;
import tech.terrareg.platform.error.ErrorKind;
import tech.terrareg.platform.error.RegistryException;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class SessionServiceTest {

    private InMemorySessionRepository repository;
    private MutableClock clock;
    private SessionService service;

    @BeforeEach
    void setUp() {
        repository = new InMemorySessionRepository();
        clock = new MutableClock(Instant.parse("2024-05-01T08:00:00Z"));
        service = new SessionService();
        service.sessionRepository = repository;
        service.clock = clock;
        service.infraConfig = InfraConfig.builder().sessionMaxTtl(Duration.ofHours(2)).build();
    }

    @Test
    @DisplayName("create issues a random id and caps the TTL at the configured maximum")
    void create_shouldCapTtl() {
        // Act
        Session session = service.create(Duration.ofDays(3), "{}");

        // Assert
        assertThat(session.id).isNotBlank();
        assertThat(session.expiry).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
        assertThat(service.create(Duration.ofMinutes(5), "{}").id).isNotEqualTo(session.id);
    }

    @Test
    @DisplayName("validate returns the session until expiry and deletes it afterwards")
    void validate_shouldDeleteExpiredSession() {
        // Arrange
        Session session = service.create(Duration.ofMinutes(30), "{}");

        // Act & Assert
        clock.advance(Duration.ofMinutes(29));
        assertThat(service.validate(session.id)).isPresent();

        clock.advance(Duration.ofMinutes(1));
        assertThat(service.validate(session.id)).isEmpty();
        assertThat(repository.rows).doesNotContainKey(session.id);
    }

    @Test
    @DisplayName("validate ignores rows of another kind")
    void validate_shouldIgnoreOtherKinds() {
        // Arrange
        Session state = service.create(SessionKind.OAUTH_STATE, Duration.ofMinutes(10), "{}");

        // Act & Assert
        assertThat(service.validate(state.id)).isEmpty();
        assertThat(service.validate(state.id, SessionKind.OAUTH_STATE)).isPresent();
    }

    @Test
    @DisplayName("refresh of an expired session fails with SESSION_EXPIRED")
    void refresh_shouldThrow_whenExpired() {
        // Arrange
        Session session = service.create(Duration.ofMinutes(1), "{}");
        clock.advance(Duration.ofMinutes(2));

        // Act & Assert
        assertThatThrownBy(() -> service.refresh(session.id, Duration.ofMinutes(10)))
            .isInstanceOf(RegistryException.class)
            .extracting(e -> ((RegistryException) e).kind())
            .isEqualTo(ErrorKind.SESSION_EXPIRED);
    }

    @Test
    @DisplayName("delete is idempotent")
    void delete_shouldBeIdempotent() {
        // Arrange
        Session session = service.create(Duration.ofMinutes(10), "{}");

        // Act
        service.delete(session.id);
        service.delete(session.id);
        service.delete(null);

        // Assert
        assertThat(repository.rows).isEmpty();
    }
}
