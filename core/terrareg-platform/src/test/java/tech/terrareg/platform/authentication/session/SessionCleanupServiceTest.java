package tech.terrareg.platform.authentication.session;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.terrareg.platform.authentication.terraform.TerraformIdpService;
import tech.terrareg.platform.config.InfraConfig;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionCleanupServiceTest {

    @Mock
    private TerraformIdpService terraformIdpService;

    private InMemorySessionRepository repository;
    private MutableClock clock;
    private SessionService sessionService;
    private SessionCleanupService cleanupService;

    @BeforeEach
    void setUp() {
        repository = new InMemorySessionRepository();
        clock = new MutableClock(Instant.parse("2024-05-01T08:00:00Z"));
        sessionService = new SessionService();
        sessionService.sessionRepository = repository;
        sessionService.clock = clock;
        sessionService.infraConfig = InfraConfig.builder().build();

        cleanupService = new SessionCleanupService();
        cleanupService.sessionService = sessionService;
        cleanupService.terraformIdpService = terraformIdpService;
    }

    @Test
    @DisplayName("cleanup removes expired rows of every kind and leaves live ones")
    void cleanup_shouldRemoveOnlyExpiredRows() {
        // Arrange
        sessionService.create(Duration.ofMinutes(5), "{}");
        Session live = sessionService.create(Duration.ofHours(1), "{}");
        sessionService.create(SessionKind.OAUTH_STATE, Duration.ofMinutes(5), "{}");
        when(terraformIdpService.deleteExpired()).thenReturn(2L);
        clock.advance(Duration.ofMinutes(10));

        // Act
        SessionCleanupService.CleanupResult result = cleanupService.cleanup();

        // Assert
        assertThat(result.sessions()).isEqualTo(1);
        assertThat(result.oauthStates()).isEqualTo(1);
        assertThat(result.terraformCredentials()).isEqualTo(2);
        assertThat(repository.rows).containsOnlyKeys(live.id);
    }

    @Test
    @DisplayName("A second run with nothing new deletes nothing")
    void cleanup_shouldBeIdempotent() {
        // Arrange
        sessionService.create(Duration.ofMinutes(5), "{}");
        when(terraformIdpService.deleteExpired()).thenReturn(1L, 0L);
        clock.advance(Duration.ofMinutes(10));

        // Act & Assert
        assertThat(cleanupService.cleanup().total()).isEqualTo(2);
        assertThat(cleanupService.cleanup().total()).isZero();
    }

    @Test
    @DisplayName("A failing step is logged and does not stop the others")
    void cleanup_shouldContinue_whenOneStepFails() {
        // Arrange
        sessionService.create(Duration.ofMinutes(5), "{}");
        when(terraformIdpService.deleteExpired()).thenThrow(new IllegalStateException("database unavailable"));
        clock.advance(Duration.ofMinutes(10));

        // Act
        SessionCleanupService.CleanupResult result = cleanupService.cleanup();

        // Assert
        assertThat(result.sessions()).isEqualTo(1);
        assertThat(result.terraformCredentials()).isZero();
    }
}
