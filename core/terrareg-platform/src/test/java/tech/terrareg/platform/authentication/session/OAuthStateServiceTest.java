package tech.terrareg.platform.authentication.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.terrareg.platform.authentication.AuthMethodType;
import tech.terrareg.platform.config.InfraConfig;
import tech.terrareg.platform.error.ErrorKind;
import tech.terrareg.platform.error.RegistryException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.*;

class OAuthStateServiceTest {

    private InMemorySessionRepository repository;
    private MutableClock clock;
    private OAuthStateService service;

    @BeforeEach
    void setUp() {
        repository = new InMemorySessionRepository();
        clock = new MutableClock(Instant.parse("2024-05-01T08:00:00Z"));

        SessionService sessionService = new SessionService();
        sessionService.sessionRepository = repository;
        sessionService.clock = clock;
        sessionService.infraConfig = InfraConfig.builder().sessionMaxTtl(Duration.ofHours(2)).build();

        service = new OAuthStateService();
        service.sessionService = sessionService;
        service.objectMapper = new ObjectMapper();
        service.clock = clock;
    }

    @Test
    @DisplayName("consume returns the issued state once and rejects the second use")
    void consume_shouldRejectReplay() {
        // Arrange
        OAuthStateService.IssuedState issued = service.issue(AuthMethodType.OPENID_CONNECT, "/modules");

        // Act
        OAuthState first = service.consume(issued.parameter(), AuthMethodType.OPENID_CONNECT);

        // Assert
        assertThat(first.redirectUrl()).isEqualTo("/modules");
        assertThat(repository.rows).isEmpty();
        assertInvalid(() -> service.consume(issued.parameter(), AuthMethodType.OPENID_CONNECT));
    }

    @Test
    @DisplayName("concurrent callbacks with the same state: exactly one succeeds")
    void consume_shouldAllowSingleWinner_whenCallbacksRace() throws Exception {
        // Arrange
        OAuthStateService.IssuedState issued = service.issue(AuthMethodType.SAML, "/");
        int callers = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        List<Future<OAuthState>> results = new ArrayList<>();
        Callable<OAuthState> callback = () -> {
            start.await();
            return service.consume(issued.parameter(), AuthMethodType.SAML);
        };

        // Act
        try {
            for (int i = 0; i < callers; i++) {
                results.add(executor.submit(callback));
            }
            start.countDown();

            // Assert
            int succeeded = 0;
            int rejected = 0;
            for (Future<OAuthState> result : results) {
                try {
                    result.get();
                    succeeded++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(RegistryException.class);
                    rejected++;
                }
            }
            assertThat(succeeded).isEqualTo(1);
            assertThat(rejected).isEqualTo(callers - 1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("an expired state is rejected")
    void consume_shouldThrow_whenExpired() {
        // Arrange
        OAuthStateService.IssuedState issued = service.issue(AuthMethodType.OPENID_CONNECT, "/");
        clock.advance(OAuthStateService.STATE_TTL);

        // Act & Assert
        assertInvalid(() -> service.consume(issued.parameter(), AuthMethodType.OPENID_CONNECT));
    }

    @Test
    @DisplayName("a state issued for another login method is rejected and still used up")
    void consume_shouldThrow_whenMethodDiffers() {
        // Arrange
        OAuthStateService.IssuedState issued = service.issue(AuthMethodType.SAML, "/");

        // Act & Assert
        assertInvalid(() -> service.consume(issued.parameter(), AuthMethodType.OPENID_CONNECT));
        assertInvalid(() -> service.consume(issued.parameter(), AuthMethodType.SAML));
    }

    @Test
    @DisplayName("malformed parameters are rejected")
    void consume_shouldThrow_whenMalformed() {
        assertInvalid(() -> service.consume(null, AuthMethodType.SAML));
        assertInvalid(() -> service.consume("%%%", AuthMethodType.SAML));
        assertInvalid(() -> service.consume("bm8tc2VwYXJhdG9y", AuthMethodType.SAML));
    }

    private static void assertInvalid(org.assertj.core.api.ThrowableAssert.ThrowingCallable call) {
        assertThatThrownBy(call)
            .isInstanceOf(RegistryException.class)
            .extracting(e -> ((RegistryException) e).kind())
            .isEqualTo(ErrorKind.INVALID_INPUT);
    }
}
