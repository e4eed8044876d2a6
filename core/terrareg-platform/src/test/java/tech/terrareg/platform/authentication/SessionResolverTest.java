package tech.terrareg.platform.authentication;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.terrareg.platform.authentication.session.Session;
import tech.terrareg.platform.authentication.session.SessionCookieService;
import tech.terrareg.platform.authentication.session.SessionData;
import tech.terrareg.platform.authentication.session.SessionService;
import tech.terrareg.platform.error.InvalidSessionCookieException;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SessionResolver")
class SessionResolverTest {

    private static final String COOKIE = "terrareg_session";

    @Mock
    private SessionCookieService sessionCookieService;

    @Mock
    private SessionService sessionService;

    private SessionResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new SessionResolver();
        resolver.sessionCookieService = sessionCookieService;
        resolver.sessionService = sessionService;
        resolver.claimsCodec = new ClaimsCodec(new ObjectMapper());
        when(sessionCookieService.cookieName()).thenReturn(COOKIE);
    }

    private static AuthRequest withCookie(String value) {
        return new AuthRequest(Map.of(), Map.of(COOKIE, value), "/v1/terrareg/auth/admin/is_authenticated");
    }

    @Test
    @DisplayName("No cookie resolves to empty without touching the session store")
    void resolve_shouldReturnEmpty_whenNoCookie() {
        // Act
        Optional<ActiveSession> result = resolver.resolve(new AuthRequest(Map.of(), Map.of(), "/"));

        // Assert
        assertThat(result).isEmpty();
        verifyNoInteractions(sessionService);
    }

    @Test
    @DisplayName("A tampered cookie resolves to empty instead of failing the request")
    void resolve_shouldReturnEmpty_whenCookieTampered() {
        // Arrange
        when(sessionCookieService.read("tampered"))
            .thenThrow(new InvalidSessionCookieException("Session cookie failed authentication"));

        // Act & Assert
        assertThat(resolver.resolve(withCookie("tampered"))).isEmpty();
        verifyNoInteractions(sessionService);
    }

    @Test
    @DisplayName("A cookie whose session is gone resolves to empty")
    void resolve_shouldReturnEmpty_whenSessionMissing() {
        // Arrange
        when(sessionCookieService.read("valid")).thenReturn(new SessionData("abc", false, "csrf"));
        when(sessionService.validate("abc")).thenReturn(Optional.empty());

        // Act & Assert
        assertThat(resolver.resolve(withCookie("valid"))).isEmpty();
    }

    @Test
    @DisplayName("A valid cookie yields the session with its stored claims")
    void resolve_shouldReturnActiveSession_whenValid() {
        // Arrange
        Session session = new Session();
        session.id = "abc";
        session.providerSourceAuth = "{\"kind\":\"admin_session\",\"username\":\"admin\"}";
        when(sessionCookieService.read("valid")).thenReturn(new SessionData("abc", true, "csrf"));
        when(sessionService.validate("abc")).thenReturn(Optional.of(session));

        // Act
        Optional<ActiveSession> result = resolver.resolve(withCookie("valid"));

        // Assert
        assertThat(result).isPresent();
        assertThat(result.get().claims()).isEqualTo(new ProviderClaims.AdminSession("admin"));
        assertThat(result.get().cookie().adminAuthenticated()).isTrue();
    }
}
