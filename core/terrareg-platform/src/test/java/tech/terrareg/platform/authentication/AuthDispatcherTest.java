package tech.terrareg.platform.authentication;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AuthDispatcherTest {

    @Mock
    private TokenAuth adminApiKey;

    @Mock
    private SessionAuth sessionMethod;

    @Mock
    private TokenAuth uploadApiKey;

    @Mock
    private BearerAuth analyticsKey;

    @Mock
    private SessionResolver sessionResolver;

    private final ActiveSession activeSession = new ActiveSession(null, null, null);

    private AuthDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        stub(adminApiKey, AuthMethodType.ADMIN_API_KEY);
        stub(sessionMethod, AuthMethodType.OPENID_CONNECT);
        stub(uploadApiKey, AuthMethodType.UPLOAD_API_KEY);
        stub(analyticsKey, AuthMethodType.TERRAFORM_ANALYTICS_AUTH_KEY);
        dispatcher = new AuthDispatcher(List.of(adminApiKey, sessionMethod, uploadApiKey, analyticsKey), sessionResolver);
    }

    @Test
    @DisplayName("The highest-priority recognizer wins when several accept the request")
    void authenticate_shouldPreferEarlierMethod_whenMultipleCredentialsPresent() {
        // Arrange
        when(adminApiKey.authenticate("key")).thenReturn(Optional.of(context(AuthMethodType.ADMIN_API_KEY)));
        when(uploadApiKey.authenticate("key")).thenReturn(Optional.of(context(AuthMethodType.UPLOAD_API_KEY)));
        when(sessionResolver.resolve(any())).thenReturn(Optional.of(activeSession));
        when(sessionMethod.authenticate(activeSession)).thenReturn(Optional.of(context(AuthMethodType.OPENID_CONNECT)));

        // Act
        AuthContext result = dispatcher.authenticate(request(Map.of("X-Terrareg-ApiKey", "key")));

        // Assert
        assertThat(result.providerType()).isEqualTo(AuthMethodType.ADMIN_API_KEY);
        verifyNoInteractions(sessionResolver);
    }

    @Test
    @DisplayName("Disabled methods are skipped")
    void authenticate_shouldSkipDisabledMethods() {
        // Arrange
        when(adminApiKey.isEnabled()).thenReturn(false);
        when(adminApiKey.authenticate("key")).thenReturn(Optional.of(context(AuthMethodType.ADMIN_API_KEY)));
        when(uploadApiKey.authenticate("key")).thenReturn(Optional.of(context(AuthMethodType.UPLOAD_API_KEY)));
        when(sessionResolver.resolve(any())).thenReturn(Optional.empty());

        // Act
        AuthContext result = dispatcher.authenticate(request(Map.of("x-terrareg-apikey", "key")));

        // Assert
        assertThat(result.providerType()).isEqualTo(AuthMethodType.UPLOAD_API_KEY);
        verify(adminApiKey, never()).authenticate(anyString());
    }

    @Test
    @DisplayName("A session beats an upload key presented on the same request")
    void authenticate_shouldPreferSession_overUploadKey() {
        // Arrange
        when(adminApiKey.authenticate("upload")).thenReturn(Optional.empty());
        when(uploadApiKey.authenticate("upload")).thenReturn(Optional.of(context(AuthMethodType.UPLOAD_API_KEY)));
        when(sessionResolver.resolve(any())).thenReturn(Optional.of(activeSession));
        when(sessionMethod.authenticate(activeSession)).thenReturn(Optional.of(context(AuthMethodType.OPENID_CONNECT)));

        // Act
        AuthContext result = dispatcher.authenticate(request(Map.of("X-Terrareg-ApiKey", "upload")));

        // Assert
        assertThat(result.providerType()).isEqualTo(AuthMethodType.OPENID_CONNECT);
        verify(uploadApiKey, never()).authenticate(anyString());
    }

    @Test
    @DisplayName("Bearer tokens reach only bearer recognizers")
    void authenticate_shouldRouteBearerToken() {
        // Arrange
        when(sessionResolver.resolve(any())).thenReturn(Optional.empty());
        when(analyticsKey.authenticate("tf-token")).thenReturn(Optional.of(context(AuthMethodType.TERRAFORM_ANALYTICS_AUTH_KEY)));

        // Act
        AuthContext result = dispatcher.authenticate(request(Map.of("Authorization", "Bearer tf-token")));

        // Assert
        assertThat(result.providerType()).isEqualTo(AuthMethodType.TERRAFORM_ANALYTICS_AUTH_KEY);
        verify(adminApiKey, never()).authenticate(anyString());
    }

    @Test
    @DisplayName("No credentials yields the unauthenticated context")
    void authenticate_shouldReturnNotAuthenticated_whenNothingMatches() {
        // Arrange
        when(sessionResolver.resolve(any())).thenReturn(Optional.empty());

        // Act
        AuthContext result = dispatcher.authenticate(request(Map.of()));

        // Assert
        assertThat(result).isSameAs(AuthContext.notAuthenticated());
        assertThat(result.isAuthenticated()).isFalse();
    }

    private static void stub(AuthMethod method, AuthMethodType type) {
        when(method.type()).thenReturn(type);
        when(method.isEnabled()).thenReturn(true);
    }

    private static AuthContext context(AuthMethodType type) {
        return AuthContext.builder(type).username(type.name().toLowerCase()).build();
    }

    private static AuthRequest request(Map<String, String> headers) {
        return new AuthRequest(headers, Map.of(), "/v1/modules");
    }
}
