package tech.terrareg.platform.authentication.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.terrareg.platform.authentication.AuthMethodType;
import tech.terrareg.platform.error.ErrorKind;
import tech.terrareg.platform.error.RegistryException;
import tech.terrareg.platform.shared.Hashing;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.Optional;

/**
 * Short-lived, single-use state for redirect-based logins.
 *
 * The parameter handed to the identity provider is
 * {@code base64url(sessionId + ":" + state)}. Consuming it deletes the record
 * whether or not it matches.
 */
@ApplicationScoped
public class OAuthStateService {

    private static final Logger LOG = Logger.getLogger(OAuthStateService.class);

    public static final Duration STATE_TTL = Duration.ofMinutes(10);

    @Inject
    SessionService sessionService;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    Clock clock;

    /**
     * A stored state and the opaque parameter to send to the identity provider.
     */
    public record IssuedState(String parameter, OAuthState state) {}

    public IssuedState issue(AuthMethodType method, String redirectUrl) {
        String state = Hashing.randomToken(24);
        String nonce = Hashing.randomToken(16);
        long expiresAt = clock.instant().plus(STATE_TTL).getEpochSecond();
        OAuthState payload = new OAuthState(state, redirectUrl, method, expiresAt, nonce);
        Session record = sessionService.create(SessionKind.OAUTH_STATE, STATE_TTL, toJson(payload));
        String parameter = Base64.getUrlEncoder().withoutPadding()
            .encodeToString((record.id + ":" + state).getBytes(StandardCharsets.UTF_8));
        return new IssuedState(parameter, payload);
    }

    /**
     * Decode, look up and delete the state record.
     *
     * @throws RegistryException INVALID_INPUT if the parameter is malformed, unknown,
     *         expired, already used, or was issued for another login method
     */
    public OAuthState consume(String parameter, AuthMethodType expectedMethod) {
        if (parameter == null || parameter.isEmpty()) {
            throw RegistryException.invalidInput("Missing state parameter");
        }
        String decoded;
        try {
            decoded = new String(Base64.getUrlDecoder().decode(parameter), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new RegistryException(ErrorKind.INVALID_INPUT, "Malformed state parameter", e);
        }
        int separator = decoded.indexOf(':');
        if (separator <= 0) {
            throw RegistryException.invalidInput("Malformed state parameter");
        }
        String sessionId = decoded.substring(0, separator);
        String state = decoded.substring(separator + 1);

        Optional<Session> record = sessionService.take(sessionId, SessionKind.OAUTH_STATE);
        if (record.isEmpty()) {
            LOG.debug("OAuth state not found or expired");
            throw RegistryException.invalidInput("Invalid or expired state");
        }
        OAuthState payload = fromJson(record.get().providerSourceAuth);
        if (!Hashing.constantTimeEquals(payload.state(), state) || payload.authMethod() != expectedMethod) {
            throw RegistryException.invalidInput("Invalid or expired state");
        }
        return payload;
    }

    private String toJson(OAuthState payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize OAuth state", e);
        }
    }

    private OAuthState fromJson(String json) {
        try {
            return objectMapper.readValue(json, OAuthState.class);
        } catch (JsonProcessingException e) {
            throw new RegistryException(ErrorKind.INVALID_INPUT, "Invalid or expired state", e);
        }
    }
}
