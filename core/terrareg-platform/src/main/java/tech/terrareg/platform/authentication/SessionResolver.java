package tech.terrareg.platform.authentication;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.terrareg.platform.authentication.session.Session;
import tech.terrareg.platform.authentication.session.SessionCookieService;
import tech.terrareg.platform.authentication.session.SessionData;
import tech.terrareg.platform.authentication.session.SessionService;
import tech.terrareg.platform.error.InvalidSessionCookieException;

import java.util.Optional;

/**
 * Turns the session cookie of a request into an {@link ActiveSession}.
 *
 * A tampered, expired or unknown session yields empty so the request carries on
 * unauthenticated.
 */
@ApplicationScoped
public class SessionResolver {

    private static final Logger LOG = Logger.getLogger(SessionResolver.class);

    @Inject
    SessionCookieService sessionCookieService;

    @Inject
    SessionService sessionService;

    @Inject
    ClaimsCodec claimsCodec;

    public Optional<ActiveSession> resolve(AuthRequest request) {
        Optional<String> cookie = request.cookie(sessionCookieService.cookieName());
        if (cookie.isEmpty()) {
            return Optional.empty();
        }
        SessionData data;
        try {
            data = sessionCookieService.read(cookie.get());
        } catch (InvalidSessionCookieException e) {
            LOG.debugf("Ignoring session cookie on %s: %s", request.path(), e.getMessage());
            return Optional.empty();
        }
        Optional<Session> session = sessionService.validate(data.sessionId());
        if (session.isEmpty()) {
            LOG.debugf("Session cookie on %s refers to no valid session", request.path());
            return Optional.empty();
        }
        return claimsCodec.decode(session.get().providerSourceAuth)
            .map(claims -> new ActiveSession(session.get(), data, claims));
    }
}
