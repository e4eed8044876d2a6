package tech.terrareg.platform.authentication.session;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.terrareg.platform.config.InfraConfig;
import tech.terrareg.platform.error.ErrorKind;
import tech.terrareg.platform.error.RegistryException;
import tech.terrareg.platform.shared.Hashing;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Server-side session lifecycle.
 *
 * Expiry is capped at the configured maximum TTL. Validation touches
 * {@code lastAccessedAt} but only {@link #refresh} moves the expiry.
 */
@ApplicationScoped
public class SessionService {

    private static final Logger LOG = Logger.getLogger(SessionService.class);

    /** 256-bit identifiers. */
    static final int SESSION_ID_BYTES = 32;

    @Inject
    SessionRepository sessionRepository;

    @Inject
    InfraConfig infraConfig;

    @Inject
    Clock clock;

    public Session create(Duration ttl, String providerSourceAuth) {
        return create(SessionKind.SESSION, ttl, providerSourceAuth);
    }

    Session create(SessionKind kind, Duration ttl, String providerSourceAuth) {
        Instant now = now();
        Session session = new Session();
        session.id = Hashing.randomToken(SESSION_ID_BYTES);
        session.kind = kind;
        session.createdAt = now;
        session.lastAccessedAt = now;
        session.expiry = now.plus(cap(ttl));
        session.providerSourceAuth = providerSourceAuth;
        sessionRepository.persist(session);
        LOG.debugf("Created %s expiring at %s", kind, session.expiry);
        return session;
    }

    /**
     * Return the session if present and unexpired. Expired sessions are deleted on sight.
     */
    public Optional<Session> validate(String sessionId) {
        return validate(sessionId, SessionKind.SESSION);
    }

    Optional<Session> validate(String sessionId, SessionKind kind) {
        if (sessionId == null || sessionId.isEmpty()) {
            return Optional.empty();
        }
        Optional<Session> found = sessionRepository.findByIdOptional(sessionId);
        if (found.isEmpty() || found.get().kind != kind) {
            return Optional.empty();
        }
        Session session = found.get();
        Instant now = now();
        if (session.isExpired(now)) {
            LOG.debugf("Session expired at %s, deleting", session.expiry);
            sessionRepository.deleteById(session.id);
            return Optional.empty();
        }
        session.lastAccessedAt = now;
        sessionRepository.update(session);
        return Optional.of(session);
    }

    /**
     * Remove and return an unexpired row of the given kind. Of concurrent callers
     * with the same id at most one receives it.
     */
    Optional<Session> take(String sessionId, SessionKind kind) {
        if (sessionId == null || sessionId.isEmpty()) {
            return Optional.empty();
        }
        return sessionRepository.takeUnexpired(sessionId, kind, now());
    }

    /**
     * Move the expiry to {@code now + min(ttl, max)}.
     *
     * @throws RegistryException SESSION_EXPIRED if the session is gone or already expired
     */
    public Session refresh(String sessionId, Duration ttl) {
        Session session = validate(sessionId)
            .orElseThrow(() -> new RegistryException(ErrorKind.SESSION_EXPIRED, "Session has expired"));
        session.expiry = now().plus(cap(ttl));
        sessionRepository.update(session);
        return session;
    }

    /**
     * Idempotent.
     */
    public void delete(String sessionId) {
        if (sessionId != null) {
            sessionRepository.deleteById(sessionId);
        }
    }

    /**
     * Remove rows of the given kind whose expiry has passed.
     */
    public long deleteExpired(SessionKind kind) {
        return sessionRepository.deleteExpired(kind, now());
    }

    private Duration cap(Duration ttl) {
        Duration max = infraConfig.sessionMaxTtl();
        return ttl.compareTo(max) > 0 ? max : ttl;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }
}
