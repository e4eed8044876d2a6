package tech.terrareg.platform.authentication.session;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for Session entities.
 */
public interface SessionRepository {

    // Read operations
    Optional<Session> findByIdOptional(String id);

    // Write operations
    void persist(Session session);
    void update(Session session);
    boolean deleteById(String id);

    /**
     * Atomically remove and return the row with this id and kind if it expires after {@code now}.
     */
    Optional<Session> takeUnexpired(String id, SessionKind kind, Instant now);

    /**
     * Delete rows of the given kind whose expiry is at or before {@code now}.
     */
    long deleteExpired(SessionKind kind, Instant now);
}
