package tech.terrareg.platform.authentication.session;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Map-backed {@link SessionRepository} for service tests.
 */
class InMemorySessionRepository implements SessionRepository {

    final Map<String, Session> rows = new LinkedHashMap<>();

    @Override
    public Optional<Session> findByIdOptional(String id) {
        return Optional.ofNullable(rows.get(id));
    }

    @Override
    public void persist(Session session) {
        rows.put(session.id, session);
    }

    @Override
    public void update(Session session) {
        rows.put(session.id, session);
    }

    @Override
    public boolean deleteById(String id) {
        return rows.remove(id) != null;
    }

    @Override
    public synchronized Optional<Session> takeUnexpired(String id, SessionKind kind, Instant now) {
        Session session = rows.get(id);
        if (session == null || session.kind != kind || !session.expiry.isAfter(now)) {
            return Optional.empty();
        }
        rows.remove(id);
        return Optional.of(session);
    }

    @Override
    public long deleteExpired(SessionKind kind, Instant now) {
        long before = rows.size();
        rows.values().removeIf(s -> s.kind == kind && !s.expiry.isAfter(now));
        return before - rows.size();
    }
}
