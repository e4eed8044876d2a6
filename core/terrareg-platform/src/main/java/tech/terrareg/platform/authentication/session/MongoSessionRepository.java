package tech.terrareg.platform.authentication.session;

import io.quarkus.mongodb.panache.PanacheMongoRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Typed;
import org.bson.Document;

import java.time.Instant;
import java.util.Date;
import java.util.Optional;

/**
 * MongoDB implementation of SessionRepository.
 */
@ApplicationScoped
@Typed(SessionRepository.class)
class MongoSessionRepository implements PanacheMongoRepositoryBase<Session, String>, SessionRepository {

    @Override
    public long deleteExpired(SessionKind kind, Instant now) {
        return delete("kind = ?1 and expiry <= ?2", kind.name(), now);
    }

    @Override
    public Optional<Session> takeUnexpired(String id, SessionKind kind, Instant now) {
        Document filter = new Document("_id", id)
            .append("kind", kind.name())
            .append("expiry", new Document("$gt", Date.from(now)));
        return Optional.ofNullable(mongoCollection().findOneAndDelete(filter));
    }

    // Delegate to Panache methods via interface

    @Override
    public Optional<Session> findByIdOptional(String id) {
        return PanacheMongoRepositoryBase.super.findByIdOptional(id);
    }

    @Override
    public void persist(Session session) {
        PanacheMongoRepositoryBase.super.persist(session);
    }

    @Override
    public void update(Session session) {
        PanacheMongoRepositoryBase.super.update(session);
    }

    @Override
    public boolean deleteById(String id) {
        return PanacheMongoRepositoryBase.super.deleteById(id);
    }
}
