package tech.terrareg.platform.namespace;

import io.quarkus.mongodb.panache.PanacheMongoRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Typed;

import java.util.List;
import java.util.Optional;

/**
 * MongoDB implementation of NamespaceRepository.
 * Package-private to prevent direct injection - use NamespaceRepository interface.
 */
@ApplicationScoped
@Typed(NamespaceRepository.class)
class MongoNamespaceRepository implements PanacheMongoRepositoryBase<Namespace, Long>, NamespaceRepository {

    @Override
    public Optional<Namespace> findByName(String name) {
        return find("nameLower", Namespace.fold(name)).firstResultOptional();
    }

    @Override
    public List<Namespace> findByIds(List<Long> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return list("_id in ?1", ids);
    }

    @Override
    public List<Namespace> listPage(int offset, int limit) {
        return findAll(Sort.ascending("nameLower")).range(offset, offset + limit - 1).list();
    }

    // Delegate to Panache methods via interface
    @Override
    public Optional<Namespace> findByIdOptional(Long id) {
        return PanacheMongoRepositoryBase.super.findByIdOptional(id);
    }

    @Override
    public List<Namespace> listAll() {
        return PanacheMongoRepositoryBase.super.listAll(Sort.ascending("nameLower"));
    }

    @Override
    public long count() {
        return PanacheMongoRepositoryBase.super.count();
    }

    @Override
    public void persist(Namespace namespace) {
        PanacheMongoRepositoryBase.super.persist(namespace);
    }

    @Override
    public void update(Namespace namespace) {
        PanacheMongoRepositoryBase.super.update(namespace);
    }

    @Override
    public boolean deleteById(Long id) {
        return PanacheMongoRepositoryBase.super.deleteById(id);
    }
}
