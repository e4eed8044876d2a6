package tech.terrareg.platform.provider;

import io.quarkus.mongodb.panache.PanacheMongoRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Typed;

import java.util.List;
import java.util.Optional;

/**
 * MongoDB implementation of ProviderRepository.
 */
@ApplicationScoped
@Typed(ProviderRepository.class)
class MongoProviderRepository implements PanacheMongoRepositoryBase<Provider, Long>, ProviderRepository {

    @Override
    public Optional<Provider> findByNamespaceAndName(Long namespaceId, String name) {
        return find("namespaceId = ?1 and name = ?2", namespaceId, name).firstResultOptional();
    }

    @Override
    public List<Provider> findByNamespaceId(Long namespaceId) {
        return list("namespaceId", Sort.ascending("name"), namespaceId);
    }

    @Override
    public long countByNamespaceId(Long namespaceId) {
        return count("namespaceId", namespaceId);
    }

    // Delegate to Panache methods via interface

    @Override
    public Optional<Provider> findByIdOptional(Long id) {
        return PanacheMongoRepositoryBase.super.findByIdOptional(id);
    }

    @Override
    public void persist(Provider provider) {
        PanacheMongoRepositoryBase.super.persist(provider);
    }

    @Override
    public void update(Provider provider) {
        PanacheMongoRepositoryBase.super.update(provider);
    }

    @Override
    public boolean deleteById(Long id) {
        return PanacheMongoRepositoryBase.super.deleteById(id);
    }
}
