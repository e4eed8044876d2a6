package tech.terrareg.platform.module;

import io.quarkus.mongodb.panache.PanacheMongoRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Typed;

import java.util.List;
import java.util.Optional;

/**
 * MongoDB implementation of ModuleProviderRepository.
 * Package-private to prevent direct injection - use ModuleProviderRepository interface.
 */
@ApplicationScoped
@Typed(ModuleProviderRepository.class)
class MongoModuleProviderRepository implements PanacheMongoRepositoryBase<ModuleProvider, Long>, ModuleProviderRepository {

    @Override
    public Optional<ModuleProvider> findByTriple(Long namespaceId, String moduleName, String providerName) {
        return find("namespaceId = ?1 and moduleName = ?2 and providerName = ?3", namespaceId, moduleName, providerName)
            .firstResultOptional();
    }

    @Override
    public List<ModuleProvider> findByNamespaceId(Long namespaceId) {
        return list("namespaceId", Sort.ascending("moduleName", "providerName"), namespaceId);
    }

    @Override
    public List<ModuleProvider> findByNamespaceAndModule(Long namespaceId, String moduleName) {
        return list("namespaceId = ?1 and moduleName = ?2", Sort.ascending("providerName"), namespaceId, moduleName);
    }

    @Override
    public List<ModuleProvider> findByIds(List<Long> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return list("_id in ?1", ids);
    }

    @Override
    public long countByNamespaceId(Long namespaceId) {
        return count("namespaceId", namespaceId);
    }

    // Delegate to Panache methods via interface
    @Override
    public Optional<ModuleProvider> findByIdOptional(Long id) {
        return PanacheMongoRepositoryBase.super.findByIdOptional(id);
    }

    @Override
    public List<ModuleProvider> listAll() {
        return PanacheMongoRepositoryBase.super.listAll();
    }

    @Override
    public long count() {
        return PanacheMongoRepositoryBase.super.count();
    }

    @Override
    public void persist(ModuleProvider moduleProvider) {
        PanacheMongoRepositoryBase.super.persist(moduleProvider);
    }

    @Override
    public void update(ModuleProvider moduleProvider) {
        PanacheMongoRepositoryBase.super.update(moduleProvider);
    }

    @Override
    public boolean deleteById(Long id) {
        return PanacheMongoRepositoryBase.super.deleteById(id);
    }
}
