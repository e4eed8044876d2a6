package tech.terrareg.platform.module;

import io.quarkus.mongodb.panache.PanacheMongoRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Typed;

import java.util.List;
import java.util.Optional;

/**
 * MongoDB implementation of ModuleVersionRepository.
 * Package-private to prevent direct injection - use ModuleVersionRepository interface.
 */
@ApplicationScoped
@Typed(ModuleVersionRepository.class)
class MongoModuleVersionRepository implements PanacheMongoRepositoryBase<ModuleVersion, Long>, ModuleVersionRepository {

    @Override
    public List<ModuleVersion> findByModuleProviderId(Long moduleProviderId) {
        return list("moduleProviderId", Sort.ascending("_id"), moduleProviderId);
    }

    @Override
    public List<ModuleVersion> findPublishedByModuleProviderId(Long moduleProviderId) {
        return list("moduleProviderId = ?1 and published = true", Sort.ascending("_id"), moduleProviderId);
    }

    @Override
    public List<ModuleVersion> findAllByVersion(Long moduleProviderId, String version) {
        return list("moduleProviderId = ?1 and version = ?2", Sort.ascending("_id"), moduleProviderId, version);
    }

    @Override
    public Optional<ModuleVersion> findPublishedByVersion(Long moduleProviderId, String version) {
        return find("moduleProviderId = ?1 and version = ?2 and published = true", moduleProviderId, version)
            .firstResultOptional();
    }

    @Override
    public Optional<ModuleVersion> findLatestByVersion(Long moduleProviderId, String version) {
        return find("moduleProviderId = ?1 and version = ?2", Sort.descending("_id"), moduleProviderId, version)
            .firstResultOptional();
    }

    @Override
    public List<ModuleVersion> listPublished() {
        return list("published = true");
    }

    @Override
    public Optional<ModuleVersion> findMostRecentlyPublished() {
        return find("published = true and beta = false", Sort.descending("publishedAt")).firstResultOptional();
    }

    @Override
    public long countPublished() {
        return count("published = true");
    }

    // Delegate to Panache methods via interface
    @Override
    public Optional<ModuleVersion> findByIdOptional(Long id) {
        return PanacheMongoRepositoryBase.super.findByIdOptional(id);
    }

    @Override
    public void persist(ModuleVersion moduleVersion) {
        PanacheMongoRepositoryBase.super.persist(moduleVersion);
    }

    @Override
    public void update(ModuleVersion moduleVersion) {
        PanacheMongoRepositoryBase.super.update(moduleVersion);
    }

    @Override
    public boolean deleteById(Long id) {
        return PanacheMongoRepositoryBase.super.deleteById(id);
    }
}
