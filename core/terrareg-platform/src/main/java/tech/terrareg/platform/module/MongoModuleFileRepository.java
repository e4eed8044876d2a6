package tech.terrareg.platform.module;

import io.quarkus.mongodb.panache.PanacheMongoRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Typed;

import java.util.List;
import java.util.Optional;

/**
 * MongoDB implementation of ModuleFileRepository.
 */
@ApplicationScoped
@Typed(ModuleFileRepository.class)
class MongoModuleFileRepository implements PanacheMongoRepositoryBase<ModuleFile, Long>, ModuleFileRepository {

    @Override
    public List<ModuleFile> findByOwner(Long ownerId, FileOwnerKind ownerKind) {
        return list("ownerId = ?1 and ownerKind = ?2", Sort.ascending("path"), ownerId, ownerKind.name());
    }

    @Override
    public Optional<ModuleFile> findByOwnerAndPath(Long ownerId, FileOwnerKind ownerKind, String path) {
        return find("ownerId = ?1 and ownerKind = ?2 and path = ?3", ownerId, ownerKind.name(), path).firstResultOptional();
    }

    @Override
    public long deleteByOwnerIds(List<Long> ownerIds) {
        if (ownerIds.isEmpty()) {
            return 0;
        }
        return delete("ownerId in ?1", ownerIds);
    }

    @Override
    public void persist(ModuleFile file) {
        PanacheMongoRepositoryBase.super.persist(file);
    }
}
