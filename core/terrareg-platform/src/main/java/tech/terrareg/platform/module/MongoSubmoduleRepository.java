package tech.terrareg.platform.module;

import io.quarkus.mongodb.panache.PanacheMongoRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Typed;

import java.util.List;
import java.util.Optional;

/**
 * MongoDB implementation of SubmoduleRepository.
 */
@ApplicationScoped
@Typed(SubmoduleRepository.class)
class MongoSubmoduleRepository implements PanacheMongoRepositoryBase<Submodule, Long>, SubmoduleRepository {

    @Override
    public List<Submodule> findByModuleVersionId(Long moduleVersionId, ComponentKind kind) {
        return list("moduleVersionId = ?1 and kind = ?2", Sort.ascending("path"), moduleVersionId, kind.name());
    }

    @Override
    public Optional<Submodule> findByPath(Long moduleVersionId, ComponentKind kind, String path) {
        return find("moduleVersionId = ?1 and kind = ?2 and path = ?3", moduleVersionId, kind.name(), path)
            .firstResultOptional();
    }

    @Override
    public long deleteByModuleVersionId(Long moduleVersionId) {
        return delete("moduleVersionId", moduleVersionId);
    }

    @Override
    public void persist(Submodule submodule) {
        PanacheMongoRepositoryBase.super.persist(submodule);
    }
}
