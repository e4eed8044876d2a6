package tech.terrareg.platform.provider;

import io.quarkus.mongodb.panache.PanacheMongoRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Typed;

import java.util.List;
import java.util.Optional;

/**
 * MongoDB implementation of GpgKeyRepository.
 */
@ApplicationScoped
@Typed(GpgKeyRepository.class)
class MongoGpgKeyRepository implements PanacheMongoRepositoryBase<GpgKey, Long>, GpgKeyRepository {

    @Override
    public Optional<GpgKey> findByFingerprint(String fingerprint) {
        return find("fingerprint", fingerprint).firstResultOptional();
    }

    @Override
    public Optional<GpgKey> findByNamespaceAndKeyId(Long namespaceId, String keyId) {
        return find("namespaceId = ?1 and keyId = ?2", namespaceId, keyId).firstResultOptional();
    }

    @Override
    public List<GpgKey> findByNamespaceIds(List<Long> namespaceIds) {
        if (namespaceIds.isEmpty()) {
            return List.of();
        }
        return list("namespaceId in ?1", Sort.ascending("_id"), namespaceIds);
    }

    // Delegate to Panache methods via interface

    @Override
    public Optional<GpgKey> findByIdOptional(Long id) {
        return PanacheMongoRepositoryBase.super.findByIdOptional(id);
    }

    @Override
    public void persist(GpgKey key) {
        PanacheMongoRepositoryBase.super.persist(key);
    }

    @Override
    public boolean deleteById(Long id) {
        return PanacheMongoRepositoryBase.super.deleteById(id);
    }
}
