package tech.terrareg.platform.provider;

import io.quarkus.mongodb.panache.PanacheMongoRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Typed;

import java.util.List;
import java.util.Optional;

/**
 * MongoDB implementation of ProviderVersionRepository.
 * Binaries are accessed through the active-record statics of {@link ProviderVersionBinary}.
 */
@ApplicationScoped
@Typed(ProviderVersionRepository.class)
class MongoProviderVersionRepository
        implements PanacheMongoRepositoryBase<ProviderVersion, Long>, ProviderVersionRepository {

    @Override
    public Optional<ProviderVersion> findByVersion(Long providerId, String version) {
        return find("providerId = ?1 and version = ?2", providerId, version).firstResultOptional();
    }

    @Override
    public List<ProviderVersion> findByProviderId(Long providerId) {
        return list("providerId", Sort.ascending("_id"), providerId);
    }

    @Override
    public List<ProviderVersionBinary> findBinaries(Long providerVersionId) {
        return ProviderVersionBinary.list("providerVersionId", Sort.ascending("os", "arch"), providerVersionId);
    }

    @Override
    public Optional<ProviderVersionBinary> findBinary(Long providerVersionId, String os, String arch) {
        return ProviderVersionBinary.find("providerVersionId = ?1 and os = ?2 and arch = ?3",
            providerVersionId, os, arch).firstResultOptional();
    }

    @Override
    public void persistBinary(ProviderVersionBinary binary) {
        binary.persist();
    }

    @Override
    public void updateBinary(ProviderVersionBinary binary) {
        binary.update();
    }

    @Override
    public long deleteByProviderId(Long providerId) {
        List<Long> versionIds = findByProviderId(providerId).stream().map(v -> v.id).toList();
        if (!versionIds.isEmpty()) {
            ProviderVersionBinary.delete("providerVersionId in ?1", versionIds);
        }
        return delete("providerId", providerId);
    }

    // Delegate to Panache methods via interface

    @Override
    public Optional<ProviderVersion> findByIdOptional(Long id) {
        return PanacheMongoRepositoryBase.super.findByIdOptional(id);
    }

    @Override
    public void persist(ProviderVersion version) {
        PanacheMongoRepositoryBase.super.persist(version);
    }

    @Override
    public void update(ProviderVersion version) {
        PanacheMongoRepositoryBase.super.update(version);
    }
}
