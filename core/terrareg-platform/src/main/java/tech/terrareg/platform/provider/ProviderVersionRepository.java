package tech.terrareg.platform.provider;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for provider versions and their platform binaries.
 */
public interface ProviderVersionRepository {

    // Read operations
    Optional<ProviderVersion> findByIdOptional(Long id);
    Optional<ProviderVersion> findByVersion(Long providerId, String version);
    List<ProviderVersion> findByProviderId(Long providerId);
    List<ProviderVersionBinary> findBinaries(Long providerVersionId);
    Optional<ProviderVersionBinary> findBinary(Long providerVersionId, String os, String arch);

    // Write operations
    void persist(ProviderVersion version);
    void update(ProviderVersion version);
    void persistBinary(ProviderVersionBinary binary);
    void updateBinary(ProviderVersionBinary binary);
    long deleteByProviderId(Long providerId);
}
