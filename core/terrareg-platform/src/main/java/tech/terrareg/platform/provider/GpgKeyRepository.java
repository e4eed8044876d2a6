package tech.terrareg.platform.provider;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for GpgKey entities.
 */
public interface GpgKeyRepository {

    Optional<GpgKey> findByIdOptional(Long id);
    Optional<GpgKey> findByFingerprint(String fingerprint);
    Optional<GpgKey> findByNamespaceAndKeyId(Long namespaceId, String keyId);
    List<GpgKey> findByNamespaceIds(List<Long> namespaceIds);

    void persist(GpgKey key);
    boolean deleteById(Long id);
}
