package tech.terrareg.platform.provider;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Provider entities.
 */
public interface ProviderRepository {

    // Read operations
    Optional<Provider> findByIdOptional(Long id);
    Optional<Provider> findByNamespaceAndName(Long namespaceId, String name);
    List<Provider> findByNamespaceId(Long namespaceId);
    long countByNamespaceId(Long namespaceId);

    // Write operations
    void persist(Provider provider);
    void update(Provider provider);
    boolean deleteById(Long id);
}
