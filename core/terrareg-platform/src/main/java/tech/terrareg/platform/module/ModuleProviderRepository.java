package tech.terrareg.platform.module;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for ModuleProvider entities.
 */
public interface ModuleProviderRepository {

    // Read operations
    Optional<ModuleProvider> findByIdOptional(Long id);
    Optional<ModuleProvider> findByTriple(Long namespaceId, String moduleName, String providerName);
    List<ModuleProvider> findByNamespaceId(Long namespaceId);
    List<ModuleProvider> findByNamespaceAndModule(Long namespaceId, String moduleName);
    List<ModuleProvider> findByIds(List<Long> ids);
    List<ModuleProvider> listAll();
    long countByNamespaceId(Long namespaceId);
    long count();

    // Write operations
    void persist(ModuleProvider moduleProvider);
    void update(ModuleProvider moduleProvider);
    boolean deleteById(Long id);
}
