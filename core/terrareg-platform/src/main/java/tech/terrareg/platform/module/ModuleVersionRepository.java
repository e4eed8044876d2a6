package tech.terrareg.platform.module;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for ModuleVersion entities.
 */
public interface ModuleVersionRepository {

    // Read operations
    Optional<ModuleVersion> findByIdOptional(Long id);

    /**
     * Every row for the module provider, published or not.
     */
    List<ModuleVersion> findByModuleProviderId(Long moduleProviderId);

    List<ModuleVersion> findPublishedByModuleProviderId(Long moduleProviderId);

    /**
     * Every row carrying this version string, including superseded ones.
     */
    List<ModuleVersion> findAllByVersion(Long moduleProviderId, String version);

    Optional<ModuleVersion> findPublishedByVersion(Long moduleProviderId, String version);

    /**
     * Latest row (highest id) for the version, published or not.
     */
    Optional<ModuleVersion> findLatestByVersion(Long moduleProviderId, String version);

    List<ModuleVersion> listPublished();
    Optional<ModuleVersion> findMostRecentlyPublished();
    long countPublished();

    // Write operations
    void persist(ModuleVersion moduleVersion);
    void update(ModuleVersion moduleVersion);
    boolean deleteById(Long id);
}
