package tech.terrareg.platform.namespace;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Namespace entities.
 * Exposes only approved data access methods - Panache internals are hidden.
 */
public interface NamespaceRepository {

    // Read operations
    Optional<Namespace> findByIdOptional(Long id);
    Optional<Namespace> findByName(String name);
    List<Namespace> findByIds(List<Long> ids);
    List<Namespace> listPage(int offset, int limit);
    List<Namespace> listAll();
    long count();

    // Write operations
    void persist(Namespace namespace);
    void update(Namespace namespace);
    boolean deleteById(Long id);
}
