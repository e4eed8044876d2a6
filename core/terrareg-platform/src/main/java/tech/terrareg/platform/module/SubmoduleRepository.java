package tech.terrareg.platform.module;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Submodule entities (submodules and examples).
 */
public interface SubmoduleRepository {

    List<Submodule> findByModuleVersionId(Long moduleVersionId, ComponentKind kind);
    Optional<Submodule> findByPath(Long moduleVersionId, ComponentKind kind, String path);

    void persist(Submodule submodule);
    long deleteByModuleVersionId(Long moduleVersionId);
}
