package tech.terrareg.platform.module;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for ModuleFile entities.
 */
public interface ModuleFileRepository {

    List<ModuleFile> findByOwner(Long ownerId, FileOwnerKind ownerKind);
    Optional<ModuleFile> findByOwnerAndPath(Long ownerId, FileOwnerKind ownerKind, String path);

    void persist(ModuleFile file);
    long deleteByOwnerIds(List<Long> ownerIds);
}
