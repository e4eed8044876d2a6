package tech.terrareg.platform.module;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.terrareg.platform.error.RegistryException;
import tech.terrareg.platform.storage.BlobStorage;
import tech.terrareg.platform.storage.StoragePaths;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Publication and deletion of module versions.
 *
 * Publishing the newest row of a version unpublishes every older row of that
 * version, so at most one row per (module provider, version) is published.
 */
@ApplicationScoped
public class ModuleVersionService {

    private static final Logger LOG = Logger.getLogger(ModuleVersionService.class);

    @Inject
    ModuleVersionRepository moduleVersionRepository;

    @Inject
    SubmoduleRepository submoduleRepository;

    @Inject
    ModuleFileRepository moduleFileRepository;

    @Inject
    BlobStorage blobStorage;

    @Inject
    Clock clock;

    /**
     * Publish the newest row of {@code version}. Publishing an already published row is a no-op.
     *
     * @throws RegistryException NOT_FOUND if the version was never indexed
     */
    @Transactional
    public ModuleVersion publish(ModuleProviderService.ResolvedModuleProvider resolved, String version) {
        ModuleVersion latest = moduleVersionRepository.findLatestByVersion(resolved.moduleProvider().id, version)
            .orElseThrow(() -> RegistryException.notFound("Module version does not exist: " + resolved.id() + "/" + version));
        publishRow(latest);
        return latest;
    }

    /**
     * Mark {@code row} published and unpublish any other row carrying the same version.
     */
    public void publishRow(ModuleVersion row) {
        if (row.published) {
            return;
        }
        for (ModuleVersion other : moduleVersionRepository.findAllByVersion(row.moduleProviderId, row.version)) {
            if (!other.id.equals(row.id) && other.published) {
                other.published = false;
                other.supersededById = row.id;
                moduleVersionRepository.update(other);
                LOG.infof("Unpublished superseded row %d of version %s", other.id, other.version);
            }
        }
        row.published = true;
        row.publishedAt = Instant.now(clock).truncatedTo(ChronoUnit.SECONDS);
        moduleVersionRepository.update(row);
        LOG.infof("Published module version row %d (%s)", row.id, row.version);
    }

    /**
     * Delete every row of the version with its submodules, examples, files and archives.
     */
    @Transactional
    public void delete(ModuleProviderService.ResolvedModuleProvider resolved, String version) {
        List<ModuleVersion> rows = moduleVersionRepository.findAllByVersion(resolved.moduleProvider().id, version);
        if (rows.isEmpty()) {
            throw RegistryException.notFound("Module version does not exist: " + resolved.id() + "/" + version);
        }
        for (ModuleVersion row : rows) {
            deleteRows(row);
        }
        blobStorage.deletePrefix(StoragePaths.moduleVersionDirectory(resolved.namespace().name,
            resolved.moduleProvider().moduleName, resolved.moduleProvider().providerName, version));
        LOG.infof("Deleted module version %s/%s (%d rows)", resolved.id(), version, rows.size());
    }

    /**
     * Remove the row and everything it owns. Archives are left to the caller,
     * which knows whether the storage path is still in use by a newer row.
     */
    public void deleteRows(ModuleVersion row) {
        List<Long> owners = new ArrayList<>();
        for (Submodule example : submoduleRepository.findByModuleVersionId(row.id, ComponentKind.EXAMPLE)) {
            owners.add(example.id);
        }
        List<ModuleFile> files = new ArrayList<>(moduleFileRepository.findByOwner(row.id, FileOwnerKind.MODULE_VERSION));
        for (Long exampleId : owners) {
            files.addAll(moduleFileRepository.findByOwner(exampleId, FileOwnerKind.EXAMPLE));
        }
        for (ModuleFile file : files) {
            if (!file.isInline()) {
                blobStorage.deletePrefix(file.blobRef);
            }
        }
        owners.add(row.id);
        moduleFileRepository.deleteByOwnerIds(owners);
        submoduleRepository.deleteByModuleVersionId(row.id);
        moduleVersionRepository.deleteById(row.id);
    }
}
