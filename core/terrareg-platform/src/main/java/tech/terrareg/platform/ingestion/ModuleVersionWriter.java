package tech.terrareg.platform.ingestion;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.terrareg.platform.module.ComponentKind;
import tech.terrareg.platform.module.FileOwnerKind;
import tech.terrareg.platform.module.ModuleFile;
import tech.terrareg.platform.module.ModuleProvider;
import tech.terrareg.platform.module.ModuleProviderRepository;
import tech.terrareg.platform.module.ModuleProviderService;
import tech.terrareg.platform.module.ModuleVersion;
import tech.terrareg.platform.module.ModuleVersionRepository;
import tech.terrareg.platform.module.ModuleVersionService;
import tech.terrareg.platform.module.SemanticVersion;
import tech.terrareg.platform.module.Submodule;
import tech.terrareg.platform.module.SubmoduleRepository;
import tech.terrareg.platform.module.ModuleFileRepository;
import tech.terrareg.platform.shared.TsidGenerator;
import tech.terrareg.platform.storage.StoragePaths;

import java.io.ByteArrayInputStream;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Persists an indexed module version in a single transaction.
 *
 * A new row is always inserted. Published rows of the same version are
 * unpublished and point at the new row through {@code supersededById}.
 * Staged blobs are promoted last, so a storage failure rolls the rows back.
 */
@ApplicationScoped
public class ModuleVersionWriter {

    private static final Logger LOG = Logger.getLogger(ModuleVersionWriter.class);

    @Inject
    ModuleVersionRepository moduleVersionRepository;

    @Inject
    ModuleProviderRepository moduleProviderRepository;

    @Inject
    SubmoduleRepository submoduleRepository;

    @Inject
    ModuleFileRepository moduleFileRepository;

    @Inject
    ModuleProviderService moduleProviderService;

    @Inject
    ModuleVersionService moduleVersionService;

    @Inject
    Clock clock;

    @Transactional
    public ModuleVersion persist(ModuleProviderService.IngestionTarget target, IndexedModuleVersion indexed,
                                 String sourceArchiveRef, String sourceZipRef, boolean publish, StagedBlobs blobs) {
        moduleProviderService.saveNew(target);
        ModuleProviderService.ResolvedModuleProvider resolved = target.resolved();
        ModuleProvider moduleProvider = resolved.moduleProvider();
        String version = indexed.version().getVersion();

        ModuleVersion row = new ModuleVersion();
        row.id = TsidGenerator.generate();
        row.moduleProviderId = moduleProvider.id;
        row.version = version;
        row.major = indexed.version().getMajor();
        row.minor = indexed.version().getMinor();
        row.patch = indexed.version().getPatch();
        row.beta = SemanticVersion.isBeta(indexed.version());
        row.published = false;
        row.sourceArchiveRef = sourceArchiveRef;
        row.sourceZipRef = sourceZipRef;
        row.extractionVersion = ModuleIngestionService.EXTRACTION_VERSION;
        row.readmeText = indexed.root().readmeText();
        row.description = indexed.description();
        row.owner = indexed.metadata().owner();
        row.repoSnapshotSha = indexed.repoSnapshotSha();
        row.terraformDocsJson = indexed.root().terraformDocsJson();
        row.tfsecJson = indexed.root().tfsecJson();
        row.graphJson = indexed.root().graphJson();
        row.variableTemplateJson = indexed.metadata().variableTemplate() == null
            ? null : indexed.metadata().variableTemplate().toString();
        row.createdAt = Instant.now(clock).truncatedTo(ChronoUnit.SECONDS);

        for (ModuleVersion previous : moduleVersionRepository.findAllByVersion(moduleProvider.id, version)) {
            if (previous.published) {
                previous.published = false;
                previous.supersededById = row.id;
                moduleVersionRepository.update(previous);
                LOG.infof("Row %d of %s/%s superseded by %d", previous.id, resolved.id(), version, row.id);
            }
        }
        moduleVersionRepository.persist(row);

        String versionDirectory = StoragePaths.moduleVersionDirectory(resolved.namespace().name,
            moduleProvider.moduleName, moduleProvider.providerName, version);
        persistFiles(row.id, FileOwnerKind.MODULE_VERSION, indexed.rootFiles(), versionDirectory, blobs);
        for (AnalyzedComponent submodule : indexed.submodules()) {
            persistComponent(row.id, submodule);
        }
        for (AnalyzedComponent example : indexed.examples()) {
            Submodule saved = persistComponent(row.id, example);
            persistFiles(saved.id, FileOwnerKind.EXAMPLE, example.files(), versionDirectory, blobs);
        }

        applyMetadataUrls(moduleProvider, indexed.metadata());

        if (publish) {
            moduleVersionService.publishRow(row);
        }
        blobs.promote();
        return row;
    }

    private Submodule persistComponent(Long moduleVersionId, AnalyzedComponent component) {
        Submodule submodule = new Submodule();
        submodule.id = TsidGenerator.generate();
        submodule.moduleVersionId = moduleVersionId;
        submodule.kind = component.kind();
        submodule.path = component.path();
        submodule.readmeText = component.readmeText();
        submodule.terraformDocsJson = component.terraformDocsJson();
        submodule.tfsecJson = component.tfsecJson();
        submodule.graphJson = component.graphJson();
        submodule.infracostJson = component.kind() == ComponentKind.EXAMPLE ? component.infracostJson() : null;
        submoduleRepository.persist(submodule);
        return submodule;
    }

    private void persistFiles(Long ownerId, FileOwnerKind ownerKind, List<AnalyzedComponent.StagedFile> files,
                              String versionDirectory, StagedBlobs blobs) {
        for (AnalyzedComponent.StagedFile staged : files) {
            ModuleFile file = new ModuleFile();
            file.id = TsidGenerator.generate();
            file.ownerId = ownerId;
            file.ownerKind = ownerKind;
            file.path = staged.path();
            file.contentType = staged.contentType();
            if (staged.content().length <= ModuleFile.INLINE_LIMIT_BYTES) {
                file.content = staged.content();
            } else {
                file.blobRef = StoragePaths.safeJoinPaths(versionDirectory, "files", String.valueOf(file.id));
                blobs.put(file.blobRef, new ByteArrayInputStream(staged.content()));
            }
            moduleFileRepository.persist(file);
        }
    }

    private void applyMetadataUrls(ModuleProvider moduleProvider, ModuleMetadata metadata) {
        boolean changed = false;
        if (moduleProvider.repoCloneUrlTemplate == null && metadata.repoCloneUrl() != null) {
            moduleProvider.repoCloneUrlTemplate = metadata.repoCloneUrl();
            changed = true;
        }
        if (moduleProvider.repoBrowseUrlTemplate == null && metadata.repoBrowseUrl() != null) {
            moduleProvider.repoBrowseUrlTemplate = metadata.repoBrowseUrl();
            changed = true;
        }
        if (moduleProvider.repoBaseUrlTemplate == null && metadata.repoBaseUrl() != null) {
            moduleProvider.repoBaseUrlTemplate = metadata.repoBaseUrl();
            changed = true;
        }
        if (changed) {
            moduleProviderRepository.update(moduleProvider);
        }
    }
}
