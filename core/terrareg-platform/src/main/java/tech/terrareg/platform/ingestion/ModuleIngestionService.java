package tech.terrareg.platform.ingestion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.semver4j.Semver;
import tech.terrareg.platform.config.DomainConfig;
import tech.terrareg.platform.config.InfraConfig;
import tech.terrareg.platform.config.ModuleHostingMode;
import tech.terrareg.platform.error.ErrorKind;
import tech.terrareg.platform.error.RegistryException;
import tech.terrareg.platform.error.StorageUnavailableException;
import tech.terrareg.platform.ingestion.analysis.AnalysisOutcome;
import tech.terrareg.platform.ingestion.analysis.GraphAnalyzer;
import tech.terrareg.platform.ingestion.analysis.InfracostAnalyzer;
import tech.terrareg.platform.ingestion.analysis.ModuleAnalyzer;
import tech.terrareg.platform.ingestion.analysis.TerraformDocsAnalyzer;
import tech.terrareg.platform.ingestion.analysis.TfsecAnalyzer;
import tech.terrareg.platform.module.ComponentKind;
import tech.terrareg.platform.module.GitUrlTemplate;
import tech.terrareg.platform.module.ModuleProvider;
import tech.terrareg.platform.module.ModuleProviderService;
import tech.terrareg.platform.module.ModuleVersion;
import tech.terrareg.platform.module.SemanticVersion;
import tech.terrareg.platform.shared.Hashing;
import tech.terrareg.platform.storage.BlobStorage;
import tech.terrareg.platform.storage.StoragePaths;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Indexes module versions from uploaded archives or git tags.
 *
 * Work happens in a private temporary directory. Generated archives are staged
 * under {@code upload/} and promoted inside the indexing transaction. When the
 * transaction fails the archives a published row serves are put back, and a
 * namespace or module provider auto-created for the ingestion is never stored.
 */
@ApplicationScoped
public class ModuleIngestionService {

    private static final Logger LOG = Logger.getLogger(ModuleIngestionService.class);

    static final int EXTRACTION_VERSION = 1;

    static final List<String> ROOT_FILES = List.of("README.md", "CHANGELOG.md", "LICENSE");
    private static final String README = "README.md";
    private static final String TEXT_CONTENT_TYPE = "text/plain; charset=utf-8";

    private final ConcurrentHashMap<String, ProviderLock> providerLocks = new ConcurrentHashMap<>();

    /**
     * Lock plus the number of callers using it. The entry is removed when the count drops to zero.
     */
    private static final class ProviderLock {
        final ReentrantLock lock = new ReentrantLock();
        int users;
    }

    @Inject
    ModuleProviderService moduleProviderService;

    @Inject
    ModuleVersionWriter moduleVersionWriter;

    @Inject
    BlobStorage blobStorage;

    @Inject
    SystemCommandService systemCommandService;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    DomainConfig domainConfig;

    @Inject
    InfraConfig infraConfig;

    ModuleAnalyzer terraformDocs;
    ModuleAnalyzer tfsec;
    ModuleAnalyzer infracost;
    ModuleAnalyzer graph;

    @PostConstruct
    void init() {
        terraformDocs = new TerraformDocsAnalyzer(systemCommandService, objectMapper, infraConfig.moduleIndexingTimeout());
        tfsec = new TfsecAnalyzer(systemCommandService, objectMapper, infraConfig.moduleIndexingTimeout());
        infracost = infraConfig.infracostApiKey()
            .map(key -> (ModuleAnalyzer) new InfracostAnalyzer(systemCommandService, objectMapper,
                infraConfig.moduleIndexingTimeout(), key))
            .orElse(null);
        graph = new GraphAnalyzer(systemCommandService, objectMapper,
            infraConfig.terraformLockTimeout(), infraConfig.moduleIndexingTimeout());
    }

    // ==================== Entry points ====================

    /**
     * Index an uploaded tar.gz or zip archive.
     *
     * @param publish explicit publish flag; null falls back to auto-publish
     * @throws RegistryException INVALID_INPUT when hosting is disallowed or the archive is unusable
     */
    public ModuleVersion ingestUpload(String namespace, String module, String provider, String version,
                                      InputStream archive, Boolean publish) {
        if (domainConfig.allowModuleHosting() == ModuleHostingMode.DISALLOW) {
            throw RegistryException.invalidInput("Module upload is disabled; modules must be imported from git");
        }
        Semver semver = SemanticVersion.parse(version);
        ModuleProviderService.IngestionTarget target =
            moduleProviderService.resolveForIngestion(namespace, module, provider);

        return withProviderLock(target.id(), () -> {
            Path workDirectory = createWorkDirectory();
            try {
                Path uploaded = workDirectory.resolve("upload");
                try (InputStream limited = new SizeLimitedInputStream(archive, infraConfig.uploadMaxSizeBytes())) {
                    Files.copy(limited, uploaded);
                }
                Path extracted = Files.createDirectory(workDirectory.resolve("source"));
                try (InputStream in = Files.newInputStream(uploaded)) {
                    new ArchiveExtractor(infraConfig.uploadMaxSizeBytes() * 10).extract(in, extracted);
                }
                LOG.infof("Indexing uploaded archive for %s/%s", target.id(), semver.getVersion());
                return index(target, semver, extracted, workDirectory, null,
                    publish != null ? publish : domainConfig.autoPublishModuleVersions());
            } catch (IOException e) {
                throw new StorageUnavailableException("Unable to stage uploaded archive", e);
            } finally {
                deleteRecursively(workDirectory);
            }
        });
    }

    /**
     * Clone the tag for {@code version} and index it.
     *
     * @throws RegistryException INVALID_INPUT when hosting is enforced or no clone URL is configured
     */
    public ModuleVersion ingestFromGit(String namespace, String module, String provider, String version,
                                       Boolean publish) {
        if (domainConfig.allowModuleHosting() == ModuleHostingMode.ENFORCE) {
            throw RegistryException.invalidInput("Git import is disabled; modules must be uploaded");
        }
        Semver semver = SemanticVersion.parse(version);
        ModuleProviderService.IngestionTarget target =
            moduleProviderService.resolveForIngestion(namespace, module, provider);
        ModuleProviderService.ResolvedModuleProvider resolved = target.resolved();
        ModuleProvider moduleProvider = resolved.moduleProvider();
        if (moduleProvider.repoCloneUrlTemplate == null || moduleProvider.repoCloneUrlTemplate.isBlank()) {
            throw RegistryException.invalidInput("Module provider has no repository clone URL: " + resolved.id());
        }

        String tag = GitCloner.renderTag(moduleProvider.gitTagFormat, semver.getVersion(),
            semver.getMajor(), semver.getMinor(), semver.getPatch());
        String cloneUrl = GitUrlTemplate.render(moduleProvider.repoCloneUrlTemplate, resolved.namespace().name,
            moduleProvider.moduleName, moduleProvider.providerName, tag, moduleProvider.gitPath);

        return withProviderLock(target.id(), () -> {
            Path workDirectory = createWorkDirectory();
            try {
                Path checkout = workDirectory.resolve("checkout");
                String sha = new GitCloner(systemCommandService, infraConfig.gitCloneTimeout())
                    .cloneTag(cloneUrl, tag, checkout);
                Path moduleRoot = checkout;
                if (moduleProvider.gitPath != null && !moduleProvider.gitPath.isBlank()) {
                    moduleRoot = ArchiveExtractor.resolveEntry(checkout.toAbsolutePath().normalize(), moduleProvider.gitPath);
                    if (!Files.isDirectory(moduleRoot)) {
                        throw RegistryException.invalidInput("Git path does not exist in tag " + tag + ": " + moduleProvider.gitPath);
                    }
                }
                LOG.infof("Indexing %s/%s from tag %s (%s)", resolved.id(), semver.getVersion(), tag, sha);
                return index(target, semver, moduleRoot, workDirectory, sha,
                    publish != null ? publish : domainConfig.autoPublishModuleVersions());
            } finally {
                deleteRecursively(workDirectory);
            }
        });
    }

    // ==================== Indexing ====================

    private ModuleVersion index(ModuleProviderService.IngestionTarget target, Semver version,
                                Path moduleRoot, Path workDirectory, String repoSnapshotSha, boolean publish) {
        ModuleProviderService.ResolvedModuleProvider resolved = target.resolved();
        ModuleMetadata metadata = readMetadata(moduleRoot);
        List<String> missing = metadata.missingAttributes(domainConfig.requiredModuleMetadataAttributes());
        if (!missing.isEmpty()) {
            throw RegistryException.invalidInput("Module metadata is missing required attributes: " + String.join(", ", missing));
        }

        ModuleTree tree = new ModuleTreeScanner(domainConfig.modulesDirectory(), domainConfig.examplesDirectory())
            .scan(moduleRoot);
        if (!tree.rootHasTerraform()) {
            throw RegistryException.invalidInput("Module root contains no Terraform files");
        }

        AnalyzedComponent root = analyze(null, "", moduleRoot, List.of());
        List<AnalyzedComponent> submodules = new ArrayList<>();
        for (String path : tree.submodules()) {
            submodules.add(analyze(ComponentKind.SUBMODULE, path, moduleRoot.resolve(path), List.of()));
        }
        List<AnalyzedComponent> examples = new ArrayList<>();
        for (String path : tree.examples()) {
            examples.add(analyze(ComponentKind.EXAMPLE, path, moduleRoot.resolve(path), exampleFiles(moduleRoot, tree, path)));
        }
        List<AnalyzedComponent.StagedFile> rootFiles = new ArrayList<>();
        for (String name : ROOT_FILES) {
            if (tree.files().contains(name)) {
                rootFiles.add(readFile(moduleRoot, name));
            }
        }

        String description = metadata.description() != null && !metadata.description().isBlank()
            ? metadata.description()
            : ReadmeDescriptionExtractor.extract(root.readmeText());

        IndexedModuleVersion indexed = new IndexedModuleVersion(version, root, submodules, examples, rootFiles,
            metadata, description, repoSnapshotSha);

        List<String> archived = tree.files().stream()
            .filter(f -> !ModuleMetadata.FILE_NAMES.contains(f))
            .toList();
        StagedBlobs blobs = new StagedBlobs(blobStorage, StoragePaths.upload(Hashing.randomToken(16)));
        ModuleProvider moduleProvider = resolved.moduleProvider();
        String versionString = version.getVersion();
        String tarGzRef = StoragePaths.moduleArchive(resolved.namespace().name, moduleProvider.moduleName,
            moduleProvider.providerName, versionString, StoragePaths.SOURCE_TAR_GZ);
        String zipRef = StoragePaths.moduleArchive(resolved.namespace().name, moduleProvider.moduleName,
            moduleProvider.providerName, versionString, StoragePaths.SOURCE_ZIP);

        try {
            stageArchives(moduleRoot, archived, workDirectory, blobs, tarGzRef, zipRef);
            ModuleVersion row;
            try {
                row = moduleVersionWriter.persist(target, indexed, tarGzRef, zipRef, publish, blobs);
            } catch (RuntimeException e) {
                LOG.warnf("Indexing %s/%s failed, restoring stored archives: %s", resolved.id(), versionString, e.getMessage());
                blobs.restore(e);
                throw e;
            }
            LOG.infof("Indexed %s/%s as row %d (%d submodules, %d examples, published=%s)", resolved.id(),
                versionString, row.id, submodules.size(), examples.size(), row.published);
            return row;
        } finally {
            blobs.discard();
        }
    }

    private AnalyzedComponent analyze(ComponentKind kind, String path, Path directory,
                                      List<AnalyzedComponent.StagedFile> files) {
        String readme = readText(directory.resolve(README));
        String docs = run(terraformDocs, directory);
        String security = domainConfig.enableSecurityScanning() ? run(tfsec, directory) : null;
        String cost = kind == ComponentKind.EXAMPLE && infracost != null ? run(infracost, directory) : null;
        String resourceGraph = run(graph, directory);
        return new AnalyzedComponent(kind, path, readme, docs, security, cost, resourceGraph, files);
    }

    private static String run(ModuleAnalyzer analyzer, Path directory) {
        AnalysisOutcome outcome = analyzer.analyze(directory);
        if (outcome instanceof AnalysisOutcome.Failed failed) {
            LOG.warnf("Analyzer %s failed for %s: %s", analyzer.name(), directory, failed.reason());
        }
        return outcome.json().orElse(null);
    }

    private List<AnalyzedComponent.StagedFile> exampleFiles(Path moduleRoot, ModuleTree tree, String example) {
        List<AnalyzedComponent.StagedFile> files = new ArrayList<>();
        for (String file : tree.filesUnder(example)) {
            String name = file.substring(file.lastIndexOf('/') + 1).toLowerCase(Locale.ROOT);
            boolean matches = domainConfig.exampleFileExtensions().stream()
                .anyMatch(ext -> name.endsWith("." + ext.toLowerCase(Locale.ROOT).replaceFirst("^\\.", "")));
            if (matches) {
                files.add(readFile(moduleRoot, file));
            }
        }
        return files;
    }

    ModuleMetadata readMetadata(Path moduleRoot) {
        for (String name : ModuleMetadata.FILE_NAMES) {
            Path file = moduleRoot.resolve(name);
            if (Files.isRegularFile(file)) {
                try {
                    return objectMapper.readValue(Files.readAllBytes(file), ModuleMetadata.class);
                } catch (JsonProcessingException e) {
                    throw new RegistryException(ErrorKind.INVALID_INPUT,
                        name + " is not valid JSON: " + e.getOriginalMessage(), e);
                } catch (IOException e) {
                    throw new StorageUnavailableException("Unable to read " + name, e);
                }
            }
        }
        return ModuleMetadata.empty();
    }

    // ==================== Archives ====================

    private void stageArchives(Path moduleRoot, List<String> files, Path workDirectory,
                               StagedBlobs blobs, String tarGzRef, String zipRef) {
        try {
            Path archives = Files.createDirectories(workDirectory.resolve("archives"));
            Path tarGz = archives.resolve(StoragePaths.SOURCE_TAR_GZ);
            Path zip = archives.resolve(StoragePaths.SOURCE_ZIP);
            ArchiveBuilder.writeTarGz(moduleRoot, files, tarGz);
            ArchiveBuilder.writeZip(moduleRoot, files, zip);
            try (InputStream in = Files.newInputStream(tarGz)) {
                blobs.put(tarGzRef, in);
            }
            try (InputStream in = Files.newInputStream(zip)) {
                blobs.put(zipRef, in);
            }
        } catch (IOException e) {
            throw new StorageUnavailableException("Unable to build module archives", e);
        }
    }

    // ==================== Helpers ====================

    private <T> T withProviderLock(String providerId, Supplier<T> work) {
        ProviderLock entry = providerLocks.compute(providerId, (id, existing) -> {
            ProviderLock current = existing != null ? existing : new ProviderLock();
            current.users++;
            return current;
        });
        try {
            boolean acquired;
            try {
                acquired = entry.lock.tryLock(infraConfig.moduleIndexingTimeout().toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw RegistryException.conflict("Interrupted while waiting to index " + providerId);
            }
            if (!acquired) {
                throw RegistryException.conflict("Another version of " + providerId + " is being indexed");
            }
            try {
                return work.get();
            } finally {
                entry.lock.unlock();
            }
        } finally {
            providerLocks.computeIfPresent(providerId, (id, existing) -> --existing.users == 0 ? null : existing);
        }
    }

    int heldProviderLocks() {
        return providerLocks.size();
    }

    private Path createWorkDirectory() {
        try {
            Path uploadDirectory = Path.of(infraConfig.uploadDirectory());
            Files.createDirectories(uploadDirectory);
            return Files.createTempDirectory(uploadDirectory, "ingest-");
        } catch (IOException e) {
            throw new StorageUnavailableException("Unable to create ingestion work directory", e);
        }
    }

    private static AnalyzedComponent.StagedFile readFile(Path moduleRoot, String relative) {
        try {
            return new AnalyzedComponent.StagedFile(relative, Files.readAllBytes(moduleRoot.resolve(relative)), TEXT_CONTENT_TYPE);
        } catch (IOException e) {
            throw new StorageUnavailableException("Unable to read " + relative, e);
        }
    }

    private static String readText(Path file) {
        if (!Files.isRegularFile(file)) {
            return null;
        }
        try {
            return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageUnavailableException("Unable to read " + file.getFileName(), e);
        }
    }

    static void deleteRecursively(Path directory) {
        if (directory == null || !Files.exists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    LOG.warnf("Unable to delete %s: %s", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            LOG.warnf("Unable to clean up %s: %s", directory, e.getMessage());
        }
    }
}
