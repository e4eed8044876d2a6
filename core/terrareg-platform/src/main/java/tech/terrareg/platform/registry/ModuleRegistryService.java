package tech.terrareg.platform.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.semver4j.Semver;
import tech.terrareg.platform.analytics.AnalyticsService;
import tech.terrareg.platform.analytics.AnalyticsTokenParser;
import tech.terrareg.platform.authentication.AuthContext;
import tech.terrareg.platform.authentication.AuthMethodType;
import tech.terrareg.platform.authentication.ProviderClaims;
import tech.terrareg.platform.config.DomainConfig;
import tech.terrareg.platform.config.ModuleHostingMode;
import tech.terrareg.platform.error.RegistryException;
import tech.terrareg.platform.ingestion.GitCloner;
import tech.terrareg.platform.module.ComponentKind;
import tech.terrareg.platform.module.GitUrlTemplate;
import tech.terrareg.platform.module.ModuleProvider;
import tech.terrareg.platform.module.ModuleProviderRepository;
import tech.terrareg.platform.module.ModuleProviderService;
import tech.terrareg.platform.module.ModuleVersion;
import tech.terrareg.platform.module.ModuleVersionRepository;
import tech.terrareg.platform.module.SemanticVersion;
import tech.terrareg.platform.module.Submodule;
import tech.terrareg.platform.module.SubmoduleRepository;
import tech.terrareg.platform.namespace.Namespace;
import tech.terrareg.platform.namespace.NamespaceRepository;
import tech.terrareg.platform.namespace.NamespaceService;
import tech.terrareg.platform.presign.PresignedUrlService;
import tech.terrareg.platform.storage.BlobStorage;
import tech.terrareg.platform.storage.StoragePaths;

import java.io.InputStream;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Terraform Registry module protocol: version listing, download resolution and detail.
 *
 * Only published rows are visible. Beta versions are left out of listings and
 * "latest" resolution; they stay reachable by exact version.
 */
@ApplicationScoped
public class ModuleRegistryService {

    private static final Logger LOG = Logger.getLogger(ModuleRegistryService.class);

    public static final String SOURCE_PATH_PREFIX = "/v1/terrareg/modules/";

    @Inject
    ModuleProviderService moduleProviderService;

    @Inject
    ModuleProviderRepository moduleProviderRepository;

    @Inject
    ModuleVersionRepository moduleVersionRepository;

    @Inject
    SubmoduleRepository submoduleRepository;

    @Inject
    NamespaceService namespaceService;

    @Inject
    NamespaceRepository namespaceRepository;

    @Inject
    AnalyticsService analyticsService;

    @Inject
    PresignedUrlService presignedUrlService;

    @Inject
    BlobStorage blobStorage;

    @Inject
    DomainConfig domainConfig;

    @Inject
    ObjectMapper objectMapper;

    /**
     * A resolved download: the module version and the value for {@code X-Terraform-Get}.
     */
    public record Download(ModuleVersion moduleVersion, String terraformGet) {}

    // ==================== Versions ====================

    /**
     * Published, non-beta versions in descending precedence.
     */
    public ModuleWire.VersionsResponse versions(String namespaceSegment, String module, String provider) {
        String namespace = AnalyticsTokenParser.parse(namespaceSegment).namespace();
        ModuleProviderService.ResolvedModuleProvider resolved = requireProvider(namespace, module, provider);
        List<ModuleWire.VersionEntry> versions = visibleVersions(resolved.moduleProvider().id).stream()
            .map(ModuleWire.VersionEntry::new)
            .toList();
        return new ModuleWire.VersionsResponse(List.of(new ModuleWire.ModuleVersions(resolved.id(), versions)));
    }

    /**
     * Highest published version satisfying {@code constraint}; a blank constraint means latest non-beta.
     */
    public Optional<ModuleVersion> resolve(ModuleProviderService.ResolvedModuleProvider resolved, String constraint) {
        List<ModuleVersion> published = moduleVersionRepository.findPublishedByModuleProviderId(resolved.moduleProvider().id);
        List<String> candidates = published.stream().map(v -> v.version).toList();
        return VersionConstraint.parse(constraint).resolve(candidates)
            .flatMap(version -> published.stream().filter(v -> v.version.equals(version)).findFirst());
    }

    public Optional<ModuleVersion> latest(ModuleProviderService.ResolvedModuleProvider resolved) {
        return resolve(resolved, null);
    }

    // ==================== Download ====================

    /**
     * Resolve the download for a published version and record it.
     *
     * @param namespaceSegment namespace path segment, optionally prefixed {@code <token>__}
     * @param version          exact version, or null for the latest non-beta version
     * @throws RegistryException UNAUTHORIZED when an analytics token is required and missing
     */
    public Download download(String namespaceSegment, String module, String provider, String version,
                             AuthContext auth, String terraformVersion, String userAgent) {
        AnalyticsTokenParser.ParsedNamespace parsed = AnalyticsTokenParser.parse(namespaceSegment);
        boolean internalExtraction = auth.providerType() == AuthMethodType.TERRAFORM_INTERNAL_EXTRACTION;
        if (!internalExtraction && !domainConfig.disableAnalytics() && !domainConfig.allowUnidentifiedDownloads()
            && parsed.token() == null) {
            throw RegistryException.unauthorized("An " + domainConfig.analyticsTokenPhrase()
                + " must be provided. Please update module source to include " + domainConfig.analyticsTokenPhrase()
                + ", e.g. " + domainConfig.exampleAnalyticsToken() + "__" + parsed.namespace() + "/" + module + "/" + provider);
        }

        ModuleProviderService.ResolvedModuleProvider resolved = requireProvider(parsed.namespace(), module, provider);
        ModuleVersion moduleVersion = version == null
            ? requireMatching(resolved, null)
            : requirePublished(resolved, version);

        String terraformGet = terraformGet(resolved, moduleVersion);

        if (!internalExtraction && !domainConfig.disableAnalytics()) {
            String environment = auth.claims() instanceof ProviderClaims.AnalyticsKey key ? key.environment() : null;
            analyticsService.recordDownload(moduleVersion, parsed.token(), environment, terraformVersion, userAgent);
        }
        LOG.debugf("Resolved download of %s/%s", resolved.id(), moduleVersion.version);
        return new Download(moduleVersion, terraformGet);
    }

    /**
     * Presigned archive URL, or a {@code git::} source when the module is served from its repository.
     */
    String terraformGet(ModuleProviderService.ResolvedModuleProvider resolved, ModuleVersion moduleVersion) {
        ModuleProvider moduleProvider = resolved.moduleProvider();
        boolean hasCloneUrl = moduleProvider.repoCloneUrlTemplate != null && !moduleProvider.repoCloneUrlTemplate.isBlank();
        if (domainConfig.allowModuleHosting() == ModuleHostingMode.ENFORCE || !hasCloneUrl) {
            return presignedUrlService.signAbsolute(sourcePath(resolved, moduleVersion.version, StoragePaths.SOURCE_TAR_GZ));
        }
        Semver semver = SemanticVersion.parse(moduleVersion.version);
        String tag = GitCloner.renderTag(moduleProvider.gitTagFormat, moduleVersion.version,
            semver.getMajor(), semver.getMinor(), semver.getPatch());
        String cloneUrl = GitUrlTemplate.render(moduleProvider.repoCloneUrlTemplate, resolved.namespace().name,
            moduleProvider.moduleName, moduleProvider.providerName, tag, moduleProvider.gitPath);
        StringBuilder source = new StringBuilder("git::").append(cloneUrl);
        if (moduleProvider.gitPath != null && !moduleProvider.gitPath.isBlank()) {
            source.append("//").append(moduleProvider.gitPath.replaceAll("^/+", ""));
        }
        return source.append("?ref=").append(tag).toString();
    }

    public static String sourcePath(ModuleProviderService.ResolvedModuleProvider resolved, String version, String archiveName) {
        return SOURCE_PATH_PREFIX + resolved.namespace().name + "/" + resolved.moduleProvider().moduleName + "/"
            + resolved.moduleProvider().providerName + "/" + version + "/" + archiveName;
    }

    /**
     * Stored archive of a published version; the caller has verified the presigned URL.
     */
    public InputStream openSourceArchive(String namespace, String module, String provider, String version,
                                         String archiveName) {
        ModuleProviderService.ResolvedModuleProvider resolved = requireProvider(namespace, module, provider);
        ModuleVersion moduleVersion = requirePublished(resolved, version);
        String ref = StoragePaths.SOURCE_ZIP.equals(archiveName) ? moduleVersion.sourceZipRef : moduleVersion.sourceArchiveRef;
        if (ref == null) {
            throw RegistryException.notFound("Archive not available for " + resolved.id() + "/" + version);
        }
        return blobStorage.getBlob(ref);
    }

    // ==================== Detail ====================

    /**
     * @param version exact version, or null for the latest non-beta version
     */
    public ModuleWire.ModuleDetail detail(String namespace, String module, String provider, String version) {
        ModuleProviderService.ResolvedModuleProvider resolved = requireProvider(namespace, module, provider);
        ModuleVersion moduleVersion = version == null
            ? requireMatching(resolved, null)
            : requirePublished(resolved, version);
        return detail(resolved, moduleVersion);
    }

    /**
     * Detail of the highest published version satisfying {@code constraint}.
     * A blank constraint means the latest non-beta version.
     *
     * @throws RegistryException INVALID_INPUT for a malformed constraint, NOT_FOUND when nothing matches
     */
    public ModuleWire.ModuleDetail detailMatching(String namespace, String module, String provider, String constraint) {
        ModuleProviderService.ResolvedModuleProvider resolved = requireProvider(namespace, module, provider);
        return detail(resolved, requireMatching(resolved, constraint));
    }

    ModuleVersion requireMatching(ModuleProviderService.ResolvedModuleProvider resolved, String constraint) {
        return resolve(resolved, constraint).orElseThrow(() -> RegistryException.notFound(
            constraint == null || constraint.isBlank()
                ? "No published versions of " + resolved.id()
                : "No published version of " + resolved.id() + " matches " + constraint));
    }

    private ModuleWire.ModuleDetail detail(ModuleProviderService.ResolvedModuleProvider resolved, ModuleVersion moduleVersion) {
        ModuleWire.ModuleSummary summary = summarize(resolved.namespace(), resolved.moduleProvider(), moduleVersion);

        List<ModuleWire.Component> submodules = new ArrayList<>();
        for (Submodule submodule : submoduleRepository.findByModuleVersionId(moduleVersion.id, ComponentKind.SUBMODULE)) {
            submodules.add(component(submodule.path, submodule.readmeText, submodule.terraformDocsJson));
        }
        List<ModuleWire.Component> examples = new ArrayList<>();
        for (Submodule example : submoduleRepository.findByModuleVersionId(moduleVersion.id, ComponentKind.EXAMPLE)) {
            examples.add(component(example.path, example.readmeText, example.terraformDocsJson));
        }
        List<String> providers = moduleProviderRepository
            .findByNamespaceAndModule(resolved.namespace().id, resolved.moduleProvider().moduleName).stream()
            .map(mp -> mp.providerName)
            .sorted()
            .toList();

        return new ModuleWire.ModuleDetail(summary.id(), summary.owner(), summary.namespace(), summary.name(),
            summary.version(), summary.provider(), summary.description(), summary.source(), summary.publishedAt(),
            summary.downloads(), summary.verified(), summary.trusted(), summary.internal(),
            component("", moduleVersion.readmeText, moduleVersion.terraformDocsJson),
            submodules, examples, providers, visibleVersions(resolved.moduleProvider().id));
    }

    /**
     * Latest published summary of every provider of {@code namespace/module}.
     */
    public List<ModuleWire.ModuleSummary> providersOf(String namespace, String module) {
        Namespace ns = namespaceService.findByName(namespace)
            .orElseThrow(() -> RegistryException.notFound("Namespace does not exist: " + namespace));
        List<ModuleWire.ModuleSummary> summaries = new ArrayList<>();
        for (ModuleProvider moduleProvider : moduleProviderRepository.findByNamespaceAndModule(ns.id, module)) {
            latest(new ModuleProviderService.ResolvedModuleProvider(ns, moduleProvider))
                .ifPresent(v -> summaries.add(summarize(ns, moduleProvider, v)));
        }
        if (summaries.isEmpty()) {
            throw RegistryException.notFound("Module does not exist: " + namespace + "/" + module);
        }
        return summaries;
    }

    /**
     * Summary of a stored row, looking up its module provider and namespace.
     */
    public Optional<ModuleWire.ModuleSummary> summarize(ModuleVersion moduleVersion) {
        return moduleProviderRepository.findByIdOptional(moduleVersion.moduleProviderId)
            .flatMap(mp -> namespaceRepository.findByIdOptional(mp.namespaceId)
                .map(ns -> summarize(ns, mp, moduleVersion)));
    }

    public ModuleWire.ModuleSummary summarize(Namespace namespace, ModuleProvider moduleProvider, ModuleVersion moduleVersion) {
        String id = namespace.name + "/" + moduleProvider.moduleName + "/" + moduleProvider.providerName + "/" + moduleVersion.version;
        String source = GitUrlTemplate.render(
            moduleProvider.repoBrowseUrlTemplate != null ? moduleProvider.repoBrowseUrlTemplate : moduleProvider.repoBaseUrlTemplate,
            namespace.name, moduleProvider.moduleName, moduleProvider.providerName, moduleVersion.version, moduleProvider.gitPath);
        return new ModuleWire.ModuleSummary(
            id,
            moduleVersion.owner != null ? moduleVersion.owner : namespace.name,
            namespace.name,
            moduleProvider.moduleName,
            moduleVersion.version,
            moduleProvider.providerName,
            moduleVersion.description,
            source,
            moduleVersion.publishedAt == null ? null : DateTimeFormatter.ISO_INSTANT.format(moduleVersion.publishedAt),
            analyticsService.downloadsOfModuleProvider(moduleProvider.id),
            moduleProvider.verified || domainConfig.isVerifiedNamespace(namespace.name),
            domainConfig.isTrustedNamespace(namespace.name),
            moduleVersion.internal);
    }

    // ==================== Helpers ====================

    private ModuleWire.Component component(String path, String readme, String terraformDocsJson) {
        TerraformDocsView docs = TerraformDocsView.of(objectMapper, terraformDocsJson);
        List<ModuleWire.Resource> resources = docs.resources();
        return new ModuleWire.Component(path, readme, resources.isEmpty() && docs.inputs().isEmpty() && docs.outputs().isEmpty(),
            docs.inputs(), docs.outputs(), docs.dependencies(), docs.providerDependencies(), resources);
    }

    private List<String> visibleVersions(Long moduleProviderId) {
        return moduleVersionRepository.findPublishedByModuleProviderId(moduleProviderId).stream()
            .filter(v -> !v.beta)
            .map(v -> v.version)
            .distinct()
            .sorted(SemanticVersion.PRECEDENCE.reversed())
            .toList();
    }

    private ModuleProviderService.ResolvedModuleProvider requireProvider(String namespace, String module, String provider) {
        return moduleProviderService.find(namespace, module, provider)
            .orElseThrow(() -> RegistryException.notFound("Module provider does not exist: "
                + namespace + "/" + module + "/" + provider));
    }

    private ModuleVersion requirePublished(ModuleProviderService.ResolvedModuleProvider resolved, String version) {
        return moduleVersionRepository.findPublishedByVersion(resolved.moduleProvider().id, version)
            .orElseThrow(() -> RegistryException.notFound("Module version does not exist: " + resolved.id() + "/" + version));
    }
}
