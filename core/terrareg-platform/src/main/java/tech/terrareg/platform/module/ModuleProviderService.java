package tech.terrareg.platform.module;

import com.mongodb.MongoWriteException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.terrareg.platform.analytics.AnalyticsEventRepository;
import tech.terrareg.platform.config.DomainConfig;
import tech.terrareg.platform.error.RegistryException;
import tech.terrareg.platform.namespace.Namespace;
import tech.terrareg.platform.namespace.NamespaceService;
import tech.terrareg.platform.shared.TsidGenerator;
import tech.terrareg.platform.storage.BlobStorage;
import tech.terrareg.platform.storage.StoragePaths;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Module provider lifecycle and repository settings.
 */
@ApplicationScoped
public class ModuleProviderService {

    private static final Logger LOG = Logger.getLogger(ModuleProviderService.class);

    private static final Pattern MODULE_NAME = Pattern.compile("^[0-9a-zA-Z][0-9a-zA-Z-_]*[0-9A-Za-z]$");
    private static final Pattern PROVIDER_NAME = Pattern.compile("^[0-9a-z]+$");
    private static final int DUPLICATE_KEY_ERROR = 11000;

    @Inject
    ModuleProviderRepository moduleProviderRepository;

    @Inject
    ModuleVersionRepository moduleVersionRepository;

    @Inject
    ModuleVersionService moduleVersionService;

    @Inject
    AnalyticsEventRepository analyticsEventRepository;

    @Inject
    NamespaceService namespaceService;

    @Inject
    BlobStorage blobStorage;

    @Inject
    DomainConfig domainConfig;

    /**
     * A module provider together with its namespace.
     */
    public record ResolvedModuleProvider(Namespace namespace, ModuleProvider moduleProvider) {

        public String id() {
            return namespace.name + "/" + moduleProvider.moduleName + "/" + moduleProvider.providerName;
        }
    }

    /**
     * Repository settings; null fields are left unchanged.
     */
    public record Settings(
        String repoBaseUrlTemplate,
        String repoCloneUrlTemplate,
        String repoBrowseUrlTemplate,
        String gitTagFormat,
        String gitPath,
        Boolean verified
    ) {}

    public Optional<ResolvedModuleProvider> find(String namespace, String module, String provider) {
        return namespaceService.findByName(namespace).flatMap(ns ->
            moduleProviderRepository.findByTriple(ns.id, module, provider)
                .map(mp -> new ResolvedModuleProvider(ns, mp)));
    }

    public ResolvedModuleProvider require(String namespace, String module, String provider) {
        return find(namespace, module, provider)
            .orElseThrow(() -> RegistryException.notFound("Module provider does not exist: "
                + namespace + "/" + module + "/" + provider));
    }

    @Transactional
    public ResolvedModuleProvider create(String namespace, String module, String provider, Settings settings) {
        Namespace ns = namespaceService.require(namespace);
        validateNames(module, provider);
        if (moduleProviderRepository.findByTriple(ns.id, module, provider).isPresent()) {
            throw RegistryException.conflict("Module provider already exists");
        }
        ModuleProvider moduleProvider = newModuleProvider(ns, module, provider);
        if (settings != null) {
            apply(moduleProvider, settings);
        }
        persist(moduleProvider);
        LOG.infof("Created module provider %s/%s/%s", ns.name, module, provider);
        return new ResolvedModuleProvider(ns, moduleProvider);
    }

    /**
     * The module provider an ingestion writes to. A namespace or module provider
     * flagged as new does not exist yet; {@link #saveNew} stores it.
     */
    public record IngestionTarget(ResolvedModuleProvider resolved, boolean newNamespace, boolean newModuleProvider) {

        public String id() {
            return resolved.id();
        }
    }

    /**
     * Resolve the module provider for an ingestion without writing anything.
     * Missing entities are built in memory when the auto-create flags allow it.
     *
     * @throws RegistryException NOT_FOUND when a missing entity may not be auto-created
     */
    public IngestionTarget resolveForIngestion(String namespace, String module, String provider) {
        Optional<Namespace> existingNamespace = namespaceService.findByName(namespace);
        if (existingNamespace.isPresent()) {
            Optional<ModuleProvider> existing =
                moduleProviderRepository.findByTriple(existingNamespace.get().id, module, provider);
            if (existing.isPresent()) {
                return new IngestionTarget(new ResolvedModuleProvider(existingNamespace.get(), existing.get()), false, false);
            }
        }
        if (!domainConfig.autoCreateModuleProvider()) {
            throw RegistryException.notFound("Module provider does not exist: " + namespace + "/" + module + "/" + provider);
        }
        Namespace ns = existingNamespace.orElseGet(() -> namespaceService.prepareAutoCreated(namespace));
        validateNames(module, provider);
        return new IngestionTarget(new ResolvedModuleProvider(ns, newModuleProvider(ns, module, provider)),
            existingNamespace.isEmpty(), true);
    }

    /**
     * Store the new entities of {@code target}, in the caller's transaction.
     *
     * @throws RegistryException CONFLICT if either was created concurrently
     */
    public void saveNew(IngestionTarget target) {
        if (target.newNamespace()) {
            namespaceService.persistAutoCreated(target.resolved().namespace());
        }
        if (target.newModuleProvider()) {
            persist(target.resolved().moduleProvider());
            LOG.infof("Auto-created module provider %s", target.id());
        }
    }

    @Transactional
    public ResolvedModuleProvider updateSettings(String namespace, String module, String provider, Settings settings) {
        ResolvedModuleProvider resolved = require(namespace, module, provider);
        apply(resolved.moduleProvider(), settings);
        moduleProviderRepository.update(resolved.moduleProvider());
        LOG.infof("Updated settings of %s", resolved.id());
        return resolved;
    }

    /**
     * Delete the module provider with every version, analytics row and stored archive.
     */
    @Transactional
    public void delete(String namespace, String module, String provider) {
        ResolvedModuleProvider resolved = require(namespace, module, provider);
        ModuleProvider moduleProvider = resolved.moduleProvider();
        for (ModuleVersion version : moduleVersionRepository.findByModuleProviderId(moduleProvider.id)) {
            moduleVersionService.deleteRows(version);
        }
        long analytics = analyticsEventRepository.deleteByModuleProviderId(moduleProvider.id);
        moduleProviderRepository.deleteById(moduleProvider.id);
        blobStorage.deletePrefix(StoragePaths.moduleProviderDirectory(
            resolved.namespace().name, moduleProvider.moduleName, moduleProvider.providerName));
        LOG.infof("Deleted module provider %s with %d analytics rows", resolved.id(), analytics);
    }

    private void apply(ModuleProvider moduleProvider, Settings settings) {
        if (settings.repoBaseUrlTemplate() != null) {
            GitUrlTemplate.validate(settings.repoBaseUrlTemplate());
            moduleProvider.repoBaseUrlTemplate = emptyToNull(settings.repoBaseUrlTemplate());
        }
        if (settings.repoCloneUrlTemplate() != null) {
            GitUrlTemplate.validate(settings.repoCloneUrlTemplate());
            moduleProvider.repoCloneUrlTemplate = emptyToNull(settings.repoCloneUrlTemplate());
        }
        if (settings.repoBrowseUrlTemplate() != null) {
            GitUrlTemplate.validate(settings.repoBrowseUrlTemplate());
            moduleProvider.repoBrowseUrlTemplate = emptyToNull(settings.repoBrowseUrlTemplate());
        }
        if (settings.gitTagFormat() != null) {
            if (!settings.gitTagFormat().isEmpty() && !settings.gitTagFormat().contains("{")) {
                throw RegistryException.invalidInput("Git tag format must contain {version}, {major}, {minor} or {patch}");
            }
            moduleProvider.gitTagFormat = settings.gitTagFormat().isEmpty()
                ? ModuleProvider.DEFAULT_GIT_TAG_FORMAT : settings.gitTagFormat();
        }
        if (settings.gitPath() != null) {
            if (settings.gitPath().contains("..")) {
                throw RegistryException.invalidInput("Git path must not contain '..'");
            }
            moduleProvider.gitPath = emptyToNull(settings.gitPath().replaceAll("^/+|/+$", ""));
        }
        if (settings.verified() != null) {
            moduleProvider.verified = settings.verified();
        }
    }

    private void persist(ModuleProvider moduleProvider) {
        try {
            moduleProviderRepository.persist(moduleProvider);
        } catch (MongoWriteException e) {
            if (e.getCode() == DUPLICATE_KEY_ERROR) {
                throw RegistryException.conflict("Module provider already exists");
            }
            throw e;
        }
    }

    static void validateNames(String module, String provider) {
        if (module == null || !MODULE_NAME.matcher(module).matches()) {
            throw RegistryException.invalidInput("Module name is invalid: " + module);
        }
        if (provider == null || !PROVIDER_NAME.matcher(provider).matches()) {
            throw RegistryException.invalidInput("Provider name is invalid: " + provider);
        }
    }

    private ModuleProvider newModuleProvider(Namespace namespace, String module, String provider) {
        ModuleProvider moduleProvider = new ModuleProvider();
        moduleProvider.id = TsidGenerator.generate();
        moduleProvider.namespaceId = namespace.id;
        moduleProvider.moduleName = module;
        moduleProvider.providerName = provider;
        moduleProvider.verified = domainConfig.isVerifiedNamespace(namespace.name);
        return moduleProvider;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
