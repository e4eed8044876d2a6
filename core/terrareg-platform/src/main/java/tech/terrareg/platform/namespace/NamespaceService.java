package tech.terrareg.platform.namespace;

import com.mongodb.MongoWriteException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.terrareg.platform.authorization.UserGroupNamespacePermissionRepository;
import tech.terrareg.platform.config.DomainConfig;
import tech.terrareg.platform.error.RegistryException;
import tech.terrareg.platform.module.ModuleProviderRepository;
import tech.terrareg.platform.provider.ProviderRepository;
import tech.terrareg.platform.shared.TsidGenerator;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Namespace lifecycle: explicit creation, auto-creation during ingestion and
 * deletion once empty.
 */
@ApplicationScoped
public class NamespaceService {

    private static final Logger LOG = Logger.getLogger(NamespaceService.class);

    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-z0-9][a-z0-9-_]*[a-z0-9]$");
    private static final int DUPLICATE_KEY_ERROR = 11000;

    @Inject
    NamespaceRepository namespaceRepository;

    @Inject
    ModuleProviderRepository moduleProviderRepository;

    @Inject
    ProviderRepository providerRepository;

    @Inject
    UserGroupNamespacePermissionRepository permissionRepository;

    @Inject
    DomainConfig domainConfig;

    public Optional<Namespace> findByName(String name) {
        return namespaceRepository.findByName(name);
    }

    public Namespace require(String name) {
        return namespaceRepository.findByName(name)
            .orElseThrow(() -> RegistryException.notFound("Namespace does not exist: " + name));
    }

    public List<Namespace> list(int offset, int limit) {
        return namespaceRepository.listPage(offset, limit);
    }

    public long count() {
        return namespaceRepository.count();
    }

    /**
     * @throws RegistryException CONFLICT if a namespace with the same folded name exists
     */
    @Transactional
    public Namespace create(String name, String displayName, NamespaceType type) {
        validateName(name);
        if (namespaceRepository.findByName(name).isPresent()) {
            throw RegistryException.conflict("A namespace already exists with this name");
        }
        Namespace namespace = newNamespace(name, displayName, type);
        try {
            namespaceRepository.persist(namespace);
        } catch (MongoWriteException e) {
            if (e.getCode() == DUPLICATE_KEY_ERROR) {
                throw RegistryException.conflict("A namespace already exists with this name");
            }
            throw e;
        }
        LOG.infof("Created namespace %s", namespace.name);
        return namespace;
    }

    /**
     * Return the namespace, creating it when auto-creation is enabled. A concurrent
     * creation of the same name resolves to the row that won.
     *
     * @throws RegistryException NOT_FOUND if absent and auto-creation is disabled
     */
    public Namespace findOrCreate(String name) {
        Optional<Namespace> existing = namespaceRepository.findByName(name);
        if (existing.isPresent()) {
            return existing.get();
        }
        Namespace namespace = prepareAutoCreated(name);
        try {
            namespaceRepository.persist(namespace);
            LOG.infof("Auto-created namespace %s", namespace.name);
            return namespace;
        } catch (MongoWriteException e) {
            if (e.getCode() == DUPLICATE_KEY_ERROR) {
                return namespaceRepository.findByName(name)
                    .orElseThrow(() -> new IllegalStateException("Duplicate key but namespace not found: " + name));
            }
            throw e;
        }
    }

    /**
     * Build, without storing, the namespace that auto-creation would add.
     *
     * @throws RegistryException NOT_FOUND if auto-creation is disabled, INVALID_INPUT for a bad name
     */
    public Namespace prepareAutoCreated(String name) {
        if (!domainConfig.autoCreateNamespace()) {
            throw RegistryException.notFound("Namespace does not exist: " + name);
        }
        validateName(name);
        return newNamespace(name, null, NamespaceType.ORGANISATION);
    }

    /**
     * Store a namespace built by {@link #prepareAutoCreated}, in the caller's transaction.
     *
     * @throws RegistryException CONFLICT if the name was taken in the meantime
     */
    public void persistAutoCreated(Namespace namespace) {
        try {
            namespaceRepository.persist(namespace);
        } catch (MongoWriteException e) {
            if (e.getCode() == DUPLICATE_KEY_ERROR) {
                throw RegistryException.conflict("Namespace was created concurrently: " + namespace.name);
            }
            throw e;
        }
        LOG.infof("Auto-created namespace %s", namespace.name);
    }

    /**
     * Delete an empty namespace and the group permissions that reference it.
     *
     * @throws RegistryException INVALID_INPUT while modules or providers remain
     */
    @Transactional
    public void delete(String name) {
        Namespace namespace = require(name);
        if (moduleProviderRepository.countByNamespaceId(namespace.id) > 0
            || providerRepository.countByNamespaceId(namespace.id) > 0) {
            throw RegistryException.invalidInput("Namespace cannot be deleted while it contains modules or providers");
        }
        long permissions = permissionRepository.deleteByNamespaceId(namespace.id);
        namespaceRepository.deleteById(namespace.id);
        LOG.infof("Deleted namespace %s and %d group permissions", namespace.name, permissions);
    }

    static void validateName(String name) {
        if (name == null || !NAME_PATTERN.matcher(Namespace.fold(name)).matches()) {
            throw RegistryException.invalidInput("Namespace name is invalid: " + name);
        }
    }

    private static Namespace newNamespace(String name, String displayName, NamespaceType type) {
        Namespace namespace = new Namespace();
        namespace.id = TsidGenerator.generate();
        namespace.name = name;
        namespace.nameLower = Namespace.fold(name);
        namespace.displayName = displayName;
        namespace.type = type != null ? type : NamespaceType.ORGANISATION;
        return namespace;
    }
}
