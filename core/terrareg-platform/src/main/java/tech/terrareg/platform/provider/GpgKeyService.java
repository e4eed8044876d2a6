package tech.terrareg.platform.provider;

import com.mongodb.MongoWriteException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.terrareg.platform.error.RegistryException;
import tech.terrareg.platform.namespace.Namespace;
import tech.terrareg.platform.namespace.NamespaceService;
import tech.terrareg.platform.shared.TsidGenerator;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Namespace GPG keys that sign provider releases.
 */
@ApplicationScoped
public class GpgKeyService {

    private static final Logger LOG = Logger.getLogger(GpgKeyService.class);

    private static final int DUPLICATE_KEY_ERROR = 11000;

    @Inject
    GpgKeyRepository gpgKeyRepository;

    @Inject
    NamespaceService namespaceService;

    @Inject
    Clock clock;

    /**
     * A key together with the name of the namespace it belongs to.
     */
    public record NamespacedKey(String namespace, GpgKey key) {}

    public List<NamespacedKey> list(List<String> namespaces) {
        List<NamespacedKey> keys = new ArrayList<>();
        for (String name : namespaces) {
            namespaceService.findByName(name).ifPresent(ns ->
                gpgKeyRepository.findByNamespaceIds(List.of(ns.id))
                    .forEach(key -> keys.add(new NamespacedKey(ns.name, key))));
        }
        return keys;
    }

    public NamespacedKey get(String namespace, String keyId) {
        Namespace ns = namespaceService.require(namespace);
        GpgKey key = gpgKeyRepository.findByNamespaceAndKeyId(ns.id, keyId.toUpperCase(Locale.ROOT))
            .orElseThrow(() -> RegistryException.notFound("GPG key does not exist: " + keyId));
        return new NamespacedKey(ns.name, key);
    }

    /**
     * @throws RegistryException CONFLICT if a key with the same fingerprint exists
     */
    @Transactional
    public NamespacedKey create(String namespace, String asciiArmor, String source, String sourceUrl) {
        Namespace ns = namespaceService.require(namespace);
        GpgKeyParser.ParsedKey parsed = GpgKeyParser.parse(asciiArmor);
        if (gpgKeyRepository.findByFingerprint(parsed.fingerprint()).isPresent()) {
            throw RegistryException.conflict("GPG key already exists: " + parsed.keyId());
        }
        GpgKey key = new GpgKey();
        key.id = TsidGenerator.generate();
        key.namespaceId = ns.id;
        key.asciiArmor = asciiArmor.trim();
        key.keyId = parsed.keyId();
        key.fingerprint = parsed.fingerprint();
        key.source = source == null ? "" : source;
        key.sourceUrl = sourceUrl;
        key.createdAt = Instant.now(clock);
        try {
            gpgKeyRepository.persist(key);
        } catch (MongoWriteException e) {
            if (e.getError().getCode() == DUPLICATE_KEY_ERROR) {
                throw RegistryException.conflict("GPG key already exists: " + parsed.keyId());
            }
            throw e;
        }
        LOG.infof("Added GPG key %s to namespace %s", key.keyId, ns.name);
        return new NamespacedKey(ns.name, key);
    }

    @Transactional
    public void delete(String namespace, String keyId) {
        NamespacedKey existing = get(namespace, keyId);
        gpgKeyRepository.deleteById(existing.key().id);
        LOG.infof("Deleted GPG key %s from namespace %s", existing.key().keyId, existing.namespace());
    }
}
