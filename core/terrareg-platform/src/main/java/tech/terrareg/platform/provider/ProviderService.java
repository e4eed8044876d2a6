package tech.terrareg.platform.provider;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import org.semver4j.Semver;
import tech.terrareg.platform.config.DomainConfig;
import tech.terrareg.platform.error.RegistryException;
import tech.terrareg.platform.error.StorageUnavailableException;
import tech.terrareg.platform.module.SemanticVersion;
import tech.terrareg.platform.namespace.Namespace;
import tech.terrareg.platform.namespace.NamespaceService;
import tech.terrareg.platform.presign.PresignedUrlService;
import tech.terrareg.platform.shared.Hashing;
import tech.terrareg.platform.shared.TsidGenerator;
import tech.terrareg.platform.storage.BlobStorage;
import tech.terrareg.platform.storage.StoragePaths;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Provider registry protocol and provider release ingestion.
 *
 * A provider version becomes published once it has at least one binary, a
 * SHA256SUMS file and its detached signature.
 */
@ApplicationScoped
public class ProviderService {

    private static final Logger LOG = Logger.getLogger(ProviderService.class);

    private static final Pattern PROVIDER_NAME = Pattern.compile("^[a-z0-9][a-z0-9-]*$");
    private static final Pattern PLATFORM_PART = Pattern.compile("^[a-z0-9_]+$");
    static final String SHASUMS = "SHA256SUMS";
    static final String SHASUMS_SIGNATURE = "SHA256SUMS.sig";
    public static final String SOURCE_PATH_PREFIX = "/v1/terrareg/providers/";

    @Inject
    ProviderRepository providerRepository;

    @Inject
    ProviderVersionRepository providerVersionRepository;

    @Inject
    ProviderCategoryRepository providerCategoryRepository;

    @Inject
    GpgKeyRepository gpgKeyRepository;

    @Inject
    NamespaceService namespaceService;

    @Inject
    PresignedUrlService presignedUrlService;

    @Inject
    BlobStorage blobStorage;

    @Inject
    DomainConfig domainConfig;

    @Inject
    Clock clock;

    // ==================== Registry protocol ====================

    public ProviderWire.VersionsResponse versions(String namespace, String name) {
        Namespace ns = namespaceService.require(namespace);
        Provider provider = requireProvider(ns, name);
        List<ProviderWire.VersionEntry> entries = new ArrayList<>();
        for (ProviderVersion version : publishedVersions(provider)) {
            List<ProviderWire.Platform> platforms = providerVersionRepository.findBinaries(version.id).stream()
                .map(b -> new ProviderWire.Platform(b.os, b.arch))
                .toList();
            entries.add(new ProviderWire.VersionEntry(version.version, version.protocols, platforms));
        }
        return new ProviderWire.VersionsResponse(ns.name + "/" + provider.name, entries, null);
    }

    public ProviderWire.Download download(String namespace, String name, String version, String os, String arch) {
        Namespace ns = namespaceService.require(namespace);
        Provider provider = requireProvider(ns, name);
        ProviderVersion providerVersion = providerVersionRepository.findByVersion(provider.id, version)
            .filter(v -> v.published)
            .orElseThrow(() -> RegistryException.notFound("Provider version does not exist: " + ns.name + "/" + name + "/" + version));
        ProviderVersionBinary binary = providerVersionRepository.findBinary(providerVersion.id, os, arch)
            .orElseThrow(() -> RegistryException.notFound("No binary for " + os + "_" + arch));

        List<ProviderWire.GpgPublicKey> keys = gpgKeyRepository.findByNamespaceIds(List.of(ns.id)).stream()
            .filter(k -> providerVersion.gpgKeyId == null || providerVersion.gpgKeyId.equals(k.id))
            .map(k -> new ProviderWire.GpgPublicKey(k.keyId, k.asciiArmor, k.trustSignature, k.source, k.sourceUrl))
            .toList();

        String base = SOURCE_PATH_PREFIX + ns.name + "/" + provider.name + "/" + version + "/";
        return new ProviderWire.Download(
            providerVersion.protocols,
            binary.os,
            binary.arch,
            binary.filename,
            presignedUrlService.signAbsolute(base + binary.filename),
            presignedUrlService.signAbsolute(base + shasumsFilename(provider.name, version)),
            presignedUrlService.signAbsolute(base + shasumsFilename(provider.name, version) + ".sig"),
            binary.sha256,
            new ProviderWire.SigningKeys(keys));
    }

    public ProviderWire.ProviderDetail detail(String namespace, String name) {
        Namespace ns = namespaceService.require(namespace);
        Provider provider = requireProvider(ns, name);
        List<ProviderVersion> published = publishedVersions(provider);
        ProviderVersion latest = published.stream().filter(v -> !v.beta).findFirst()
            .orElseThrow(() -> RegistryException.notFound("Provider has no published versions: " + ns.name + "/" + name));
        String category = provider.categoryId == null ? null
            : providerCategoryRepository.findByIdOptional(provider.categoryId).map(c -> c.slug).orElse(null);
        return new ProviderWire.ProviderDetail(
            ns.name + "/" + provider.name + "/" + latest.version,
            ns.name,
            ns.name,
            provider.name,
            latest.version,
            provider.description,
            provider.sourceUrl,
            latest.publishedAt == null ? null : DateTimeFormatter.ISO_INSTANT.format(latest.publishedAt),
            provider.tier,
            category,
            published.stream().map(v -> v.version).toList());
    }

    public List<ProviderWire.Category> categories() {
        return providerCategoryRepository.listAll().stream()
            .map(c -> new ProviderWire.Category(c.id, c.name, c.slug, c.userSelectable))
            .toList();
    }

    /**
     * Stored release artifact; the caller has verified the presigned URL.
     */
    public InputStream openArtifact(String namespace, String name, String version, String filename) {
        Namespace ns = namespaceService.require(namespace);
        Provider provider = requireProvider(ns, name);
        ProviderVersion providerVersion = providerVersionRepository.findByVersion(provider.id, version)
            .orElseThrow(() -> RegistryException.notFound("Provider version does not exist"));
        String shasums = shasumsFilename(provider.name, version);
        if (filename.equals(shasums)) {
            return blobStorage.getBlob(requireRef(providerVersion.shasumsRef));
        }
        if (filename.equals(shasums + ".sig")) {
            return blobStorage.getBlob(requireRef(providerVersion.shasumsSignatureRef));
        }
        return providerVersionRepository.findBinaries(providerVersion.id).stream()
            .filter(b -> b.filename.equals(filename))
            .findFirst()
            .map(b -> blobStorage.getBlob(b.blobRef))
            .orElseThrow(() -> RegistryException.notFound("No such release artifact: " + filename));
    }

    // ==================== Release ingestion ====================

    /**
     * Store one platform zip. Creates the provider and version on first upload.
     */
    @Transactional
    public ProviderVersionBinary uploadBinary(String namespace, String name, String version, String os, String arch,
                                              InputStream content) {
        requireHosting();
        if (!PLATFORM_PART.matcher(os).matches() || !PLATFORM_PART.matcher(arch).matches()) {
            throw RegistryException.invalidInput("Invalid platform: " + os + "_" + arch);
        }
        ProviderVersion providerVersion = findOrCreateVersion(namespace, name, version);
        Namespace ns = namespaceService.require(namespace);

        byte[] bytes = readAll(content);
        String blobRef = StoragePaths.providerBinary(ns.name, name, version, os, arch);
        blobStorage.putBlob(blobRef, new ByteArrayInputStream(bytes));

        ProviderVersionBinary binary = providerVersionRepository.findBinary(providerVersion.id, os, arch).orElse(null);
        boolean created = binary == null;
        if (created) {
            binary = new ProviderVersionBinary();
            binary.id = TsidGenerator.generate();
            binary.providerVersionId = providerVersion.id;
            binary.os = os;
            binary.arch = arch;
        }
        binary.filename = "terraform-provider-" + name + "_" + version + "_" + os + "_" + arch + ".zip";
        binary.sha256 = Hashing.sha256Hex(bytes);
        binary.size = bytes.length;
        binary.blobRef = blobRef;
        if (created) {
            providerVersionRepository.persistBinary(binary);
        } else {
            providerVersionRepository.updateBinary(binary);
        }
        LOG.infof("Stored provider binary %s/%s/%s %s_%s (%d bytes)", ns.name, name, version, os, arch, bytes.length);
        refreshPublication(providerVersion);
        return binary;
    }

    @Transactional
    public void uploadShasums(String namespace, String name, String version, InputStream content) {
        requireHosting();
        ProviderVersion providerVersion = findOrCreateVersion(namespace, name, version);
        Namespace ns = namespaceService.require(namespace);
        String ref = StoragePaths.safeJoinPaths(
            StoragePaths.providerVersionDirectory(ns.name, name, version), SHASUMS);
        blobStorage.putBlob(ref, new ByteArrayInputStream(readAll(content)));
        providerVersion.shasumsRef = ref;
        providerVersionRepository.update(providerVersion);
        refreshPublication(providerVersion);
    }

    /**
     * Store the detached signature. When {@code keyId} names a namespace key, only that key is advertised.
     */
    @Transactional
    public void uploadShasumsSignature(String namespace, String name, String version, String keyId, InputStream content) {
        requireHosting();
        ProviderVersion providerVersion = findOrCreateVersion(namespace, name, version);
        Namespace ns = namespaceService.require(namespace);
        if (keyId != null && !keyId.isBlank()) {
            GpgKey key = gpgKeyRepository.findByNamespaceAndKeyId(ns.id, keyId.toUpperCase(Locale.ROOT))
                .orElseThrow(() -> RegistryException.invalidInput("Unknown GPG key for namespace " + ns.name + ": " + keyId));
            providerVersion.gpgKeyId = key.id;
        }
        String ref = StoragePaths.safeJoinPaths(
            StoragePaths.providerVersionDirectory(ns.name, name, version), SHASUMS_SIGNATURE);
        blobStorage.putBlob(ref, new ByteArrayInputStream(readAll(content)));
        providerVersion.shasumsSignatureRef = ref;
        providerVersionRepository.update(providerVersion);
        refreshPublication(providerVersion);
    }

    // ==================== Helpers ====================

    private ProviderVersion findOrCreateVersion(String namespace, String name, String version) {
        if (!PROVIDER_NAME.matcher(name).matches()) {
            throw RegistryException.invalidInput("Invalid provider name: " + name);
        }
        Semver semver = SemanticVersion.parse(version);
        Namespace ns = namespaceService.findOrCreate(namespace);
        Provider provider = providerRepository.findByNamespaceAndName(ns.id, name).orElseGet(() -> {
            Provider created = new Provider();
            created.id = TsidGenerator.generate();
            created.namespaceId = ns.id;
            created.name = name;
            providerRepository.persist(created);
            LOG.infof("Created provider %s/%s", ns.name, name);
            return created;
        });
        return providerVersionRepository.findByVersion(provider.id, semver.getVersion()).orElseGet(() -> {
            ProviderVersion created = new ProviderVersion();
            created.id = TsidGenerator.generate();
            created.providerId = provider.id;
            created.version = semver.getVersion();
            created.beta = SemanticVersion.isBeta(semver);
            providerVersionRepository.persist(created);
            return created;
        });
    }

    private void refreshPublication(ProviderVersion providerVersion) {
        boolean complete = providerVersion.shasumsRef != null
            && providerVersion.shasumsSignatureRef != null
            && !providerVersionRepository.findBinaries(providerVersion.id).isEmpty();
        if (complete && !providerVersion.published) {
            providerVersion.published = true;
            providerVersion.publishedAt = Instant.now(clock).truncatedTo(ChronoUnit.SECONDS);
            providerVersionRepository.update(providerVersion);
            LOG.infof("Published provider version row %d (%s)", providerVersion.id, providerVersion.version);
        }
    }

    private List<ProviderVersion> publishedVersions(Provider provider) {
        return providerVersionRepository.findByProviderId(provider.id).stream()
            .filter(v -> v.published)
            .sorted(Comparator.comparing((ProviderVersion v) -> v.version, SemanticVersion.PRECEDENCE).reversed())
            .toList();
    }

    private Provider requireProvider(Namespace ns, String name) {
        return providerRepository.findByNamespaceAndName(ns.id, name)
            .orElseThrow(() -> RegistryException.notFound("Provider does not exist: " + ns.name + "/" + name));
    }

    private void requireHosting() {
        if (!domainConfig.allowProviderHosting()) {
            throw RegistryException.invalidInput("Provider hosting is disabled");
        }
    }

    static String shasumsFilename(String name, String version) {
        return "terraform-provider-" + name + "_" + version + "_" + SHASUMS;
    }

    private static String requireRef(String ref) {
        return Optional.ofNullable(ref).orElseThrow(() -> RegistryException.notFound("Artifact not uploaded"));
    }

    private static byte[] readAll(InputStream content) {
        try (InputStream in = content) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new StorageUnavailableException("Unable to read uploaded provider artifact", e);
        }
    }
}
