package tech.terrareg.platform.module;

import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Map-backed {@link ModuleVersionRepository} shared by module and ingestion tests.
 */
public class InMemoryModuleVersionRepository implements ModuleVersionRepository {

    public final Map<Long, ModuleVersion> rows = new LinkedHashMap<>();

    @Override
    public Optional<ModuleVersion> findByIdOptional(Long id) {
        return Optional.ofNullable(rows.get(id));
    }

    @Override
    public List<ModuleVersion> findByModuleProviderId(Long moduleProviderId) {
        return rows.values().stream().filter(v -> Objects.equals(v.moduleProviderId, moduleProviderId)).toList();
    }

    @Override
    public List<ModuleVersion> findPublishedByModuleProviderId(Long moduleProviderId) {
        return findByModuleProviderId(moduleProviderId).stream().filter(v -> v.published).toList();
    }

    @Override
    public List<ModuleVersion> findAllByVersion(Long moduleProviderId, String version) {
        return findByModuleProviderId(moduleProviderId).stream().filter(v -> v.version.equals(version)).toList();
    }

    @Override
    public Optional<ModuleVersion> findPublishedByVersion(Long moduleProviderId, String version) {
        return findAllByVersion(moduleProviderId, version).stream().filter(v -> v.published).findFirst();
    }

    @Override
    public Optional<ModuleVersion> findLatestByVersion(Long moduleProviderId, String version) {
        return findAllByVersion(moduleProviderId, version).stream().max(Comparator.comparing(v -> v.id));
    }

    @Override
    public List<ModuleVersion> listPublished() {
        return rows.values().stream().filter(v -> v.published).toList();
    }

    @Override
    public Optional<ModuleVersion> findMostRecentlyPublished() {
        return listPublished().stream()
            .filter(v -> v.publishedAt != null)
            .max(Comparator.comparing((ModuleVersion v) -> v.publishedAt).thenComparing(v -> v.id));
    }

    @Override
    public long countPublished() {
        return listPublished().size();
    }

    @Override
    public void persist(ModuleVersion moduleVersion) {
        rows.put(moduleVersion.id, moduleVersion);
    }

    @Override
    public void update(ModuleVersion moduleVersion) {
        rows.put(moduleVersion.id, moduleVersion);
    }

    @Override
    public boolean deleteById(Long id) {
        return rows.remove(id) != null;
    }

    /**
     * A {@link ModuleVersionService} over this repository. Other collaborators are left unset.
     */
    public ModuleVersionService service(Clock clock) {
        ModuleVersionService service = new ModuleVersionService();
        service.moduleVersionRepository = this;
        service.clock = clock;
        return service;
    }
}
