package tech.terrareg.platform.analytics;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.terrareg.platform.module.ModuleProviderRepository;
import tech.terrareg.platform.module.ModuleVersion;
import tech.terrareg.platform.module.ModuleVersionRepository;
import tech.terrareg.platform.namespace.NamespaceRepository;
import tech.terrareg.platform.shared.TsidGenerator;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Download recording and the aggregate queries behind the analytics endpoints.
 */
@ApplicationScoped
public class AnalyticsService {

    private static final Logger LOG = Logger.getLogger(AnalyticsService.class);

    @Inject
    AnalyticsRecorder analyticsRecorder;

    @Inject
    AnalyticsEventRepository analyticsEventRepository;

    @Inject
    NamespaceRepository namespaceRepository;

    @Inject
    ModuleProviderRepository moduleProviderRepository;

    @Inject
    ModuleVersionRepository moduleVersionRepository;

    @Inject
    Clock clock;

    public record StatsSummary(long namespaces, long modules, long moduleVersions, long downloads) {}

    /**
     * Most recent download per analytics token.
     */
    public record TokenVersion(String token, String version, String environment, String terraformVersion,
                               Instant timestamp) {}

    /**
     * Queue a download event. Never blocks beyond the recorder's offer timeout.
     */
    public void recordDownload(ModuleVersion moduleVersion, String analyticsToken, String environment,
                               String terraformVersion, String userAgent) {
        AnalyticsEvent event = new AnalyticsEvent();
        event.id = TsidGenerator.generate();
        event.moduleVersionId = moduleVersion.id;
        event.moduleProviderId = moduleVersion.moduleProviderId;
        event.analyticsToken = analyticsToken;
        event.environment = environment;
        event.terraformVersion = terraformVersion;
        event.userAgent = userAgent;
        event.timestamp = Instant.now(clock);
        if (!analyticsRecorder.record(event)) {
            LOG.debugf("Dropped download event for module version %d", moduleVersion.id);
        }
    }

    public StatsSummary statsSummary() {
        return new StatsSummary(
            namespaceRepository.count(),
            moduleProviderRepository.count(),
            moduleVersionRepository.countPublished(),
            analyticsEventRepository.count());
    }

    public long downloadsOfVersion(Long moduleVersionId) {
        return analyticsEventRepository.countByModuleVersionId(moduleVersionId);
    }

    public long downloadsOfModuleProvider(Long moduleProviderId) {
        return analyticsEventRepository.countByModuleProviderId(moduleProviderId);
    }

    public Optional<ModuleVersion> mostRecentlyPublished() {
        return moduleVersionRepository.findMostRecentlyPublished();
    }

    /**
     * Latest download per token for one module provider, ordered by token.
     */
    public List<TokenVersion> tokenVersions(Long moduleProviderId) {
        Map<Long, String> versions = new HashMap<>();
        for (ModuleVersion row : moduleVersionRepository.findByModuleProviderId(moduleProviderId)) {
            versions.put(row.id, row.version);
        }
        Map<String, AnalyticsEvent> latest = new TreeMap<>();
        for (AnalyticsEvent event : analyticsEventRepository.findByModuleProviderId(moduleProviderId)) {
            if (event.analyticsToken == null) {
                continue;
            }
            latest.merge(event.analyticsToken, event,
                (a, b) -> Comparator.comparing((AnalyticsEvent e) -> e.timestamp).compare(a, b) >= 0 ? a : b);
        }
        return latest.values().stream()
            .map(e -> new TokenVersion(e.analyticsToken, versions.get(e.moduleVersionId), e.environment,
                e.terraformVersion, e.timestamp))
            .toList();
    }
}
