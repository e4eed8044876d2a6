package tech.terrareg.platform.analytics;

import java.util.List;

/**
 * Repository interface for AnalyticsEvent entities.
 */
public interface AnalyticsEventRepository {

    // Read operations
    long countByModuleVersionId(Long moduleVersionId);
    long countByModuleProviderId(Long moduleProviderId);
    long count();

    /**
     * Events for the module provider, newest first.
     */
    List<AnalyticsEvent> findByModuleProviderId(Long moduleProviderId);

    // Write operations
    void persist(AnalyticsEvent event);
    long deleteByModuleProviderId(Long moduleProviderId);
}
