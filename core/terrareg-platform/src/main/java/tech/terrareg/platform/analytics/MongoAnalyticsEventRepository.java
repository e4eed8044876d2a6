package tech.terrareg.platform.analytics;

import io.quarkus.mongodb.panache.PanacheMongoRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Typed;

import java.util.List;

/**
 * MongoDB implementation of AnalyticsEventRepository.
 */
@ApplicationScoped
@Typed(AnalyticsEventRepository.class)
class MongoAnalyticsEventRepository implements PanacheMongoRepositoryBase<AnalyticsEvent, Long>, AnalyticsEventRepository {

    @Override
    public long countByModuleVersionId(Long moduleVersionId) {
        return count("moduleVersionId", moduleVersionId);
    }

    @Override
    public long countByModuleProviderId(Long moduleProviderId) {
        return count("moduleProviderId", moduleProviderId);
    }

    @Override
    public List<AnalyticsEvent> findByModuleProviderId(Long moduleProviderId) {
        return list("moduleProviderId", Sort.descending("timestamp"), moduleProviderId);
    }

    @Override
    public long deleteByModuleProviderId(Long moduleProviderId) {
        return delete("moduleProviderId", moduleProviderId);
    }

    // Delegate to Panache methods via interface

    @Override
    public long count() {
        return PanacheMongoRepositoryBase.super.count();
    }

    @Override
    public void persist(AnalyticsEvent event) {
        PanacheMongoRepositoryBase.super.persist(event);
    }
}
