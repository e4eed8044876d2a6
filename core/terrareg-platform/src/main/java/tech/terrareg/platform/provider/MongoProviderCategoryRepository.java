package tech.terrareg.platform.provider;

import io.quarkus.mongodb.panache.PanacheMongoRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Typed;

import java.util.List;
import java.util.Optional;

/**
 * MongoDB implementation of ProviderCategoryRepository.
 */
@ApplicationScoped
@Typed(ProviderCategoryRepository.class)
class MongoProviderCategoryRepository
        implements PanacheMongoRepositoryBase<ProviderCategory, Long>, ProviderCategoryRepository {

    @Override
    public List<ProviderCategory> listAll() {
        return PanacheMongoRepositoryBase.super.listAll(Sort.ascending("slug"));
    }

    @Override
    public Optional<ProviderCategory> findByIdOptional(Long id) {
        return PanacheMongoRepositoryBase.super.findByIdOptional(id);
    }

    @Override
    public Optional<ProviderCategory> findBySlug(String slug) {
        return find("slug", slug).firstResultOptional();
    }
}
