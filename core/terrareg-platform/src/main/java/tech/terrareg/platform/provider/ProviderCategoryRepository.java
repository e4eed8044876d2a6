package tech.terrareg.platform.provider;

import java.util.List;
import java.util.Optional;

public interface ProviderCategoryRepository {

    List<ProviderCategory> listAll();
    Optional<ProviderCategory> findByIdOptional(Long id);
    Optional<ProviderCategory> findBySlug(String slug);
}
