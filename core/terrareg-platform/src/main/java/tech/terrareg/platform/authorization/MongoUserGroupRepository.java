package tech.terrareg.platform.authorization;

import io.quarkus.mongodb.panache.PanacheMongoRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Typed;

import java.util.List;
import java.util.Optional;

/**
 * MongoDB implementation of UserGroupRepository.
 */
@ApplicationScoped
@Typed(UserGroupRepository.class)
class MongoUserGroupRepository implements PanacheMongoRepositoryBase<UserGroup, Long>, UserGroupRepository {

    @Override
    public Optional<UserGroup> findByName(String name) {
        return find("name", name).firstResultOptional();
    }

    @Override
    public List<UserGroup> findByNames(List<String> names) {
        if (names.isEmpty()) {
            return List.of();
        }
        return list("name in ?1", names);
    }

    @Override
    public List<UserGroup> listAll() {
        return PanacheMongoRepositoryBase.super.listAll(Sort.ascending("name"));
    }

    @Override
    public void persist(UserGroup group) {
        PanacheMongoRepositoryBase.super.persist(group);
    }

    @Override
    public boolean deleteById(Long id) {
        return PanacheMongoRepositoryBase.super.deleteById(id);
    }
}
