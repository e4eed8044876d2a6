package tech.terrareg.platform.authorization;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for UserGroup entities.
 */
public interface UserGroupRepository {

    Optional<UserGroup> findByName(String name);
    List<UserGroup> findByNames(List<String> names);
    List<UserGroup> listAll();

    void persist(UserGroup group);
    boolean deleteById(Long id);
}
