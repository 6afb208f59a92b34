package tech.lapse.platform.user;

import java.util.Optional;

/**
 * Read access to users.
 */
public interface UserRepository {

    Optional<User> findUserById(String id);
}
