package tech.lapse.platform.user.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.lapse.platform.user.User;
import tech.lapse.platform.user.UserRepository;
import tech.lapse.platform.user.entity.UserEntity;
import tech.lapse.platform.user.mapper.UserMapper;

import java.util.Optional;

/**
 * Panache-based implementation of UserRepository.
 */
@ApplicationScoped
public class PanacheUserRepository
    implements UserRepository, PanacheRepositoryBase<UserEntity, String> {

    @Override
    public Optional<User> findUserById(String id) {
        return find("id", id)
            .firstResultOptional()
            .map(UserMapper::toDomain);
    }
}
