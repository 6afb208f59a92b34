package tech.lapse.platform.user.mapper;

import tech.lapse.platform.user.User;
import tech.lapse.platform.user.entity.UserEntity;

public final class UserMapper {

    private UserMapper() {
    }

    public static User toDomain(UserEntity entity) {
        if (entity == null) {
            return null;
        }
        return new User(entity.id, entity.email, entity.permissionLevel);
    }
}
