package tech.lapse.platform.grant.mapper;

import tech.lapse.platform.grant.ServiceGrant;
import tech.lapse.platform.grant.entity.ServiceGrantEntity;

import java.util.ArrayList;

/**
 * Mapper for converting between ServiceGrant domain and entity.
 */
public final class ServiceGrantMapper {

    private ServiceGrantMapper() {
    }

    public static ServiceGrant toDomain(ServiceGrantEntity entity) {
        if (entity == null) {
            return null;
        }

        ServiceGrant domain = new ServiceGrant();
        domain.id = entity.id;
        domain.serviceClientId = entity.serviceClientId;
        domain.userId = entity.userId;
        domain.scopes = entity.scopes != null ? new ArrayList<>(entity.scopes) : new ArrayList<>();
        domain.createdAt = entity.createdAt;
        domain.updatedAt = entity.updatedAt;
        domain.lastUsedAt = entity.lastUsedAt;
        domain.revokedAt = entity.revokedAt;

        return domain;
    }
}
