package tech.lapse.platform.serviceclient.mapper;

import tech.lapse.platform.serviceclient.ServiceClient;
import tech.lapse.platform.serviceclient.entity.ServiceClientEntity;

import java.util.ArrayList;

/**
 * Mapper for converting between ServiceClient domain and entity.
 */
public final class ServiceClientMapper {

    private ServiceClientMapper() {
    }

    public static ServiceClient toDomain(ServiceClientEntity entity) {
        if (entity == null) {
            return null;
        }

        ServiceClient domain = new ServiceClient();
        domain.id = entity.id;
        domain.clientId = entity.clientId;
        domain.clientSecretHash = entity.clientSecretHash;
        domain.name = entity.name;
        domain.description = entity.description;
        domain.homepageUrl = entity.homepageUrl;
        domain.iconUrl = entity.iconUrl;
        domain.allowedScopes = entity.allowedScopes != null ? new ArrayList<>(entity.allowedScopes) : new ArrayList<>();
        domain.redirectUris = entity.redirectUris != null ? new ArrayList<>(entity.redirectUris) : new ArrayList<>();
        domain.trustLevel = entity.trustLevel;
        domain.createdByUserId = entity.createdByUserId;
        domain.createdAt = entity.createdAt;
        domain.updatedAt = entity.updatedAt;
        domain.revokedAt = entity.revokedAt;
        domain.lastUsedAt = entity.lastUsedAt;

        return domain;
    }

    public static ServiceClientEntity toEntity(ServiceClient domain) {
        if (domain == null) {
            return null;
        }

        ServiceClientEntity entity = new ServiceClientEntity();
        entity.id = domain.id;
        entity.createdAt = domain.createdAt;
        updateEntity(entity, domain);
        return entity;
    }

    /**
     * Copy mutable fields onto an existing entity. The id and creation time never change.
     */
    public static void updateEntity(ServiceClientEntity entity, ServiceClient domain) {
        entity.clientId = domain.clientId;
        entity.clientSecretHash = domain.clientSecretHash;
        entity.name = domain.name;
        entity.description = domain.description;
        entity.homepageUrl = domain.homepageUrl;
        entity.iconUrl = domain.iconUrl;
        entity.allowedScopes = domain.allowedScopes != null ? new ArrayList<>(domain.allowedScopes) : new ArrayList<>();
        entity.redirectUris = domain.redirectUris != null ? new ArrayList<>(domain.redirectUris) : new ArrayList<>();
        entity.trustLevel = domain.trustLevel;
        entity.createdByUserId = domain.createdByUserId;
        entity.updatedAt = domain.updatedAt;
        entity.revokedAt = domain.revokedAt;
        entity.lastUsedAt = domain.lastUsedAt;
    }
}
