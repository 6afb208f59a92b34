package tech.lapse.platform.audit.mapper;

import tech.lapse.platform.audit.ServiceTokenAudit;
import tech.lapse.platform.audit.entity.ServiceTokenAuditEntity;

public final class ServiceTokenAuditMapper {

    private ServiceTokenAuditMapper() {
    }

    public static ServiceTokenAudit toDomain(ServiceTokenAuditEntity entity) {
        if (entity == null) {
            return null;
        }
        return ServiceTokenAudit.builder()
            .id(entity.id)
            .serviceClientId(entity.serviceClientId)
            .userId(entity.userId)
            .scope(entity.scope)
            .ip(entity.ip)
            .userAgent(entity.userAgent)
            .createdAt(entity.createdAt)
            .build();
    }

    public static ServiceTokenAuditEntity toEntity(ServiceTokenAudit audit) {
        ServiceTokenAuditEntity entity = new ServiceTokenAuditEntity();
        entity.id = audit.id();
        entity.serviceClientId = audit.serviceClientId();
        entity.userId = audit.userId();
        entity.scope = audit.scope();
        entity.ip = audit.ip();
        entity.userAgent = audit.userAgent();
        entity.createdAt = audit.createdAt();
        return entity;
    }
}
