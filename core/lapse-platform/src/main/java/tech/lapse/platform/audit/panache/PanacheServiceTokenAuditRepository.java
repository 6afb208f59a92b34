package tech.lapse.platform.audit.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import tech.lapse.platform.audit.ServiceTokenAudit;
import tech.lapse.platform.audit.ServiceTokenAuditRepository;
import tech.lapse.platform.audit.entity.ServiceTokenAuditEntity;
import tech.lapse.platform.audit.mapper.ServiceTokenAuditMapper;
import tech.lapse.platform.shared.EntityType;
import tech.lapse.platform.shared.TsidGenerator;

import java.time.Instant;
import java.util.List;

/**
 * EntityManager-based implementation of ServiceTokenAuditRepository.
 */
@ApplicationScoped
public class PanacheServiceTokenAuditRepository implements ServiceTokenAuditRepository {

    @Inject
    EntityManager em;

    @Override
    public void append(ServiceTokenAudit audit) {
        ServiceTokenAuditEntity entity = ServiceTokenAuditMapper.toEntity(audit);
        if (entity.id == null) {
            entity.id = TsidGenerator.generate(EntityType.SERVICE_TOKEN_AUDIT);
        }
        if (entity.createdAt == null) {
            entity.createdAt = Instant.now();
        }
        em.persist(entity);
    }

    @Override
    public List<ServiceTokenAudit> findByServiceClient(String serviceClientId, int limit) {
        return em.createQuery(
                "FROM ServiceTokenAuditEntity WHERE serviceClientId = :serviceClientId ORDER BY createdAt DESC",
                ServiceTokenAuditEntity.class)
            .setParameter("serviceClientId", serviceClientId)
            .setMaxResults(limit)
            .getResultList()
            .stream()
            .map(ServiceTokenAuditMapper::toDomain)
            .toList();
    }
}
