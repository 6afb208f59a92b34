package tech.lapse.platform.grant.panache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.lapse.platform.grant.GrantSummary;
import tech.lapse.platform.grant.ServiceGrant;
import tech.lapse.platform.grant.ServiceGrantRepository;
import tech.lapse.platform.grant.entity.ServiceGrantEntity;
import tech.lapse.platform.grant.mapper.ServiceGrantMapper;
import tech.lapse.platform.shared.EntityType;
import tech.lapse.platform.shared.TsidGenerator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Panache-based implementation of ServiceGrantRepository.
 */
@ApplicationScoped
public class PanacheServiceGrantRepository
    implements ServiceGrantRepository, PanacheRepositoryBase<ServiceGrantEntity, String> {

    @Inject
    ObjectMapper objectMapper;

    @Override
    public Optional<ServiceGrant> findActive(String serviceClientId, String userId) {
        return find("serviceClientId = ?1 and userId = ?2 and revokedAt is null", serviceClientId, userId)
            .firstResultOptional()
            .map(ServiceGrantMapper::toDomain);
    }

    @Override
    public Optional<ServiceGrant> findByIdAndUser(String id, String userId) {
        return find("id = ?1 and userId = ?2", id, userId)
            .firstResultOptional()
            .map(ServiceGrantMapper::toDomain);
    }

    @Override
    public List<GrantSummary> listActiveByUser(String userId) {
        List<Object[]> rows = getEntityManager().createQuery(
                "SELECT g, c.name FROM ServiceGrantEntity g, ServiceClientEntity c " +
                "WHERE c.id = g.serviceClientId AND g.userId = :userId AND g.revokedAt IS NULL " +
                "ORDER BY g.updatedAt DESC", Object[].class)
            .setParameter("userId", userId)
            .getResultList();

        List<GrantSummary> summaries = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            ServiceGrantEntity grant = (ServiceGrantEntity) row[0];
            summaries.add(new GrantSummary(
                grant.id,
                grant.serviceClientId,
                (String) row[1],
                List.copyOf(grant.scopes),
                grant.createdAt,
                grant.lastUsedAt));
        }
        return summaries;
    }

    @Override
    public String upsertScopes(String serviceClientId, String userId, List<String> scopes) {
        Instant now = Instant.now();

        getEntityManager().createNativeQuery(
                "INSERT INTO service_grants (id, service_client_id, user_id, scopes, created_at, updated_at) " +
                "VALUES (:id, :clientId, :userId, CAST(:scopes AS jsonb), :now, :now) " +
                "ON CONFLICT (service_client_id, user_id) DO UPDATE SET " +
                "scopes = EXCLUDED.scopes, updated_at = EXCLUDED.updated_at, revoked_at = NULL")
            .setParameter("id", TsidGenerator.generate(EntityType.SERVICE_GRANT))
            .setParameter("clientId", serviceClientId)
            .setParameter("userId", userId)
            .setParameter("scopes", toJson(scopes))
            .setParameter("now", now)
            .executeUpdate();

        // The upsert holds the row lock until commit, so this reads our own write
        return (String) getEntityManager().createNativeQuery(
                "SELECT id FROM service_grants WHERE service_client_id = :clientId AND user_id = :userId")
            .setParameter("clientId", serviceClientId)
            .setParameter("userId", userId)
            .getSingleResult();
    }

    @Override
    public void revoke(String id, Instant revokedAt) {
        update("revokedAt = ?1, updatedAt = ?1 where id = ?2", revokedAt, id);
    }

    @Override
    public void touchLastUsed(String id, Instant usedAt) {
        update("lastUsedAt = ?1 where id = ?2", usedAt, id);
    }

    private String toJson(List<String> scopes) {
        try {
            return objectMapper.writeValueAsString(scopes);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize grant scopes", e);
        }
    }
}
