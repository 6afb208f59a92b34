package tech.lapse.platform.serviceclient.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.lapse.platform.serviceclient.ServiceClient;
import tech.lapse.platform.serviceclient.ServiceClientRepository;
import tech.lapse.platform.serviceclient.entity.ServiceClientEntity;
import tech.lapse.platform.serviceclient.mapper.ServiceClientMapper;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Panache-based implementation of ServiceClientRepository.
 */
@ApplicationScoped
public class PanacheServiceClientRepository
    implements ServiceClientRepository, PanacheRepositoryBase<ServiceClientEntity, String> {

    @Override
    public Optional<ServiceClient> findActiveByClientId(String clientId) {
        return find("clientId = ?1 and revokedAt is null", clientId)
            .firstResultOptional()
            .map(ServiceClientMapper::toDomain);
    }

    @Override
    public Optional<ServiceClient> findActiveById(String id) {
        return find("id = ?1 and revokedAt is null", id)
            .firstResultOptional()
            .map(ServiceClientMapper::toDomain);
    }

    @Override
    public Optional<ServiceClient> findActiveOwnedBy(String id, String ownerUserId) {
        return find("id = ?1 and createdByUserId = ?2 and revokedAt is null", id, ownerUserId)
            .firstResultOptional()
            .map(ServiceClientMapper::toDomain);
    }

    @Override
    public List<ServiceClient> findActiveByOwner(String ownerUserId) {
        return list("createdByUserId = ?1 and revokedAt is null order by createdAt desc", ownerUserId)
            .stream()
            .map(ServiceClientMapper::toDomain)
            .toList();
    }

    @Override
    public void persist(ServiceClient client) {
        if (client.createdAt == null) {
            client.createdAt = Instant.now();
        }
        client.updatedAt = Instant.now();
        persist(ServiceClientMapper.toEntity(client));
    }

    @Override
    public void update(ServiceClient client) {
        client.updatedAt = Instant.now();
        ServiceClientEntity entity = findById(client.id);
        if (entity != null) {
            ServiceClientMapper.updateEntity(entity, client);
        }
    }

    @Override
    public void touchLastUsed(String id, Instant usedAt) {
        update("lastUsedAt = ?1 where id = ?2", usedAt, id);
    }
}
