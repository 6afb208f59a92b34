package tech.lapse.platform.serviceclient;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for service clients.
 */
public interface ServiceClientRepository {

    // Read operations; all of them skip revoked clients
    Optional<ServiceClient> findActiveByClientId(String clientId);
    Optional<ServiceClient> findActiveById(String id);
    Optional<ServiceClient> findActiveOwnedBy(String id, String ownerUserId);
    List<ServiceClient> findActiveByOwner(String ownerUserId);

    // Write operations
    void persist(ServiceClient client);
    void update(ServiceClient client);
    void touchLastUsed(String id, Instant usedAt);
}
