package tech.lapse.platform.grant;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for service grants.
 */
public interface ServiceGrantRepository {

    Optional<ServiceGrant> findActive(String serviceClientId, String userId);

    /**
     * Owner-scoped lookup, revoked or not.
     */
    Optional<ServiceGrant> findByIdAndUser(String id, String userId);

    /**
     * Active grants of a user, most recently updated first.
     */
    List<GrantSummary> listActiveByUser(String userId);

    /**
     * Create or replace the grant for (client, user) in one atomic statement.
     * Replaces the scopes and clears any revocation.
     *
     * @return the grant id, which is stable across upserts of the same pair
     */
    String upsertScopes(String serviceClientId, String userId, List<String> scopes);

    void revoke(String id, Instant revokedAt);

    void touchLastUsed(String id, Instant usedAt);
}
