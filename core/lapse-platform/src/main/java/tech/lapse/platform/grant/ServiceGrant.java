package tech.lapse.platform.grant;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A user's standing consent for one service client.
 *
 * <p>There is at most one grant per (client, user) pair. Re-consenting replaces
 * the scopes and clears {@link #revokedAt}; revoking only sets it. Scopes are
 * ordered, duplicate-free, non-empty and within the client's allowed scopes.
 */
public class ServiceGrant {

    public String id;

    public String serviceClientId;

    public String userId;

    public List<String> scopes = new ArrayList<>();

    public Instant createdAt;

    public Instant updatedAt;

    public Instant lastUsedAt;

    public Instant revokedAt;

    public ServiceGrant() {
    }

    public boolean isActive() {
        return revokedAt == null;
    }
}
