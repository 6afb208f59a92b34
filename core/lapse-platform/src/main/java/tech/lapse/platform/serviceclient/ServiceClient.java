package tech.lapse.platform.serviceclient;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A registered third-party application that can act on behalf of users.
 *
 * <p>{@link #clientId} is the public identifier ({@code svc_...}) presented
 * in consent and token exchange requests; {@link #id} is the internal row id
 * and is what delegated tokens carry as {@code actorId}.
 *
 * <p>Clients are never deleted. Revocation sets {@link #revokedAt}, after
 * which the client fails every lookup by public id and every authentication.
 */
public class ServiceClient {

    public String id;

    public String clientId;

    /**
     * Hex salt and derived key, {@code "salt:hash"}. The plaintext secret is
     * only ever returned once, at registration or rotation.
     */
    public String clientSecretHash;

    public String name;

    public String description;

    public String homepageUrl;

    public String iconUrl;

    /**
     * Upper bound on what any grant for this client may hold.
     */
    public List<String> allowedScopes = new ArrayList<>();

    /**
     * Exact-match redirect targets for the consent flow.
     */
    public List<String> redirectUris = new ArrayList<>();

    public TrustLevel trustLevel = TrustLevel.UNTRUSTED;

    public String createdByUserId;

    public Instant createdAt;

    public Instant updatedAt;

    public Instant revokedAt;

    public Instant lastUsedAt;

    public ServiceClient() {
    }

    public boolean isRevoked() {
        return revokedAt != null;
    }

    public boolean isRedirectUriAllowed(String redirectUri) {
        return redirectUris != null && redirectUris.contains(redirectUri);
    }
}
