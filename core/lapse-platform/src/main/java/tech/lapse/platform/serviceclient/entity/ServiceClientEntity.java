package tech.lapse.platform.serviceclient.entity;

import jakarta.persistence.*;
import tech.lapse.platform.serviceclient.TrustLevel;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JPA Entity for service clients.
 */
@Entity
@Table(name = "service_clients")
public class ServiceClientEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "client_id", nullable = false, unique = true, length = 64)
    public String clientId;

    @Column(name = "client_secret_hash", nullable = false, length = 256)
    public String clientSecretHash;

    @Column(name = "name", nullable = false, length = 48)
    public String name;

    @Column(name = "description", length = 200)
    public String description;

    @Column(name = "homepage_url", nullable = false, length = 500)
    public String homepageUrl;

    @Column(name = "icon_url", length = 500)
    public String iconUrl;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "service_client_scopes", joinColumns = @JoinColumn(name = "service_client_id"))
    @OrderColumn(name = "position")
    @Column(name = "scope", length = 64)
    public List<String> allowedScopes = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "service_client_redirect_uris", joinColumns = @JoinColumn(name = "service_client_id"))
    @OrderColumn(name = "position")
    @Column(name = "redirect_uri", length = 500)
    public List<String> redirectUris = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "trust_level", nullable = false, length = 20)
    public TrustLevel trustLevel;

    @Column(name = "created_by_user_id", nullable = false, length = 64)
    public String createdByUserId;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    @Column(name = "revoked_at")
    public Instant revokedAt;

    @Column(name = "last_used_at")
    public Instant lastUsedAt;

    public ServiceClientEntity() {
    }
}
