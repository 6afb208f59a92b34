package tech.lapse.platform.grant.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JPA Entity for service grants. Scopes are stored as a JSONB array so the
 * whole grant can be replaced by a single upsert statement.
 */
@Entity
@Table(name = "service_grants",
    uniqueConstraints = @UniqueConstraint(name = "uq_service_grants_client_user",
        columnNames = {"service_client_id", "user_id"}))
public class ServiceGrantEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "service_client_id", nullable = false, length = 17)
    public String serviceClientId;

    @Column(name = "user_id", nullable = false, length = 64)
    public String userId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "scopes", nullable = false, columnDefinition = "jsonb")
    public List<String> scopes = new ArrayList<>();

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    @Column(name = "last_used_at")
    public Instant lastUsedAt;

    @Column(name = "revoked_at")
    public Instant revokedAt;

    public ServiceGrantEntity() {
    }
}
