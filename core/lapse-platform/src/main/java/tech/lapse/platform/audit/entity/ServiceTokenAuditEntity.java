package tech.lapse.platform.audit.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;

@Entity
@Table(name = "service_token_audits", indexes = {
    @Index(name = "idx_service_token_audits_client", columnList = "service_client_id, created_at"),
    @Index(name = "idx_service_token_audits_user", columnList = "user_id, created_at")
})
public class ServiceTokenAuditEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "service_client_id", nullable = false, length = 17)
    public String serviceClientId;

    @Column(name = "user_id", nullable = false, length = 64)
    public String userId;

    @Column(name = "scope", nullable = false, length = 512)
    public String scope;

    @Column(name = "ip", length = 64)
    public String ip;

    @Column(name = "user_agent", length = 512)
    public String userAgent;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    public ServiceTokenAuditEntity() {
    }
}
