package tech.lapse.platform.serviceclient.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import tech.lapse.platform.serviceclient.TrustLevel;

import java.time.Instant;

@Entity
@Table(name = "service_client_reviews", indexes = {
    @Index(name = "idx_service_client_reviews_client", columnList = "service_client_id, created_at")
})
public class ServiceClientReviewEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "service_client_id", nullable = false, length = 17)
    public String serviceClientId;

    @Column(name = "reviewed_by_user_id", nullable = false, length = 64)
    public String reviewedByUserId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    public TrustLevel status;

    @Column(name = "notes", nullable = false, columnDefinition = "TEXT")
    public String notes;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    public ServiceClientReviewEntity() {
    }
}
