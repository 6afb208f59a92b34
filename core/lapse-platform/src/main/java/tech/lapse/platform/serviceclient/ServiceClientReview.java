package tech.lapse.platform.serviceclient;

import lombok.Builder;

import java.time.Instant;

/**
 * An admin's trust decision about a service client. Appended on every
 * trust-level change and never updated.
 *
 * @param status the trust level the reviewer set
 */
@Builder
public record ServiceClientReview(
    String id,
    String serviceClientId,
    String reviewedByUserId,
    TrustLevel status,
    String notes,
    Instant createdAt
) {}
