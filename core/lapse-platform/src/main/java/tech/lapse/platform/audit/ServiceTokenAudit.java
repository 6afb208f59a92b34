package tech.lapse.platform.audit;

import lombok.Builder;

import java.time.Instant;

/**
 * One row per successful token exchange. Never updated or deleted.
 *
 * @param scope space-joined scopes of the issued token
 * @param ip    first X-Forwarded-For entry, when present
 */
@Builder
public record ServiceTokenAudit(
    String id,
    String serviceClientId,
    String userId,
    String scope,
    String ip,
    String userAgent,
    Instant createdAt
) {}
