package tech.lapse.platform.grant;

import java.time.Instant;
import java.util.List;

/**
 * An active grant as listed to its user, with the client's display name.
 */
public record GrantSummary(
    String id,
    String serviceClientId,
    String serviceName,
    List<String> scopes,
    Instant createdAt,
    Instant lastUsedAt
) {}
