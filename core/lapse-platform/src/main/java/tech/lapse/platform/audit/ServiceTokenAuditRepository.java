package tech.lapse.platform.audit;

import java.util.List;

/**
 * Append-only store of token exchange audit records.
 */
public interface ServiceTokenAuditRepository {

    void append(ServiceTokenAudit audit);

    /**
     * Records for one service client, newest first.
     */
    List<ServiceTokenAudit> findByServiceClient(String serviceClientId, int limit);
}
