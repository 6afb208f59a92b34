package tech.lapse.platform.gateway;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * An internal procedure that can be reached through the REST gateway.
 *
 * <p>Implementations are CDI beans; the gateway discovers every bean of this
 * type and routes to it by {@link #router()} and {@link #procedure()}. Only
 * procedures that also appear in the {@link RestProcedureCatalog} are
 * reachable.
 *
 * <p>The returned value is serialized as the response body, usually an
 * {@link tech.lapse.platform.common.api.ApiResult}. Any exception thrown is
 * reported to the caller as an internal error.
 */
public interface RestProcedure {

    String router();

    String procedure();

    Object invoke(ProcedureContext context, JsonNode input) throws Exception;
}
