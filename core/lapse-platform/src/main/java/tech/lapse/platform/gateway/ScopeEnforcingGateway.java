package tech.lapse.platform.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.lapse.platform.authentication.AuthContext;
import tech.lapse.platform.authentication.AuthContextResolver;
import tech.lapse.platform.common.api.ProtocolError;

import java.util.Optional;

/**
 * Routes {@code /rest/{router}/{procedure}} calls to procedure
 * implementations after checking method, input, authentication and, for
 * delegated callers, scopes.
 *
 * <p>Checks run in this order and the first failure is returned:
 * <ol>
 *   <li>unknown procedure: 404 not_found</li>
 *   <li>wrong HTTP method: 405 invalid_request</li>
 *   <li>unparseable input: 400 invalid_request</li>
 *   <li>anonymous call to a procedure that needs a user: 401 unauthorized</li>
 *   <li>delegated caller lacking a declared scope: 403 forbidden</li>
 *   <li>no implementation bean: 404 not_found</li>
 *   <li>implementation throws: 500 internal_error</li>
 * </ol>
 * First-party callers are not scope-checked.
 */
@ApplicationScoped
public class ScopeEnforcingGateway {

    private static final Logger LOG = Logger.getLogger(ScopeEnforcingGateway.class);

    @Inject
    RestProcedureCatalog catalog;

    @Inject
    RestProcedureRegistry registry;

    @Inject
    AuthContextResolver authContextResolver;

    @Inject
    ObjectMapper objectMapper;

    public GatewayResponse handle(GatewayRequest request) {
        Optional<RestProcedureDefinition> found = catalog.find(request.router(), request.procedure());
        if (found.isEmpty()) {
            return GatewayResponse.error(404, ProtocolError.NOT_FOUND, "Unknown REST procedure.");
        }
        RestProcedureDefinition definition = found.get();

        if (definition.method() != request.method()) {
            return GatewayResponse.error(405, ProtocolError.INVALID_REQUEST, "Method not allowed.");
        }

        JsonNode input;
        try {
            input = readInput(request);
        } catch (JsonProcessingException e) {
            return GatewayResponse.error(400, ProtocolError.INVALID_REQUEST, "Invalid input payload.");
        }

        AuthContext auth = authContextResolver.resolve(request.authorizationHeader(), request.sessionCookie());
        if (definition.requiresAuth() && !auth.isAuthenticated()) {
            return GatewayResponse.error(401, ProtocolError.UNAUTHORIZED, "Authentication required.");
        }
        if (auth.isDelegated() && !auth.scopes().containsAll(definition.requiredScopes())) {
            LOG.debugf("Service client %s lacks %s for %s.%s",
                auth.actor().clientId, definition.requiredScopes(), definition.router(), definition.procedure());
            return GatewayResponse.error(403, ProtocolError.FORBIDDEN, "Missing required scope.");
        }

        Optional<RestProcedure> implementation = registry.find(definition.router(), definition.procedure());
        if (implementation.isEmpty()) {
            return GatewayResponse.error(404, ProtocolError.NOT_FOUND, "No handler for this procedure.");
        }

        try {
            Object result = implementation.get().invoke(new ProcedureContext(auth, definition), input);
            return GatewayResponse.ok(result);
        } catch (Exception e) {
            LOG.errorf(e, "Procedure %s.%s failed", definition.router(), definition.procedure());
            return GatewayResponse.error(500, ProtocolError.INTERNAL_ERROR, "Failed to execute procedure.");
        }
    }

    private JsonNode readInput(GatewayRequest request) throws JsonProcessingException {
        String raw = request.method() == RestMethod.GET ? request.queryInput() : request.body();
        if (raw == null || raw.isBlank()) {
            return objectMapper.createObjectNode();
        }
        JsonNode parsed = objectMapper.readTree(raw);
        return parsed != null ? parsed : objectMapper.createObjectNode();
    }
}
