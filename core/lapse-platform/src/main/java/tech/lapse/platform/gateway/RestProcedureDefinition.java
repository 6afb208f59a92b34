package tech.lapse.platform.gateway;

import java.util.List;

/**
 * Catalog entry describing how an internal procedure is exposed over REST.
 *
 * @param requiredScopes scopes a delegated caller must hold, all of them; empty means none
 * @param requiresAuth   whether an anonymous caller is rejected
 */
public record RestProcedureDefinition(
    String router,
    String procedure,
    RestMethod method,
    ProcedureType type,
    List<String> requiredScopes,
    String summary,
    boolean requiresAuth
) {

    public RestProcedureDefinition {
        requiredScopes = List.copyOf(requiredScopes);
    }
}
