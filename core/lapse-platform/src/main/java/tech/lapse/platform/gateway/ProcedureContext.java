package tech.lapse.platform.gateway;

import tech.lapse.platform.authentication.AuthContext;
import tech.lapse.platform.user.User;

/**
 * What a procedure implementation knows about the call it is serving.
 */
public record ProcedureContext(AuthContext auth, RestProcedureDefinition definition) {

    /**
     * The calling user, or null for anonymous calls.
     */
    public User user() {
        return auth.user();
    }
}
