package tech.lapse.platform.authentication;

import tech.lapse.platform.serviceclient.ServiceClient;
import tech.lapse.platform.user.User;

import java.util.List;

/**
 * Who is calling. Anonymous when {@code user} is null; delegated when
 * {@code actor} is set, in which case {@code scopes} bounds what it may do.
 */
public record AuthContext(User user, ServiceClient actor, List<String> scopes) {

    private static final AuthContext ANONYMOUS = new AuthContext(null, null, List.of());

    public AuthContext {
        scopes = scopes != null ? List.copyOf(scopes) : List.of();
    }

    public static AuthContext anonymous() {
        return ANONYMOUS;
    }

    public static AuthContext primary(User user) {
        return new AuthContext(user, null, List.of());
    }

    public static AuthContext delegated(User user, ServiceClient actor, List<String> scopes) {
        return new AuthContext(user, actor, scopes);
    }

    public boolean isAuthenticated() {
        return user != null;
    }

    public boolean isDelegated() {
        return actor != null;
    }
}
