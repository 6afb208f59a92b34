package tech.lapse.platform.authentication;

import java.util.List;

/**
 * Verified claims of a delegated (on-behalf-of) token.
 *
 * @param userId  the user being acted for
 * @param actorId internal id of the service client acting
 * @param scopes  trimmed, non-empty and duplicate-free
 */
public record DelegatedToken(String userId, String email, String actorId, List<String> scopes) {

    public DelegatedToken {
        scopes = List.copyOf(scopes);
    }
}
