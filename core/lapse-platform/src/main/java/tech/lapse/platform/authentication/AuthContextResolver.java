package tech.lapse.platform.authentication;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.lapse.platform.serviceclient.ServiceClient;
import tech.lapse.platform.serviceclient.ServiceClientRepository;
import tech.lapse.platform.user.User;
import tech.lapse.platform.user.UserRepository;

import java.util.Optional;

/**
 * Builds the {@link AuthContext} of a request from its credentials.
 *
 * <p>The bearer token in the Authorization header wins over the session
 * cookie. A bearer token is tried as a delegated token first; only a token
 * that carries no delegated marker at all is then tried as a primary token.
 * Cookie tokens are first-party sessions and are only ever verified as
 * primary tokens.
 */
@ApplicationScoped
public class AuthContextResolver {

    private static final Logger LOG = Logger.getLogger(AuthContextResolver.class);

    public static final String SESSION_COOKIE = "lapse-auth";
    private static final String BEARER_PREFIX = "Bearer ";

    @Inject
    TokenService tokenService;

    @Inject
    UserRepository userRepo;

    @Inject
    ServiceClientRepository clientRepo;

    public AuthContext resolve(String authorizationHeader, String sessionCookie) {
        String bearer = extractBearer(authorizationHeader);
        if (bearer != null) {
            return resolveBearer(bearer);
        }
        if (sessionCookie != null && !sessionCookie.isBlank()) {
            return resolvePrimary(sessionCookie);
        }
        return AuthContext.anonymous();
    }

    private AuthContext resolveBearer(String token) {
        TokenVerification<DelegatedToken> delegated = tokenService.verifyDelegated(token);
        if (delegated instanceof TokenVerification.Valid<DelegatedToken> valid) {
            DelegatedToken claims = valid.claims();
            Optional<User> user = userRepo.findUserById(claims.userId());
            Optional<ServiceClient> actor = clientRepo.findActiveById(claims.actorId());
            if (user.isEmpty() || actor.isEmpty()) {
                LOG.debugf("Delegated token for missing user or revoked actor: user=%s actor=%s",
                    claims.userId(), claims.actorId());
                return AuthContext.anonymous();
            }
            return AuthContext.delegated(user.get(), actor.get(), claims.scopes());
        }

        if (tokenService.looksDelegated(token)) {
            LOG.debug("Rejected delegated token that failed verification");
            return AuthContext.anonymous();
        }
        return resolvePrimary(token);
    }

    private AuthContext resolvePrimary(String token) {
        TokenVerification<PrimaryToken> primary = tokenService.verifyPrimary(token);
        if (primary instanceof TokenVerification.Valid<PrimaryToken> valid) {
            return userRepo.findUserById(valid.claims().userId())
                .map(AuthContext::primary)
                .orElseGet(AuthContext::anonymous);
        }
        return AuthContext.anonymous();
    }

    static String extractBearer(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            return null;
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
