package tech.lapse.platform.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.lapse.platform.audit.ServiceTokenAudit;
import tech.lapse.platform.audit.ServiceTokenAuditRepository;
import tech.lapse.platform.authentication.PrimaryToken;
import tech.lapse.platform.authentication.TokenService;
import tech.lapse.platform.authentication.TokenVerification;
import tech.lapse.platform.authorization.ScopeCatalog;
import tech.lapse.platform.authorization.Scopes;
import tech.lapse.platform.common.Result;
import tech.lapse.platform.common.api.ProtocolError;
import tech.lapse.platform.common.errors.UseCaseError;
import tech.lapse.platform.grant.ServiceGrant;
import tech.lapse.platform.grant.ServiceGrantRepository;
import tech.lapse.platform.serviceclient.ServiceClient;
import tech.lapse.platform.serviceclient.ServiceClientService;
import tech.lapse.platform.user.User;
import tech.lapse.platform.user.UserRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * RFC 8693 token exchange: an authenticated service client trades a user's
 * primary token for a delegated token, bounded by the user's grant.
 *
 * <p>Checks run in a fixed order and the first failure decides the response:
 * client credentials, subject token type, client authentication, scope
 * catalog, client allow-list, subject token, user, grant, effective scopes.
 * A delegated token is never accepted as the subject, so delegation cannot
 * be chained.
 */
@ApplicationScoped
public class TokenExchangeService {

    private static final Logger LOG = Logger.getLogger(TokenExchangeService.class);

    public static final String TOKEN_TYPE_ACCESS_TOKEN = "urn:ietf:params:oauth:token-type:access_token";
    public static final String TOKEN_TYPE_JWT = "urn:ietf:params:oauth:token-type:jwt";
    static final Set<String> ACCEPTED_SUBJECT_TOKEN_TYPES = Set.of(TOKEN_TYPE_ACCESS_TOKEN, TOKEN_TYPE_JWT);

    @Inject
    ServiceClientService clientService;

    @Inject
    ServiceGrantRepository grantRepo;

    @Inject
    ServiceTokenAuditRepository auditRepo;

    @Inject
    UserRepository userRepo;

    @Inject
    TokenService tokenService;

    @Inject
    ScopeCatalog scopeCatalog;

    /**
     * Caller metadata recorded in the audit log.
     *
     * @param forwardedFor raw X-Forwarded-For header; the first entry is the caller
     */
    public record CallerInfo(String forwardedFor, String userAgent) {

        public String ip() {
            if (forwardedFor == null) {
                return null;
            }
            String first = forwardedFor.split(",", 2)[0].trim();
            return first.isEmpty() ? null : first;
        }
    }

    @Transactional
    public Result<TokenExchangeResponse> exchange(TokenExchangeRequest request, String authHeader, CallerInfo caller) {
        Optional<ClientCredentials> credentials =
            ClientCredentials.resolve(authHeader, request.clientId(), request.clientSecret());
        if (credentials.isEmpty()) {
            return failure(new UseCaseError.AuthenticationError(
                ProtocolError.INVALID_CLIENT, "Client authentication required."));
        }

        if (!ACCEPTED_SUBJECT_TOKEN_TYPES.contains(request.subjectTokenType())) {
            return failure(new UseCaseError.ValidationError(
                ProtocolError.INVALID_REQUEST, "Unsupported subject_token_type."));
        }

        Optional<ServiceClient> authenticated =
            clientService.authenticate(credentials.get().clientId(), credentials.get().clientSecret());
        if (authenticated.isEmpty()) {
            return failure(new UseCaseError.AuthenticationError(
                ProtocolError.INVALID_CLIENT, "Invalid client credentials."));
        }
        ServiceClient client = authenticated.get();

        List<String> requested = Scopes.parseDelimited(request.scope());
        List<String> unknown = scopeCatalog.unknown(requested);
        if (!unknown.isEmpty()) {
            return failure(new UseCaseError.ValidationError(
                ProtocolError.INVALID_SCOPE, "Unknown scopes: " + String.join(", ", unknown)));
        }
        if (!Scopes.missing(requested, client.allowedScopes).isEmpty()) {
            return failure(new UseCaseError.AuthorizationError(
                ProtocolError.INVALID_SCOPE, "Requested scopes are not allowed for this client."));
        }

        TokenVerification<PrimaryToken> subject = tokenService.verifyPrimary(request.subjectToken());
        if (subject instanceof TokenVerification.Invalid<PrimaryToken> invalid) {
            if (tokenService.looksDelegated(request.subjectToken())) {
                LOG.warnf("Client %s attempted to exchange a delegated token", client.clientId);
                return failure(new UseCaseError.ValidationError(
                    ProtocolError.INVALID_REQUEST, "Subject token must not be an OBO token."));
            }
            LOG.debugf("Subject token rejected for client %s: %s", client.clientId, invalid.reason());
            return failure(new UseCaseError.ValidationError(
                ProtocolError.INVALID_REQUEST, "Invalid subject token."));
        }
        String userId = ((TokenVerification.Valid<PrimaryToken>) subject).claims().userId();

        Optional<User> user = userRepo.findUserById(userId);
        if (user.isEmpty()) {
            return failure(new UseCaseError.ValidationError(
                ProtocolError.INVALID_REQUEST, "Subject user not found."));
        }

        Optional<ServiceGrant> grant = grantRepo.findActive(client.id, userId);
        if (grant.isEmpty()) {
            return failure(new UseCaseError.AuthorizationError(
                ProtocolError.ACCESS_DENIED, "User has not granted access to this client."));
        }

        List<String> scopes = requested.isEmpty()
            ? Scopes.intersect(grant.get().scopes, client.allowedScopes)
            : Scopes.intersect(requested, grant.get().scopes);
        if (scopes.isEmpty()) {
            return failure(new UseCaseError.AuthorizationError(
                ProtocolError.ACCESS_DENIED, "Requested scopes have not been granted."));
        }
        if (Scopes.hasDuplicates(scopes)) {
            return failure(new UseCaseError.ValidationError(
                ProtocolError.INVALID_SCOPE, "Duplicate scopes are not allowed."));
        }

        String accessToken = tokenService.issueDelegated(userId, user.get().email, client.id, scopes,
            TokenService.DELEGATED_TOKEN_TTL_SECONDS);

        Instant now = Instant.now();
        clientService.touchLastUsed(client.id, now);
        grantRepo.touchLastUsed(grant.get().id, now);
        auditRepo.append(ServiceTokenAudit.builder()
            .serviceClientId(client.id)
            .userId(userId)
            .scope(Scopes.join(scopes))
            .ip(caller != null ? caller.ip() : null)
            .userAgent(caller != null ? caller.userAgent() : null)
            .createdAt(now)
            .build());

        LOG.infof("Delegated token issued via token exchange: client %s, user %s, scopes [%s]",
            client.clientId, userId, Scopes.join(scopes));

        return Result.success(new TokenExchangeResponse(
            accessToken,
            TOKEN_TYPE_ACCESS_TOKEN,
            "Bearer",
            TokenService.DELEGATED_TOKEN_TTL_SECONDS,
            Scopes.join(scopes),
            TokenService.DELEGATED_AUDIENCE,
            TokenService.DELEGATED_ISSUER));
    }

    private static Result<TokenExchangeResponse> failure(UseCaseError error) {
        return Result.failure(error);
    }
}
