package tech.lapse.platform.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.lapse.platform.authentication.AuthContext;
import tech.lapse.platform.authentication.TokenService;
import tech.lapse.platform.authorization.ScopeCatalog;
import tech.lapse.platform.authorization.Scopes;
import tech.lapse.platform.common.Result;
import tech.lapse.platform.common.api.ApiErrorCode;
import tech.lapse.platform.common.errors.UseCaseError;
import tech.lapse.platform.grant.ServiceGrant;
import tech.lapse.platform.grant.ServiceGrantRepository;
import tech.lapse.platform.serviceclient.ServiceClient;
import tech.lapse.platform.serviceclient.ServiceClientRepository;
import tech.lapse.platform.serviceclient.ServiceClientView;
import tech.lapse.platform.user.User;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

/**
 * Browser consent flow for granting a service client delegated access.
 *
 * <pre>
 * INIT --(active grant)--------> AUTO_REISSUE
 * INIT --(no active grant)-----> AWAITING_DECISION --(consent=true)--> APPROVED
 *                                                  --(consent=false)-> DENIED
 * </pre>
 *
 * <p>Only a user holding a primary token may consent. Both the opening
 * request and the decision run the same validation before anything is read
 * or written, and a token is only handed to a redirect URI registered by the
 * client.
 */
@ApplicationScoped
public class ConsentFlowService {

    private static final Logger LOG = Logger.getLogger(ConsentFlowService.class);

    @Inject
    ServiceClientRepository clientRepo;

    @Inject
    ServiceGrantRepository grantRepo;

    @Inject
    TokenService tokenService;

    @Inject
    ScopeCatalog scopeCatalog;

    /**
     * Open the flow: reissue from an active grant, or describe the client so
     * the user can decide.
     */
    @Transactional
    public Result<ConsentOutcome> initiate(AuthContext auth, ConsentRequest request) {
        Result<Validated> validated = validate(auth, request);
        if (validated instanceof Result.Failure<Validated> failure) {
            return Result.failure(failure.error());
        }
        Validated v = ((Result.Success<Validated>) validated).value();

        Optional<ServiceGrant> existing = grantRepo.findActive(v.client().id, v.user().id);
        if (existing.isEmpty()) {
            return Result.success(new ConsentOutcome.AwaitingDecision(
                ServiceClientView.from(v.client()),
                scopeCatalog.describe(v.scopes())));
        }

        ServiceGrant grant = existing.get();
        List<String> scopes = Scopes.intersect(Scopes.normalize(grant.scopes), v.client().allowedScopes);
        if (scopes.isEmpty() || Scopes.hasDuplicates(scopes)) {
            LOG.warnf("Stored grant %s has no usable scopes", grant.id);
            return Result.failure(invalid(ApiErrorCode.ERROR, "Stored grant has invalid scopes. Please re-authorize."));
        }

        String accessToken = issueToken(v.user(), v.client(), scopes);
        LOG.infof("Delegated token reissued from grant %s for client %s", grant.id, v.client().clientId);
        return Result.success(new ConsentOutcome.AutoReissued(
            tokenRedirect(v.redirectUri(), accessToken, scopes, request.state()),
            accessToken,
            grant.id));
    }

    /**
     * Apply the user's decision. Approval writes the grant in one atomic
     * upsert and issues a token; denial writes nothing.
     */
    @Transactional
    public Result<ConsentOutcome> decide(AuthContext auth, ConsentRequest request) {
        if (request.consent() == null) {
            return Result.failure(invalid(ApiErrorCode.MISSING_PARAMS, "consent must be true or false."));
        }

        Result<Validated> validated = validate(auth, request);
        if (validated instanceof Result.Failure<Validated> failure) {
            return Result.failure(failure.error());
        }
        Validated v = ((Result.Success<Validated>) validated).value();

        if (!request.consent()) {
            LOG.infof("User %s denied consent for client %s", v.user().id, v.client().clientId);
            return Result.success(new ConsentOutcome.Denied(deniedRedirect(v.redirectUri(), request.state())));
        }

        List<String> scopes = v.scopes().isEmpty()
            ? List.copyOf(v.client().allowedScopes)
            : Scopes.intersect(v.scopes(), v.client().allowedScopes);
        if (scopes.isEmpty()) {
            return Result.failure(invalid(ApiErrorCode.ERROR, "No valid scopes requested."));
        }
        if (Scopes.hasDuplicates(scopes)) {
            return Result.failure(invalid(ApiErrorCode.ERROR, "Duplicate scopes are not allowed."));
        }

        String grantId = grantRepo.upsertScopes(v.client().id, v.user().id, scopes);
        String accessToken = issueToken(v.user(), v.client(), scopes);

        LOG.infof("Grant %s written for client %s and user %s with scopes [%s]",
            grantId, v.client().clientId, v.user().id, Scopes.join(scopes));
        return Result.success(new ConsentOutcome.Approved(
            tokenRedirect(v.redirectUri(), accessToken, scopes, request.state()),
            accessToken,
            grantId));
    }

    /**
     * Only a user authenticated with a primary token may consent.
     */
    public Optional<UseCaseError> checkCaller(AuthContext auth) {
        if (!auth.isAuthenticated()) {
            return Optional.of(new UseCaseError.AuthenticationError(
                ApiErrorCode.NO_PERMISSION.name(), "Authentication required."));
        }
        if (auth.isDelegated()) {
            LOG.warnf("Delegated caller %s attempted to open a consent flow", auth.actor().clientId);
            return Optional.of(new UseCaseError.AuthenticationError(
                ApiErrorCode.NO_PERMISSION.name(), "Delegated tokens cannot authorize service clients."));
        }
        return Optional.empty();
    }

    private Result<Validated> validate(AuthContext auth, ConsentRequest request) {
        Optional<UseCaseError> callerError = checkCaller(auth);
        if (callerError.isPresent()) {
            return Result.failure(callerError.get());
        }
        if (request.state() != null && request.state().length() > ConsentRequest.MAX_STATE_LENGTH) {
            return Result.failure(invalid(ApiErrorCode.ERROR,
                "state must be at most " + ConsentRequest.MAX_STATE_LENGTH + " characters."));
        }

        List<String> scopes = Scopes.normalize(request.scope());
        List<String> unknown = scopeCatalog.unknown(scopes);
        if (!unknown.isEmpty()) {
            return Result.failure(invalid(ApiErrorCode.ERROR, "Unknown scopes: " + String.join(", ", unknown)));
        }
        if (Scopes.hasDuplicates(scopes)) {
            return Result.failure(invalid(ApiErrorCode.ERROR, "Duplicate scopes are not allowed."));
        }

        Optional<ServiceClient> client = clientRepo.findActiveByClientId(request.clientId());
        if (client.isEmpty()) {
            return Result.failure(new UseCaseError.NotFoundError(ApiErrorCode.NOT_FOUND.name(), "Client not found."));
        }

        String redirectUri = request.redirectUri();
        if (redirectUri == null || redirectUri.isBlank()) {
            return Result.failure(invalid(ApiErrorCode.MISSING_PARAMS, "redirect_uri is required."));
        }
        List<String> registered = client.get().redirectUris;
        if (registered != null && !registered.isEmpty() && !registered.contains(redirectUri)) {
            LOG.warnf("Unregistered redirect_uri for client %s: %s", request.clientId(), redirectUri);
            return Result.failure(invalid(ApiErrorCode.ERROR, "redirect_uri is not registered for this client."));
        }

        return Result.success(new Validated(auth.user(), client.get(), scopes, redirectUri));
    }

    private String issueToken(User user, ServiceClient client, List<String> scopes) {
        return tokenService.issueDelegated(user.id, user.email, client.id, scopes,
            TokenService.DELEGATED_TOKEN_TTL_SECONDS);
    }

    static String tokenRedirect(String redirectUri, String accessToken, List<String> scopes, String state) {
        StringBuilder query = new StringBuilder();
        query.append("access_token=").append(urlEncode(accessToken));
        query.append("&token_type=Bearer");
        query.append("&expires_in=").append(TokenService.DELEGATED_TOKEN_TTL_SECONDS);
        query.append("&scope=").append(urlEncode(Scopes.join(scopes)));
        if (state != null) {
            query.append("&state=").append(urlEncode(state));
        }
        return appendQuery(redirectUri, query.toString());
    }

    static String deniedRedirect(String redirectUri, String state) {
        StringBuilder query = new StringBuilder("error=access_denied");
        if (state != null) {
            query.append("&state=").append(urlEncode(state));
        }
        return appendQuery(redirectUri, query.toString());
    }

    /**
     * Parameters go before any fragment of the redirect URI.
     */
    private static String appendQuery(String redirectUri, String query) {
        int hash = redirectUri.indexOf('#');
        String base = hash >= 0 ? redirectUri.substring(0, hash) : redirectUri;
        String fragment = hash >= 0 ? redirectUri.substring(hash) : "";
        return base + (base.contains("?") ? "&" : "?") + query + fragment;
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static UseCaseError invalid(ApiErrorCode code, String message) {
        return new UseCaseError.ValidationError(code.name(), message);
    }

    private record Validated(User user, ServiceClient client, List<String> scopes, String redirectUri) {}
}
