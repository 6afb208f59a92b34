package tech.lapse.platform.oauth;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.lapse.platform.authentication.AuthContext;
import tech.lapse.platform.authentication.AuthContextResolver;
import tech.lapse.platform.common.Result;
import tech.lapse.platform.common.api.ApiResult;
import tech.lapse.platform.common.api.ErrorResponses;
import tech.lapse.platform.common.errors.UseCaseError;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Consent endpoint for service clients.
 *
 * <p>{@code POST} opens the flow; {@code PUT} carries the user's decision.
 * The browser follows {@code redirectUrl} from the response, which delivers
 * the delegated token (or {@code error=access_denied}) to the client.
 */
@Path("/oauth/authorize")
@Tag(name = "OAuth Consent", description = "Consent flow for delegated access")
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public class AuthorizationResource {

    @Inject
    AuthContextResolver authContextResolver;

    @Inject
    ConsentFlowService consentFlowService;

    @POST
    @Operation(summary = "Open the consent flow",
        description = "Reissues a token when the user already granted this client, otherwise returns the client's metadata for the consent screen.")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Token reissued, or consent required"),
        @APIResponse(responseCode = "400", description = "Invalid request or redirect_uri"),
        @APIResponse(responseCode = "401", description = "Not authenticated, or authenticated with a delegated token"),
        @APIResponse(responseCode = "404", description = "Unknown or revoked client")
    })
    public Response initiate(
            @HeaderParam("Authorization") String authHeader,
            @CookieParam(AuthContextResolver.SESSION_COOKIE) String sessionCookie,
            JsonNode body) {
        AuthContext auth = authContextResolver.resolve(authHeader, sessionCookie);
        Optional<UseCaseError> callerError = consentFlowService.checkCaller(auth);
        if (callerError.isPresent()) {
            return ErrorResponses.envelope(callerError.get());
        }
        Result<ConsentRequest> request = ConsentRequest.fromJson(body, false);
        if (request instanceof Result.Failure<ConsentRequest> failure) {
            return ErrorResponses.envelope(failure.error());
        }
        return toResponse(consentFlowService.initiate(auth, ((Result.Success<ConsentRequest>) request).value()));
    }

    @PUT
    @Operation(summary = "Approve or deny a service client")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Decision applied; follow redirectUrl"),
        @APIResponse(responseCode = "400", description = "Invalid request, redirect_uri or scopes"),
        @APIResponse(responseCode = "401", description = "Not authenticated, or authenticated with a delegated token"),
        @APIResponse(responseCode = "404", description = "Unknown or revoked client")
    })
    public Response decide(
            @HeaderParam("Authorization") String authHeader,
            @CookieParam(AuthContextResolver.SESSION_COOKIE) String sessionCookie,
            JsonNode body) {
        AuthContext auth = authContextResolver.resolve(authHeader, sessionCookie);
        Optional<UseCaseError> callerError = consentFlowService.checkCaller(auth);
        if (callerError.isPresent()) {
            return ErrorResponses.envelope(callerError.get());
        }
        Result<ConsentRequest> request = ConsentRequest.fromJson(body, true);
        if (request instanceof Result.Failure<ConsentRequest> failure) {
            return ErrorResponses.envelope(failure.error());
        }
        return toResponse(consentFlowService.decide(auth, ((Result.Success<ConsentRequest>) request).value()));
    }

    private Response toResponse(Result<ConsentOutcome> result) {
        if (result instanceof Result.Failure<ConsentOutcome> failure) {
            return ErrorResponses.envelope(failure.error());
        }
        ConsentOutcome outcome = ((Result.Success<ConsentOutcome>) result).value();

        Map<String, Object> data = new LinkedHashMap<>();
        if (outcome instanceof ConsentOutcome.AwaitingDecision awaiting) {
            data.put("client", awaiting.client());
            data.put("scopes", awaiting.requestedScopes());
        } else if (outcome instanceof ConsentOutcome.AutoReissued reissued) {
            data.put("redirectUrl", reissued.redirectUrl());
            data.put("accessToken", reissued.accessToken());
            data.put("grantId", reissued.grantId());
        } else if (outcome instanceof ConsentOutcome.Approved approved) {
            data.put("redirectUrl", approved.redirectUrl());
            data.put("accessToken", approved.accessToken());
            data.put("grantId", approved.grantId());
        } else if (outcome instanceof ConsentOutcome.Denied denied) {
            data.put("redirectUrl", denied.redirectUrl());
        }
        return Response.ok(ApiResult.ok(data)).build();
    }
}
