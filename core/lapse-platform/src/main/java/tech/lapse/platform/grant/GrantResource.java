package tech.lapse.platform.grant;

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

import java.util.List;
import java.util.Map;

/**
 * Lets a user see and revoke the service clients they have granted access to.
 */
@Path("/oauth/grants")
@Tag(name = "OAuth Grants", description = "Manage consent granted to service clients")
@Produces(MediaType.APPLICATION_JSON)
public class GrantResource {

    @Inject
    AuthContextResolver authContextResolver;

    @Inject
    ServiceGrantService grantService;

    @GET
    @Operation(summary = "List active grants of the current user")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Active grants, most recently updated first"),
        @APIResponse(responseCode = "401", description = "Not authenticated")
    })
    public Response list(
            @HeaderParam("Authorization") String authHeader,
            @CookieParam(AuthContextResolver.SESSION_COOKIE) String sessionCookie) {
        AuthContext auth = authContextResolver.resolve(authHeader, sessionCookie);
        Result<List<GrantSummary>> result = grantService.listActiveGrants(auth);
        if (result instanceof Result.Failure<List<GrantSummary>> failure) {
            return ErrorResponses.envelope(failure.error());
        }
        List<GrantSummary> grants = ((Result.Success<List<GrantSummary>>) result).value();
        return Response.ok(ApiResult.ok(Map.of("grants", grants))).build();
    }

    @DELETE
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(summary = "Revoke one of the current user's grants")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Grant revoked"),
        @APIResponse(responseCode = "400", description = "grantId missing"),
        @APIResponse(responseCode = "401", description = "Not authenticated"),
        @APIResponse(responseCode = "404", description = "No such grant for this user")
    })
    public Response revoke(
            @HeaderParam("Authorization") String authHeader,
            @CookieParam(AuthContextResolver.SESSION_COOKIE) String sessionCookie,
            RevokeGrantRequest request) {
        AuthContext auth = authContextResolver.resolve(authHeader, sessionCookie);
        Result<ServiceGrant> result = grantService.revoke(auth, request != null ? request.grantId() : null);
        if (result instanceof Result.Failure<ServiceGrant> failure) {
            return ErrorResponses.envelope(failure.error());
        }
        return Response.ok(ApiResult.ok(Map.of())).build();
    }

    public record RevokeGrantRequest(String grantId) {}
}
