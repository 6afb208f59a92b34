package tech.lapse.platform.serviceclient;

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
import tech.lapse.platform.common.api.ApiErrorCode;
import tech.lapse.platform.common.api.ApiResult;
import tech.lapse.platform.common.api.ErrorResponses;
import tech.lapse.platform.common.errors.UseCaseError;

import java.util.Map;

/**
 * Admin review of service clients. Only admin and root users may change
 * a client's trust level.
 */
@Path("/admin/apps")
@Tag(name = "Admin Apps", description = "Review third-party service clients")
@Produces(MediaType.APPLICATION_JSON)
public class AdminServiceClientResource {

    @Inject
    AuthContextResolver authContextResolver;

    @Inject
    ServiceClientService clientService;

    @PATCH
    @Path("/{id}")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(summary = "Set the trust level of an app", description = "Appends a review record.")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Trust level updated"),
        @APIResponse(responseCode = "400", description = "Invalid update payload"),
        @APIResponse(responseCode = "401", description = "Not authenticated"),
        @APIResponse(responseCode = "403", description = "Caller is not an admin"),
        @APIResponse(responseCode = "404", description = "App not found or revoked")
    })
    public Response review(
            @PathParam("id") String id,
            @HeaderParam("Authorization") String authHeader,
            @CookieParam(AuthContextResolver.SESSION_COOKIE) String sessionCookie,
            ServiceClientCommands.Review request) {
        AuthContext auth = authContextResolver.resolve(authHeader, sessionCookie);
        if (!auth.isAuthenticated() || auth.isDelegated()) {
            return ErrorResponses.envelope(new UseCaseError.AuthenticationError(
                ApiErrorCode.NO_PERMISSION.name(), "Authentication required."));
        }
        ServiceClientCommands.Review review = request != null ? request : new ServiceClientCommands.Review(null, null);

        Result<ServiceClient> result = clientService.review(auth.user(), id, review);
        if (result instanceof Result.Failure<ServiceClient> failure) {
            return ErrorResponses.envelope(failure.error());
        }
        ServiceClient client = ((Result.Success<ServiceClient>) result).value();
        return Response.ok(ApiResult.ok(Map.of("trustLevel", client.trustLevel))).build();
    }
}
