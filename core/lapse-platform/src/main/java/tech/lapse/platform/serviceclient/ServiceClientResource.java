package tech.lapse.platform.serviceclient;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.lapse.platform.audit.ServiceTokenAudit;
import tech.lapse.platform.authentication.AuthContext;
import tech.lapse.platform.authentication.AuthContextResolver;
import tech.lapse.platform.common.Result;
import tech.lapse.platform.common.api.ApiErrorCode;
import tech.lapse.platform.common.api.ApiResult;
import tech.lapse.platform.common.api.ErrorResponses;
import tech.lapse.platform.common.errors.UseCaseError;

import java.util.List;
import java.util.Map;

/**
 * Developer console API: service clients owned by the signed-in user.
 *
 * <p>Only first-party callers may manage apps; a delegated token is treated
 * as unauthenticated here.
 */
@Path("/developer/apps")
@Tag(name = "Developer Apps", description = "Register and manage service clients")
@Produces(MediaType.APPLICATION_JSON)
public class ServiceClientResource {

    @Inject
    AuthContextResolver authContextResolver;

    @Inject
    ServiceClientService clientService;

    @GET
    @Operation(summary = "List the current user's apps")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Apps owned by the user"),
        @APIResponse(responseCode = "401", description = "Not authenticated")
    })
    public Response list(
            @HeaderParam("Authorization") String authHeader,
            @CookieParam(AuthContextResolver.SESSION_COOKIE) String sessionCookie) {
        AuthContext auth = authContextResolver.resolve(authHeader, sessionCookie);
        if (!isDeveloper(auth)) {
            return unauthorized();
        }
        List<ServiceClientView> apps = clientService.listOwned(auth.user().id).stream()
            .map(ServiceClientView::from)
            .toList();
        return Response.ok(ApiResult.ok(Map.of("apps", apps))).build();
    }

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(summary = "Register a new app", description = "The client secret is only returned once.")
    @APIResponses({
        @APIResponse(responseCode = "201", description = "App registered"),
        @APIResponse(responseCode = "400", description = "Validation failed"),
        @APIResponse(responseCode = "401", description = "Not authenticated")
    })
    public Response register(
            @HeaderParam("Authorization") String authHeader,
            @CookieParam(AuthContextResolver.SESSION_COOKIE) String sessionCookie,
            ServiceClientCommands.Register request) {
        AuthContext auth = authContextResolver.resolve(authHeader, sessionCookie);
        if (!isDeveloper(auth)) {
            return unauthorized();
        }
        if (request == null) {
            return missingBody();
        }
        Result<ServiceClientCommands.IssuedSecret> result = clientService.register(auth.user().id, request);
        if (result instanceof Result.Failure<ServiceClientCommands.IssuedSecret> failure) {
            return ErrorResponses.envelope(failure.error());
        }
        ServiceClientCommands.IssuedSecret issued = ((Result.Success<ServiceClientCommands.IssuedSecret>) result).value();
        return Response.status(Response.Status.CREATED)
            .entity(ApiResult.ok(Map.of(
                "app", ServiceClientView.from(issued.client()),
                "clientSecret", issued.clientSecret())))
            .build();
    }

    @PATCH
    @Path("/{id}")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(summary = "Update an app", description = "Fields left out of the body are unchanged.")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "App updated"),
        @APIResponse(responseCode = "400", description = "Validation failed"),
        @APIResponse(responseCode = "401", description = "Not authenticated"),
        @APIResponse(responseCode = "404", description = "App not found")
    })
    public Response update(
            @PathParam("id") String id,
            @HeaderParam("Authorization") String authHeader,
            @CookieParam(AuthContextResolver.SESSION_COOKIE) String sessionCookie,
            ServiceClientCommands.Update request) {
        AuthContext auth = authContextResolver.resolve(authHeader, sessionCookie);
        if (!isDeveloper(auth)) {
            return unauthorized();
        }
        if (request == null) {
            return missingBody();
        }
        Result<ServiceClient> result = clientService.update(auth.user().id, id, request);
        if (result instanceof Result.Failure<ServiceClient> failure) {
            return ErrorResponses.envelope(failure.error());
        }
        ServiceClient client = ((Result.Success<ServiceClient>) result).value();
        return Response.ok(ApiResult.ok(Map.of("app", ServiceClientView.from(client)))).build();
    }

    @POST
    @Path("/{id}/rotate-secret")
    @Operation(summary = "Issue a new client secret", description = "The previous secret stops working immediately.")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "New secret issued"),
        @APIResponse(responseCode = "401", description = "Not authenticated"),
        @APIResponse(responseCode = "404", description = "App not found")
    })
    public Response rotateSecret(
            @PathParam("id") String id,
            @HeaderParam("Authorization") String authHeader,
            @CookieParam(AuthContextResolver.SESSION_COOKIE) String sessionCookie) {
        AuthContext auth = authContextResolver.resolve(authHeader, sessionCookie);
        if (!isDeveloper(auth)) {
            return unauthorized();
        }
        Result<ServiceClientCommands.IssuedSecret> result = clientService.rotateSecret(auth.user().id, id);
        if (result instanceof Result.Failure<ServiceClientCommands.IssuedSecret> failure) {
            return ErrorResponses.envelope(failure.error());
        }
        String secret = ((Result.Success<ServiceClientCommands.IssuedSecret>) result).value().clientSecret();
        return Response.ok(ApiResult.ok(Map.of("clientSecret", secret))).build();
    }

    @GET
    @Path("/{id}/token-audit")
    @Operation(summary = "Recent token exchanges of an app")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Audit records, newest first"),
        @APIResponse(responseCode = "401", description = "Not authenticated"),
        @APIResponse(responseCode = "404", description = "App not found")
    })
    public Response tokenAudit(
            @PathParam("id") String id,
            @HeaderParam("Authorization") String authHeader,
            @CookieParam(AuthContextResolver.SESSION_COOKIE) String sessionCookie) {
        AuthContext auth = authContextResolver.resolve(authHeader, sessionCookie);
        if (!isDeveloper(auth)) {
            return unauthorized();
        }
        Result<List<ServiceTokenAudit>> result = clientService.recentTokenAudits(auth.user().id, id);
        if (result instanceof Result.Failure<List<ServiceTokenAudit>> failure) {
            return ErrorResponses.envelope(failure.error());
        }
        return Response.ok(ApiResult.ok(Map.of("audits", ((Result.Success<List<ServiceTokenAudit>>) result).value())))
            .build();
    }

    @DELETE
    @Path("/{id}")
    @Operation(summary = "Revoke an app", description = "Tokens already issued stay valid until they expire.")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "App revoked"),
        @APIResponse(responseCode = "401", description = "Not authenticated"),
        @APIResponse(responseCode = "404", description = "App not found")
    })
    public Response revoke(
            @PathParam("id") String id,
            @HeaderParam("Authorization") String authHeader,
            @CookieParam(AuthContextResolver.SESSION_COOKIE) String sessionCookie) {
        AuthContext auth = authContextResolver.resolve(authHeader, sessionCookie);
        if (!isDeveloper(auth)) {
            return unauthorized();
        }
        Result<ServiceClient> result = clientService.revoke(auth.user().id, id);
        if (result instanceof Result.Failure<ServiceClient> failure) {
            return ErrorResponses.envelope(failure.error());
        }
        return Response.ok(ApiResult.ok(Map.of())).build();
    }

    private static boolean isDeveloper(AuthContext auth) {
        return auth.isAuthenticated() && !auth.isDelegated();
    }

    private static Response unauthorized() {
        return ErrorResponses.envelope(new UseCaseError.AuthenticationError(
            ApiErrorCode.NO_PERMISSION.name(), "Authentication required."));
    }

    private static Response missingBody() {
        return ErrorResponses.envelope(new UseCaseError.ValidationError(
            ApiErrorCode.MISSING_PARAMS.name(), "Request body is required."));
    }
}
