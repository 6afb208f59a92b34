package tech.lapse.platform.gateway;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.lapse.platform.authentication.AuthContextResolver;

/**
 * REST entry point for internal procedures. Queries take their input as a
 * JSON {@code input} query parameter, mutations as the request body.
 */
@Path("/rest/{router}/{procedure}")
@Tag(name = "REST Gateway", description = "Scope-checked access to Lapse procedures")
@Produces(MediaType.APPLICATION_JSON)
public class GatewayResource {

    @Inject
    ScopeEnforcingGateway gateway;

    @GET
    @Operation(summary = "Call a query procedure")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Procedure result"),
        @APIResponse(responseCode = "400", description = "Invalid input payload"),
        @APIResponse(responseCode = "401", description = "Authentication required"),
        @APIResponse(responseCode = "403", description = "Missing required scope"),
        @APIResponse(responseCode = "404", description = "Unknown procedure"),
        @APIResponse(responseCode = "405", description = "Method not allowed")
    })
    public Response get(
            @PathParam("router") String router,
            @PathParam("procedure") String procedure,
            @QueryParam("input") String input,
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authHeader,
            @CookieParam(AuthContextResolver.SESSION_COOKIE) String sessionCookie) {
        return dispatch(new GatewayRequest(router, procedure, RestMethod.GET, input, null, authHeader, sessionCookie));
    }

    @POST
    @Consumes(MediaType.WILDCARD)
    @Operation(summary = "Call a mutation procedure")
    public Response post(
            @PathParam("router") String router,
            @PathParam("procedure") String procedure,
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authHeader,
            @CookieParam(AuthContextResolver.SESSION_COOKIE) String sessionCookie,
            String body) {
        return dispatch(new GatewayRequest(router, procedure, RestMethod.POST, null, body, authHeader, sessionCookie));
    }

    @PATCH
    @Consumes(MediaType.WILDCARD)
    @Operation(summary = "Call an update procedure")
    public Response patch(
            @PathParam("router") String router,
            @PathParam("procedure") String procedure,
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authHeader,
            @CookieParam(AuthContextResolver.SESSION_COOKIE) String sessionCookie,
            String body) {
        return dispatch(new GatewayRequest(router, procedure, RestMethod.PATCH, null, body, authHeader, sessionCookie));
    }

    @DELETE
    @Consumes(MediaType.WILDCARD)
    @Operation(summary = "Call a delete procedure")
    public Response delete(
            @PathParam("router") String router,
            @PathParam("procedure") String procedure,
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authHeader,
            @CookieParam(AuthContextResolver.SESSION_COOKIE) String sessionCookie,
            String body) {
        return dispatch(new GatewayRequest(router, procedure, RestMethod.DELETE, null, body, authHeader, sessionCookie));
    }

    private Response dispatch(GatewayRequest request) {
        GatewayResponse result = gateway.handle(request);
        return Response.status(result.status())
            .entity(result.body())
            .type(MediaType.APPLICATION_JSON)
            .build();
    }
}
