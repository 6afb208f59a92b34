package tech.lapse.platform.oauth;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.lapse.platform.common.Result;
import tech.lapse.platform.common.api.ErrorResponses;

/**
 * Token endpoint. Only the token exchange grant is supported.
 *
 * POST /oauth/token
 *   grant_type=urn:ietf:params:oauth:grant-type:token-exchange
 *   &amp;subject_token=...
 *   &amp;subject_token_type=urn:ietf:params:oauth:token-type:access_token
 *   &amp;scope=timelapse:read
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc8693">RFC 8693 - OAuth 2.0 Token Exchange</a>
 */
@Path("/oauth/token")
@Tag(name = "OAuth Token", description = "Delegated token issuance for service clients")
public class TokenResource {

    @Inject
    TokenExchangeRequestParser requestParser;

    @Inject
    TokenExchangeService tokenExchangeService;

    @POST
    @Consumes(MediaType.WILDCARD)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Exchange a user's primary token for a delegated token",
        description = "Accepts form-encoded or JSON bodies. Client credentials via HTTP Basic or client_id/client_secret.")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Delegated token issued"),
        @APIResponse(responseCode = "400", description = "invalid_request or invalid_scope"),
        @APIResponse(responseCode = "401", description = "invalid_client"),
        @APIResponse(responseCode = "403", description = "invalid_scope or access_denied")
    })
    public Response token(
            @HeaderParam(HttpHeaders.CONTENT_TYPE) String contentType,
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authHeader,
            @HeaderParam("X-Forwarded-For") String forwardedFor,
            @HeaderParam(HttpHeaders.USER_AGENT) String userAgent,
            String body) {
        Result<TokenExchangeRequest> request = requestParser.parse(contentType, body);
        if (request instanceof Result.Failure<TokenExchangeRequest> failure) {
            return ErrorResponses.protocol(failure.error());
        }

        Result<TokenExchangeResponse> result = tokenExchangeService.exchange(
            ((Result.Success<TokenExchangeRequest>) request).value(),
            authHeader,
            new TokenExchangeService.CallerInfo(forwardedFor, userAgent));
        if (result instanceof Result.Failure<TokenExchangeResponse> failure) {
            return ErrorResponses.protocol(failure.error());
        }
        return Response.ok(((Result.Success<TokenExchangeResponse>) result).value())
            .header("Cache-Control", "no-store")
            .type(MediaType.APPLICATION_JSON)
            .build();
    }
}
