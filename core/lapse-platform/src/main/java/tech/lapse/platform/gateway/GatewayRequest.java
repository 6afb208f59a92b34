package tech.lapse.platform.gateway;

/**
 * One inbound gateway call.
 *
 * @param queryInput JSON text from the {@code input} query parameter, used for GET
 * @param body       raw request body, used for the other methods
 */
public record GatewayRequest(
    String router,
    String procedure,
    RestMethod method,
    String queryInput,
    String body,
    String authorizationHeader,
    String sessionCookie
) {
}
