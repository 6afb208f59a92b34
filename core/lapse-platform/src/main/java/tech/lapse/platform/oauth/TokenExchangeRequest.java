package tech.lapse.platform.oauth;

/**
 * A shape-validated token exchange request. Field names follow RFC 8693 on
 * the wire; {@link TokenExchangeRequestParser} produces this from a form or
 * JSON body.
 */
public record TokenExchangeRequest(
    String grantType,
    String resource,
    String audience,
    String scope,
    String requestedTokenType,
    String subjectToken,
    String subjectTokenType,
    String clientId,
    String clientSecret
) {}
