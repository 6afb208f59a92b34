package tech.lapse.platform.oauth;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Successful token exchange response (RFC 8693 section 2.2.1).
 */
@Schema(description = "Token exchange response")
public record TokenExchangeResponse(
    String access_token,
    String issued_token_type,
    String token_type,
    long expires_in,
    String scope,
    String audience,
    String issuer
) {}
