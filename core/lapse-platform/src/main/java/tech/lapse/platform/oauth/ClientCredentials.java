package tech.lapse.platform.oauth;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

/**
 * Service client credentials presented at the token endpoint.
 */
public record ClientCredentials(String clientId, String clientSecret) {

    private static final String BASIC_SCHEME = "Basic";

    /**
     * HTTP Basic credentials win; an absent or unparseable header falls back
     * to the body fields. Empty when either half is missing.
     */
    public static Optional<ClientCredentials> resolve(String authHeader, String bodyClientId, String bodyClientSecret) {
        if (isBasic(authHeader)) {
            Optional<ClientCredentials> basic = parseBasicAuth(authHeader);
            if (basic.isPresent()) {
                return basic;
            }
        }
        if (bodyClientId != null && !bodyClientId.isEmpty()
                && bodyClientSecret != null && !bodyClientSecret.isEmpty()) {
            return Optional.of(new ClientCredentials(bodyClientId, bodyClientSecret));
        }
        return Optional.empty();
    }

    /**
     * Scheme name is case-insensitive and followed by at least one whitespace.
     */
    static boolean isBasic(String authHeader) {
        return authHeader != null
            && authHeader.length() > BASIC_SCHEME.length()
            && authHeader.regionMatches(true, 0, BASIC_SCHEME, 0, BASIC_SCHEME.length())
            && Character.isWhitespace(authHeader.charAt(BASIC_SCHEME.length()));
    }

    /**
     * Splits on the first colon, so secrets may contain colons.
     */
    static Optional<ClientCredentials> parseBasicAuth(String authHeader) {
        try {
            String base64 = authHeader.substring(BASIC_SCHEME.length()).trim();
            String decoded = new String(Base64.getDecoder().decode(base64), StandardCharsets.UTF_8);
            int colonIdx = decoded.indexOf(':');
            if (colonIdx <= 0 || colonIdx == decoded.length() - 1) {
                return Optional.empty();
            }
            return Optional.of(new ClientCredentials(
                decoded.substring(0, colonIdx),
                decoded.substring(colonIdx + 1)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return "ClientCredentials[clientId=" + clientId + "]";
    }
}
