package tech.lapse.platform.authentication;

/**
 * Verified claims of a primary (first-party session) token.
 */
public record PrimaryToken(String userId, String email) {
}
