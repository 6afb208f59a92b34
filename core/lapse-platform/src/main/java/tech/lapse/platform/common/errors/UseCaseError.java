package tech.lapse.platform.common.errors;

/**
 * Sealed error hierarchy for service failures.
 *
 * Errors are categorized by type to enable consistent HTTP status mapping.
 * The {@code code} is the wire-level error kind: a protocol error
 * ({@code invalid_request}, {@code invalid_client}, ...) on the OAuth and
 * gateway endpoints, or an {@link tech.lapse.platform.common.api.ApiErrorCode}
 * name on the result-envelope endpoints.
 */
public sealed interface UseCaseError {

    String code();
    String message();

    /**
     * Input validation failed (missing required fields, unknown scopes, etc.)
     * Maps to HTTP 400 Bad Request.
     */
    record ValidationError(String code, String message) implements UseCaseError {}

    /**
     * Caller or client could not be authenticated.
     * Maps to HTTP 401 Unauthorized.
     */
    record AuthenticationError(String code, String message) implements UseCaseError {}

    /**
     * Authenticated, but not allowed to perform this action.
     * Maps to HTTP 403 Forbidden.
     */
    record AuthorizationError(String code, String message) implements UseCaseError {}

    /**
     * Entity not found.
     * Maps to HTTP 404 Not Found.
     */
    record NotFoundError(String code, String message) implements UseCaseError {}

    static int httpStatus(UseCaseError error) {
        if (error instanceof ValidationError) {
            return 400;
        }
        if (error instanceof AuthenticationError) {
            return 401;
        }
        if (error instanceof AuthorizationError) {
            return 403;
        }
        if (error instanceof NotFoundError) {
            return 404;
        }
        throw new IllegalArgumentException("Unmapped error type: " + error);
    }
}
