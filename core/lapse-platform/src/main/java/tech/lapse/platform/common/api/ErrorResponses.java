package tech.lapse.platform.common.api;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import tech.lapse.platform.common.errors.UseCaseError;

/**
 * Converts {@link UseCaseError} values into HTTP responses in one of the two
 * error vocabularies.
 */
public final class ErrorResponses {

    private ErrorResponses() {
    }

    /**
     * {@code {error, error_description}} body with the status of the error type.
     */
    public static Response protocol(UseCaseError error) {
        return protocol(UseCaseError.httpStatus(error), error.code(), error.message());
    }

    public static Response protocol(int status, String error, String description) {
        return Response.status(status)
            .entity(new ProtocolError(error, description))
            .type(MediaType.APPLICATION_JSON)
            .build();
    }

    /**
     * {@code {ok: false, error, message}} body with the status of the error type.
     */
    public static Response envelope(UseCaseError error) {
        return Response.status(UseCaseError.httpStatus(error))
            .entity(ApiResult.err(error.code(), error.message()))
            .type(MediaType.APPLICATION_JSON)
            .build();
    }
}
