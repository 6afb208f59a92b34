package tech.lapse.platform.common.api;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Protocol error body for the token endpoint and the gateway transport layer.
 */
@Schema(description = "Protocol error response")
public record ProtocolError(
    @Schema(description = "Error kind", example = "invalid_scope")
    String error,

    @Schema(description = "Human readable description")
    String error_description
) {

    public static final String INVALID_REQUEST = "invalid_request";
    public static final String INVALID_CLIENT = "invalid_client";
    public static final String INVALID_SCOPE = "invalid_scope";
    public static final String ACCESS_DENIED = "access_denied";
    public static final String UNAUTHORIZED = "unauthorized";
    public static final String FORBIDDEN = "forbidden";
    public static final String NOT_FOUND = "not_found";
    public static final String INTERNAL_ERROR = "internal_error";
}
