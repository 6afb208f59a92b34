package tech.lapse.platform.common.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Result envelope used by the consent, grants, developer and gateway procedure
 * endpoints: {@code {ok: true, data}} on success, {@code {ok: false, error, message}}
 * otherwise.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Result envelope")
public record ApiResult<T>(
    @Schema(description = "Whether the call succeeded")
    boolean ok,

    @Schema(description = "Payload on success")
    T data,

    @Schema(description = "Internal error code on failure", example = "NOT_FOUND")
    String error,

    @Schema(description = "Human readable message on failure")
    String message
) {

    public static <T> ApiResult<T> ok(T data) {
        return new ApiResult<>(true, data, null, null);
    }

    public static <T> ApiResult<T> err(ApiErrorCode code, String message) {
        return new ApiResult<>(false, null, code.name(), message);
    }

    public static <T> ApiResult<T> err(String code, String message) {
        return new ApiResult<>(false, null, code, message);
    }
}
