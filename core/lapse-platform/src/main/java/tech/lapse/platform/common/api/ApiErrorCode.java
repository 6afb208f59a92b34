package tech.lapse.platform.common.api;

/**
 * Internal result codes carried in the {@code error} field of the
 * {@link ApiResult} envelope.
 */
public enum ApiErrorCode {
    ERROR,
    NOT_FOUND,
    NO_PERMISSION,
    MISSING_PARAMS
}
