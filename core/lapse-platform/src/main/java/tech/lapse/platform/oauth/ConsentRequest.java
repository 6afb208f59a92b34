package tech.lapse.platform.oauth;

import com.fasterxml.jackson.databind.JsonNode;
import tech.lapse.platform.common.Result;
import tech.lapse.platform.common.api.ApiErrorCode;
import tech.lapse.platform.common.errors.UseCaseError;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of {@code POST} and {@code PUT /oauth/authorize}.
 *
 * @param scope   requested scopes; empty when none were requested
 * @param consent the user's decision; only present on {@code PUT}
 */
public record ConsentRequest(
    String clientId,
    String redirectUri,
    List<String> scope,
    String state,
    Boolean consent
) {

    static final int MAX_STATE_LENGTH = 256;

    public ConsentRequest {
        scope = scope != null ? List.copyOf(scope) : List.of();
    }

    /**
     * Validate the shape of a JSON body. Nothing here looks anything up.
     *
     * @param decision whether the body is a decision and must carry {@code consent}
     */
    public static Result<ConsentRequest> fromJson(JsonNode body, boolean decision) {
        if (body == null || !body.isObject()) {
            return Result.failure(invalid(ApiErrorCode.MISSING_PARAMS, "Request body must be a JSON object."));
        }

        JsonNode clientId = body.get("client_id");
        if (clientId == null || !clientId.isTextual() || clientId.asText().isEmpty()) {
            return Result.failure(invalid(ApiErrorCode.MISSING_PARAMS, "client_id is required."));
        }

        JsonNode redirectUri = body.get("redirect_uri");
        if (isPresent(redirectUri) && !redirectUri.isTextual()) {
            return Result.failure(invalid(ApiErrorCode.ERROR, "redirect_uri must be a string."));
        }

        JsonNode state = body.get("state");
        if (isPresent(state)) {
            if (!state.isTextual()) {
                return Result.failure(invalid(ApiErrorCode.ERROR, "state must be a string."));
            }
            if (state.asText().length() > MAX_STATE_LENGTH) {
                return Result.failure(invalid(ApiErrorCode.ERROR,
                    "state must be at most " + MAX_STATE_LENGTH + " characters."));
            }
        }

        List<String> scopes = new ArrayList<>();
        JsonNode scope = body.get("scope");
        if (isPresent(scope)) {
            if (!scope.isArray()) {
                return Result.failure(invalid(ApiErrorCode.ERROR, "scope must be an array of strings."));
            }
            for (JsonNode element : scope) {
                if (!element.isTextual()) {
                    return Result.failure(invalid(ApiErrorCode.ERROR, "scope must be an array of strings."));
                }
                scopes.add(element.asText());
            }
        }

        Boolean consent = null;
        if (decision) {
            JsonNode consentNode = body.get("consent");
            if (consentNode == null || !consentNode.isBoolean()) {
                return Result.failure(invalid(ApiErrorCode.MISSING_PARAMS, "consent must be true or false."));
            }
            consent = consentNode.asBoolean();
        }

        return Result.success(new ConsentRequest(
            clientId.asText(),
            isPresent(redirectUri) ? redirectUri.asText() : null,
            scopes,
            isPresent(state) ? state.asText() : null,
            consent));
    }

    private static boolean isPresent(JsonNode node) {
        return node != null && !node.isNull();
    }

    private static UseCaseError invalid(ApiErrorCode code, String message) {
        return new UseCaseError.ValidationError(code.name(), message);
    }
}
