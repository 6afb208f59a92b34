package tech.lapse.platform.oauth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.lapse.platform.common.Result;
import tech.lapse.platform.common.api.ProtocolError;
import tech.lapse.platform.common.errors.UseCaseError;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Parses and shape-checks the token endpoint body. Accepts
 * {@code application/x-www-form-urlencoded}; any other content type is read
 * as JSON.
 */
@ApplicationScoped
public class TokenExchangeRequestParser {

    public static final String GRANT_TYPE_TOKEN_EXCHANGE = "urn:ietf:params:oauth:grant-type:token-exchange";
    static final int MAX_SCOPE_LENGTH = 512;

    private static final String[] FIELDS = {
        "grant_type", "resource", "audience", "scope", "requested_token_type",
        "subject_token", "subject_token_type", "client_id", "client_secret"
    };

    @Inject
    ObjectMapper objectMapper;

    public Result<TokenExchangeRequest> parse(String contentType, String body) {
        Map<String, String> fields;
        if (contentType != null
                && contentType.toLowerCase(Locale.ROOT).startsWith("application/x-www-form-urlencoded")) {
            fields = parseForm(body);
        } else {
            Result<Map<String, String>> json = parseJson(body);
            if (json instanceof Result.Failure<Map<String, String>> failure) {
                return Result.failure(failure.error());
            }
            fields = ((Result.Success<Map<String, String>>) json).value();
        }
        return validate(fields);
    }

    Result<TokenExchangeRequest> validate(Map<String, String> fields) {
        if (!GRANT_TYPE_TOKEN_EXCHANGE.equals(fields.get("grant_type"))) {
            return invalid("grant_type must be " + GRANT_TYPE_TOKEN_EXCHANGE + ".");
        }
        String subjectToken = fields.get("subject_token");
        if (subjectToken == null || subjectToken.isEmpty()) {
            return invalid("subject_token is required.");
        }
        String subjectTokenType = fields.get("subject_token_type");
        if (subjectTokenType == null || subjectTokenType.isEmpty()) {
            return invalid("subject_token_type is required.");
        }
        String scope = fields.get("scope");
        if (scope != null && scope.length() > MAX_SCOPE_LENGTH) {
            return invalid("scope must be at most " + MAX_SCOPE_LENGTH + " characters.");
        }

        return Result.success(new TokenExchangeRequest(
            fields.get("grant_type"),
            fields.get("resource"),
            fields.get("audience"),
            scope,
            fields.get("requested_token_type"),
            subjectToken,
            subjectTokenType,
            fields.get("client_id"),
            fields.get("client_secret")));
    }

    private Result<Map<String, String>> parseJson(String body) {
        JsonNode root;
        try {
            root = body == null || body.isBlank() ? null : objectMapper.readTree(body);
        } catch (Exception e) {
            return invalid("Request body is not valid JSON.");
        }
        if (root == null || !root.isObject()) {
            return invalid("Request body must be an object.");
        }

        Map<String, String> fields = new HashMap<>();
        for (String field : FIELDS) {
            JsonNode value = root.get(field);
            if (value == null || value.isNull()) {
                continue;
            }
            if (!value.isTextual()) {
                return invalid(field + " must be a string.");
            }
            fields.put(field, value.asText());
        }
        return Result.success(fields);
    }

    private static Map<String, String> parseForm(String body) {
        Map<String, String> fields = new HashMap<>();
        if (body == null || body.isEmpty()) {
            return fields;
        }
        for (String pair : body.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String name = URLDecoder.decode(eq < 0 ? pair : pair.substring(0, eq), StandardCharsets.UTF_8);
            String value = eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            // first occurrence wins
            fields.putIfAbsent(name, value);
        }
        return fields;
    }

    private static <T> Result<T> invalid(String description) {
        return Result.failure(new UseCaseError.ValidationError(ProtocolError.INVALID_REQUEST, description));
    }
}
