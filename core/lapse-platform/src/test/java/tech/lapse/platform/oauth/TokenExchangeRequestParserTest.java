package tech.lapse.platform.oauth;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.lapse.platform.common.Result;
import tech.lapse.platform.common.api.ProtocolError;
import tech.lapse.platform.common.errors.UseCaseError;

import static org.assertj.core.api.Assertions.*;

class TokenExchangeRequestParserTest {

    private static final String FORM = "application/x-www-form-urlencoded";
    private static final String GRANT = "urn%3Aietf%3Aparams%3Aoauth%3Agrant-type%3Atoken-exchange";
    private static final String ACCESS_TOKEN = "urn%3Aietf%3Aparams%3Aoauth%3Atoken-type%3Aaccess_token";

    private TokenExchangeRequestParser parser;

    @BeforeEach
    void setUp() {
        parser = new TokenExchangeRequestParser();
        parser.objectMapper = new ObjectMapper();
    }

    @Test
    @DisplayName("parse should read a form encoded body")
    void parse_shouldReadFormBody() {
        Result<TokenExchangeRequest> result = parser.parse(FORM + "; charset=UTF-8",
            "grant_type=" + GRANT + "&subject_token=abc&subject_token_type=" + ACCESS_TOKEN
                + "&scope=timelapse%3Aread+user%3Aread&client_id=svc_1&client_secret=scs_1");

        TokenExchangeRequest request = ((Result.Success<TokenExchangeRequest>) result).value();
        assertThat(request.subjectToken()).isEqualTo("abc");
        assertThat(request.subjectTokenType()).isEqualTo(TokenExchangeService.TOKEN_TYPE_ACCESS_TOKEN);
        assertThat(request.scope()).isEqualTo("timelapse:read user:read");
        assertThat(request.clientId()).isEqualTo("svc_1");
        assertThat(request.clientSecret()).isEqualTo("scs_1");
    }

    @Test
    @DisplayName("parse should read a JSON body for any other content type")
    void parse_shouldReadJsonBody() {
        Result<TokenExchangeRequest> result = parser.parse("application/json", """
            {"grant_type": "urn:ietf:params:oauth:grant-type:token-exchange",
             "subject_token": "abc",
             "subject_token_type": "urn:ietf:params:oauth:token-type:jwt"}
            """);

        assertThat(result).isInstanceOf(Result.Success.class);
    }

    @Test
    @DisplayName("parse should reject a wrong grant type")
    void parse_shouldReject_whenGrantTypeWrong() {
        UseCaseError error = error(parser.parse(FORM, "grant_type=client_credentials&subject_token=a&subject_token_type=b"));

        assertThat(error.code()).isEqualTo(ProtocolError.INVALID_REQUEST);
        assertThat(UseCaseError.httpStatus(error)).isEqualTo(400);
    }

    @Test
    @DisplayName("parse should reject missing subject token fields")
    void parse_shouldReject_whenSubjectTokenMissing() {
        assertThat(error(parser.parse(FORM, "grant_type=" + GRANT + "&subject_token_type=x")).message())
            .isEqualTo("subject_token is required.");
        assertThat(error(parser.parse(FORM, "grant_type=" + GRANT + "&subject_token=x")).message())
            .isEqualTo("subject_token_type is required.");
    }

    @Test
    @DisplayName("parse should reject non-string JSON fields and malformed JSON")
    void parse_shouldReject_whenJsonMalformed() {
        assertThat(error(parser.parse("application/json", "{\"grant_type\": 1}")).message())
            .isEqualTo("grant_type must be a string.");
        assertThat(error(parser.parse("application/json", "{not json")).code())
            .isEqualTo(ProtocolError.INVALID_REQUEST);
        assertThat(error(parser.parse(null, "")).code()).isEqualTo(ProtocolError.INVALID_REQUEST);
    }

    @Test
    @DisplayName("parse should reject a scope longer than 512 characters")
    void parse_shouldReject_whenScopeTooLong() {
        String scope = "a".repeat(TokenExchangeRequestParser.MAX_SCOPE_LENGTH + 1);

        UseCaseError error = error(parser.parse(FORM,
            "grant_type=" + GRANT + "&subject_token=x&subject_token_type=y&scope=" + scope));

        assertThat(error.message()).startsWith("scope must be at most");
    }

    private static UseCaseError error(Result<TokenExchangeRequest> result) {
        assertThat(result).isInstanceOf(Result.Failure.class);
        return ((Result.Failure<TokenExchangeRequest>) result).error();
    }
}
