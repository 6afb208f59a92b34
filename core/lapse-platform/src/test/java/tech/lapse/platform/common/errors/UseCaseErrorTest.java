package tech.lapse.platform.common.errors;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class UseCaseErrorTest {

    @Test
    @DisplayName("httpStatus should map each error type to its status")
    void httpStatus_shouldMapEachType() {
        assertThat(UseCaseError.httpStatus(new UseCaseError.ValidationError("invalid_request", "x"))).isEqualTo(400);
        assertThat(UseCaseError.httpStatus(new UseCaseError.AuthenticationError("invalid_client", "x"))).isEqualTo(401);
        assertThat(UseCaseError.httpStatus(new UseCaseError.AuthorizationError("access_denied", "x"))).isEqualTo(403);
        assertThat(UseCaseError.httpStatus(new UseCaseError.NotFoundError("NOT_FOUND", "x"))).isEqualTo(404);
    }

    @Test
    @DisplayName("httpStatus should refuse to map a missing error instead of defaulting to 404")
    void httpStatus_shouldThrow_whenUnmapped() {
        assertThatThrownBy(() -> UseCaseError.httpStatus(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unmapped error type");
    }
}
