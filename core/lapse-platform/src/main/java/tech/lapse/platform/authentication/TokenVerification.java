package tech.lapse.platform.authentication;

/**
 * Outcome of verifying a bearer token. Verification never throws; a token
 * that fails any check is reported as {@link Invalid} with the reason.
 */
public sealed interface TokenVerification<T> permits TokenVerification.Valid, TokenVerification.Invalid {

    boolean isValid();

    record Valid<T>(T claims) implements TokenVerification<T> {
        @Override
        public boolean isValid() {
            return true;
        }
    }

    record Invalid<T>(String reason) implements TokenVerification<T> {
        @Override
        public boolean isValid() {
            return false;
        }
    }

    static <T> TokenVerification<T> valid(T claims) {
        return new Valid<>(claims);
    }

    static <T> TokenVerification<T> invalid(String reason) {
        return new Invalid<>(reason);
    }
}
