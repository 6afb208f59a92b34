package tech.lapse.platform.serviceclient;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ServiceSecretHasher.
 * Uses low cost parameters to keep the suite fast.
 */
class ServiceSecretHasherTest {

    private final ServiceSecretHasher hasher = new ServiceSecretHasher(1, 1024, 1);

    @Test
    @DisplayName("hash should produce salt and 64-byte key as hex")
    void hash_shouldProduceSaltAndKeyAsHex() {
        String stored = hasher.hash("scs_secret");

        String[] parts = stored.split(":");
        assertThat(parts).hasSize(2);
        assertThat(parts[0]).hasSize(32).matches("[0-9a-f]+");
        assertThat(parts[1]).hasSize(128).matches("[0-9a-f]+");
    }

    @Test
    @DisplayName("hash should use a fresh salt every time")
    void hash_shouldUseFreshSalt() {
        assertThat(hasher.hash("scs_secret")).isNotEqualTo(hasher.hash("scs_secret"));
    }

    @Test
    @DisplayName("hash should throw when secret is empty")
    void hash_shouldThrow_whenSecretEmpty() {
        assertThatThrownBy(() -> hasher.hash(""))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("verify should accept the original secret and reject any other")
    void verify_shouldAcceptOriginalOnly() {
        String stored = hasher.hash("scs_secret");

        assertThat(hasher.verify("scs_secret", stored)).isTrue();
        assertThat(hasher.verify("scs_secreT", stored)).isFalse();
        assertThat(hasher.verify("", stored)).isFalse();
    }

    @Test
    @DisplayName("verify should return false for malformed stored values")
    void verify_shouldReturnFalse_whenStoredValueMalformed() {
        String stored = hasher.hash("scs_secret");
        String salt = stored.substring(0, stored.indexOf(':'));

        assertThat(hasher.verify("scs_secret", null)).isFalse();
        assertThat(hasher.verify("scs_secret", "")).isFalse();
        assertThat(hasher.verify("scs_secret", "no-separator")).isFalse();
        assertThat(hasher.verify("scs_secret", salt + ":")).isFalse();
        assertThat(hasher.verify("scs_secret", ":" + stored.substring(stored.indexOf(':') + 1))).isFalse();
        assertThat(hasher.verify("scs_secret", salt + ":zz")).isFalse();
        assertThat(hasher.verify("scs_secret", salt + ":abcd")).isFalse();
    }

    @Test
    @DisplayName("verify should fail when cost parameters changed")
    void verify_shouldFail_whenCostParametersChanged() {
        String stored = hasher.hash("scs_secret");
        ServiceSecretHasher stronger = new ServiceSecretHasher(2, 1024, 1);

        assertThat(stronger.verify("scs_secret", stored)).isFalse();
    }
}
