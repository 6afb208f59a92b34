package tech.lapse.platform.oauth;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class ClientCredentialsTest {

    @Test
    @DisplayName("resolve should prefer HTTP Basic over body credentials")
    void resolve_shouldPreferBasic() {
        Optional<ClientCredentials> credentials = ClientCredentials.resolve(basic("svc_a:scs_a"), "svc_b", "scs_b");

        assertThat(credentials).contains(new ClientCredentials("svc_a", "scs_a"));
    }

    @Test
    @DisplayName("resolve should split Basic credentials on the first colon only")
    void resolve_shouldSplitOnFirstColon() {
        Optional<ClientCredentials> credentials = ClientCredentials.resolve(basic("svc_a:scs:with:colons"), null, null);

        assertThat(credentials.map(ClientCredentials::clientSecret)).contains("scs:with:colons");
    }

    @Test
    @DisplayName("resolve should fall back to the body when the Basic header is unusable")
    void resolve_shouldFallBackToBody_whenBasicUnusable() {
        assertThat(ClientCredentials.resolve("Basic %%%", "svc_b", "scs_b"))
            .contains(new ClientCredentials("svc_b", "scs_b"));
        assertThat(ClientCredentials.resolve(basic("no-colon"), "svc_b", "scs_b"))
            .contains(new ClientCredentials("svc_b", "scs_b"));
    }

    @Test
    @DisplayName("resolve should match the Basic scheme case-insensitively")
    void resolve_shouldMatchBasicSchemeIgnoringCase() {
        String encoded = Base64.getEncoder().encodeToString("svc_a:scs_a".getBytes(StandardCharsets.UTF_8));

        assertThat(ClientCredentials.resolve("basic " + encoded, "svc_b", "scs_b"))
            .contains(new ClientCredentials("svc_a", "scs_a"));
        assertThat(ClientCredentials.resolve("BASIC\t" + encoded, "svc_b", "scs_b"))
            .contains(new ClientCredentials("svc_a", "scs_a"));
    }

    @Test
    @DisplayName("resolve should ignore other schemes and a scheme without a separator")
    void resolve_shouldIgnoreNonBasicSchemes() {
        String encoded = Base64.getEncoder().encodeToString("svc_a:scs_a".getBytes(StandardCharsets.UTF_8));

        assertThat(ClientCredentials.resolve("Bearer " + encoded, "svc_b", "scs_b"))
            .contains(new ClientCredentials("svc_b", "scs_b"));
        assertThat(ClientCredentials.resolve("Basic" + encoded, "svc_b", "scs_b"))
            .contains(new ClientCredentials("svc_b", "scs_b"));
    }

    @Test
    @DisplayName("resolve should be empty when either half is missing")
    void resolve_shouldBeEmpty_whenIncomplete() {
        assertThat(ClientCredentials.resolve(null, "svc_b", null)).isEmpty();
        assertThat(ClientCredentials.resolve(null, "", "scs_b")).isEmpty();
        assertThat(ClientCredentials.resolve(basic("svc_a:"), null, null)).isEmpty();
    }

    @Test
    @DisplayName("toString should not reveal the secret")
    void toString_shouldHideSecret() {
        assertThat(new ClientCredentials("svc_a", "scs_secret").toString()).doesNotContain("scs_secret");
    }

    private static String basic(String value) {
        return "Basic " + Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8));
    }
}
