package tech.lapse.platform.authentication;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.lapse.platform.serviceclient.ServiceClientRepository;
import tech.lapse.platform.test.Fixtures;
import tech.lapse.platform.user.UserRepository;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AuthContextResolver.
 *
 * Delegated tokens must never be downgraded to first-party access.
 */
@ExtendWith(MockitoExtension.class)
class AuthContextResolverTest {

    @Mock
    private TokenService tokenService;

    @Mock
    private UserRepository userRepo;

    @Mock
    private ServiceClientRepository clientRepo;

    @InjectMocks
    private AuthContextResolver resolver;

    @Test
    @DisplayName("resolve should return anonymous when no credentials are present")
    void resolve_shouldReturnAnonymous_whenNoCredentials() {
        AuthContext auth = resolver.resolve(null, null);

        assertThat(auth.isAuthenticated()).isFalse();
        verifyNoInteractions(tokenService);
    }

    @Test
    @DisplayName("resolve should build a delegated context from a valid delegated bearer token")
    void resolve_shouldBuildDelegatedContext_whenBearerIsDelegated() {
        when(tokenService.verifyDelegated("tok")).thenReturn(TokenVerification.valid(
            new DelegatedToken(Fixtures.USER_ID, null, Fixtures.CLIENT_PK, List.of("user:read"))));
        when(userRepo.findUserById(Fixtures.USER_ID)).thenReturn(Optional.of(Fixtures.user()));
        when(clientRepo.findActiveById(Fixtures.CLIENT_PK)).thenReturn(Optional.of(Fixtures.client("user:read")));

        AuthContext auth = resolver.resolve("Bearer tok", null);

        assertThat(auth.isDelegated()).isTrue();
        assertThat(auth.user().id).isEqualTo(Fixtures.USER_ID);
        assertThat(auth.scopes()).containsExactly("user:read");
    }

    @Test
    @DisplayName("resolve should return anonymous when the delegated token's actor was revoked")
    void resolve_shouldReturnAnonymous_whenActorRevoked() {
        when(tokenService.verifyDelegated("tok")).thenReturn(TokenVerification.valid(
            new DelegatedToken(Fixtures.USER_ID, null, Fixtures.CLIENT_PK, List.of("user:read"))));
        when(userRepo.findUserById(Fixtures.USER_ID)).thenReturn(Optional.of(Fixtures.user()));
        when(clientRepo.findActiveById(Fixtures.CLIENT_PK)).thenReturn(Optional.empty());

        AuthContext auth = resolver.resolve("Bearer tok", null);

        assertThat(auth.isAuthenticated()).isFalse();
    }

    @Test
    @DisplayName("resolve should not fall back to primary verification for a tampered delegated token")
    void resolve_shouldNotFallBackToPrimary_whenTokenLooksDelegated() {
        when(tokenService.verifyDelegated("tok")).thenReturn(TokenVerification.invalid("audience mismatch"));
        when(tokenService.looksDelegated("tok")).thenReturn(true);

        AuthContext auth = resolver.resolve("Bearer tok", null);

        assertThat(auth.isAuthenticated()).isFalse();
        verify(tokenService, never()).verifyPrimary(anyString());
    }

    @Test
    @DisplayName("resolve should accept a primary bearer token")
    void resolve_shouldBuildPrimaryContext_whenBearerIsPrimary() {
        when(tokenService.verifyDelegated("tok")).thenReturn(TokenVerification.invalid("audience mismatch"));
        when(tokenService.looksDelegated("tok")).thenReturn(false);
        when(tokenService.verifyPrimary("tok")).thenReturn(TokenVerification.valid(
            new PrimaryToken(Fixtures.USER_ID, "ada@example.com")));
        when(userRepo.findUserById(Fixtures.USER_ID)).thenReturn(Optional.of(Fixtures.user()));

        AuthContext auth = resolver.resolve("Bearer tok", null);

        assertThat(auth.isAuthenticated()).isTrue();
        assertThat(auth.isDelegated()).isFalse();
    }

    @Test
    @DisplayName("resolve should only verify the session cookie as a primary token")
    void resolve_shouldVerifyCookieAsPrimaryOnly() {
        when(tokenService.verifyPrimary("cookie")).thenReturn(TokenVerification.invalid("delegated token is not a primary token"));

        AuthContext auth = resolver.resolve(null, "cookie");

        assertThat(auth.isAuthenticated()).isFalse();
        verify(tokenService, never()).verifyDelegated(anyString());
    }

    @Test
    @DisplayName("resolve should prefer the bearer header over the cookie")
    void resolve_shouldPreferBearerOverCookie() {
        when(tokenService.verifyDelegated("tok")).thenReturn(TokenVerification.invalid("bad"));
        when(tokenService.looksDelegated("tok")).thenReturn(false);
        when(tokenService.verifyPrimary("tok")).thenReturn(TokenVerification.invalid("bad"));

        AuthContext auth = resolver.resolve("Bearer tok", "cookie");

        assertThat(auth.isAuthenticated()).isFalse();
        verify(tokenService, never()).verifyPrimary("cookie");
    }

    @Test
    @DisplayName("extractBearer should ignore other schemes and empty tokens")
    void extractBearer_shouldIgnoreOtherSchemes() {
        assertThat(AuthContextResolver.extractBearer("Bearer abc")).isEqualTo("abc");
        assertThat(AuthContextResolver.extractBearer("Basic abc")).isNull();
        assertThat(AuthContextResolver.extractBearer("Bearer   ")).isNull();
        assertThat(AuthContextResolver.extractBearer(null)).isNull();
    }
}
