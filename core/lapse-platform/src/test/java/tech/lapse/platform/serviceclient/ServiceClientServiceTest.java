package tech.lapse.platform.serviceclient;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.lapse.platform.audit.ServiceTokenAudit;
import tech.lapse.platform.audit.ServiceTokenAuditRepository;
import tech.lapse.platform.authorization.ScopeCatalog;
import tech.lapse.platform.common.Result;
import tech.lapse.platform.common.errors.UseCaseError;
import tech.lapse.platform.test.Fixtures;
import tech.lapse.platform.user.PermissionLevel;
import tech.lapse.platform.user.User;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ServiceClientService.
 */
@ExtendWith(MockitoExtension.class)
class ServiceClientServiceTest {

    @Mock
    private ServiceClientRepository clientRepo;

    @Mock
    private ServiceSecretHasher secretHasher;

    @Mock
    private ServiceTokenAuditRepository auditRepo;

    @Mock
    private ServiceClientReviewRepository reviewRepo;

    @InjectMocks
    private ServiceClientService service;

    @BeforeEach
    void setUp() {
        service.scopeCatalog = ScopeCatalog.defaults();
    }

    // ========================================
    // AUTHENTICATION
    // ========================================

    @Test
    @DisplayName("authenticate should return the client when the secret matches")
    void authenticate_shouldReturnClient_whenSecretMatches() {
        ServiceClient client = Fixtures.client("user:read");
        when(clientRepo.findActiveByClientId(Fixtures.CLIENT_ID)).thenReturn(Optional.of(client));
        when(secretHasher.verify("scs_ok", client.clientSecretHash)).thenReturn(true);

        assertThat(service.authenticate(Fixtures.CLIENT_ID, "scs_ok")).contains(client);
    }

    @Test
    @DisplayName("authenticate should fail for a wrong secret or an unknown client")
    void authenticate_shouldFail_whenSecretWrongOrClientUnknown() {
        ServiceClient client = Fixtures.client("user:read");
        when(clientRepo.findActiveByClientId(Fixtures.CLIENT_ID)).thenReturn(Optional.of(client));
        when(clientRepo.findActiveByClientId("svc_unknown")).thenReturn(Optional.empty());
        when(secretHasher.verify("scs_bad", client.clientSecretHash)).thenReturn(false);

        assertThat(service.authenticate(Fixtures.CLIENT_ID, "scs_bad")).isEmpty();
        assertThat(service.authenticate("svc_unknown", "scs_bad")).isEmpty();
        assertThat(service.authenticate(Fixtures.CLIENT_ID, "")).isEmpty();
    }

    // ========================================
    // REGISTRATION
    // ========================================

    @Test
    @DisplayName("register should persist a hashed secret and return the plaintext once")
    void register_shouldPersistHashedSecret() {
        when(secretHasher.hash(anyString())).thenReturn("salt:key");

        Result<ServiceClientCommands.IssuedSecret> result = service.register(Fixtures.USER_ID, register(
            "My App", List.of("https://app.example.com/cb"), List.of("user:read", " timelapse:read ")));

        ServiceClientCommands.IssuedSecret issued = ((Result.Success<ServiceClientCommands.IssuedSecret>) result).value();
        assertThat(issued.clientSecret()).matches("scs_[0-9a-f]{48}");
        assertThat(issued.client().clientId).matches("svc_[0-9a-f]{24}");
        assertThat(issued.client().id).startsWith("scl_");

        ArgumentCaptor<ServiceClient> saved = ArgumentCaptor.forClass(ServiceClient.class);
        verify(clientRepo).persist(saved.capture());
        assertThat(saved.getValue().clientSecretHash).isEqualTo("salt:key");
        assertThat(saved.getValue().allowedScopes).containsExactly("user:read", "timelapse:read");
        assertThat(saved.getValue().trustLevel).isEqualTo(TrustLevel.UNTRUSTED);
        assertThat(saved.getValue().createdByUserId).isEqualTo(Fixtures.USER_ID);
        verify(secretHasher).hash(issued.clientSecret());
    }

    @Test
    @DisplayName("register should reject redirect URIs on another host than the homepage")
    void register_shouldRejectForeignRedirectHost() {
        Result<ServiceClientCommands.IssuedSecret> result = service.register(Fixtures.USER_ID, register(
            "My App", List.of("https://evil.example.net/cb"), List.of("user:read")));

        assertThat(error(result).message()).isEqualTo("Redirect URIs must match the homepage domain.");
        verifyNoInteractions(clientRepo);
    }

    @Test
    @DisplayName("register should validate name, scopes and redirect URIs")
    void register_shouldValidateInput() {
        assertThat(error(service.register(Fixtures.USER_ID,
            register("A", List.of("https://app.example.com/cb"), List.of("user:read")))).message())
            .startsWith("Name must be between");
        assertThat(error(service.register(Fixtures.USER_ID,
            register("My App", List.of("https://app.example.com/cb"), List.of("global:read")))).message())
            .isEqualTo("Unknown scopes: global:read");
        assertThat(error(service.register(Fixtures.USER_ID,
            register("My App", List.of("https://app.example.com/cb"), List.of("user:read", "user:read")))).message())
            .isEqualTo("Duplicate scopes are not allowed.");
        assertThat(error(service.register(Fixtures.USER_ID,
            register("My App", List.of("https://app.example.com/cb"), List.of()))).message())
            .isEqualTo("At least one scope is required.");
        assertThat(error(service.register(Fixtures.USER_ID,
            register("My App", List.of(" "), List.of("user:read")))).message())
            .isEqualTo("At least one redirect URI is required.");
        assertThat(error(service.register(Fixtures.USER_ID,
            register("My App", List.of("ftp://app.example.com/cb"), List.of("user:read")))).message())
            .isEqualTo("Redirect URIs must be absolute http(s) URLs.");
    }

    @Test
    @DisplayName("register should reject redirect URIs with a fragment")
    void register_shouldRejectRedirectUriWithFragment() {
        Result<ServiceClientCommands.IssuedSecret> result = service.register(Fixtures.USER_ID, register(
            "My App", List.of("https://app.example.com/cb#section"), List.of("user:read")));

        assertThat(error(result).message()).isEqualTo("Redirect URIs must not contain a fragment.");
        verifyNoInteractions(clientRepo);
    }

    @Test
    @DisplayName("update should reject redirect URIs with a fragment")
    void update_shouldRejectRedirectUriWithFragment() {
        ServiceClient client = Fixtures.client("user:read");
        when(clientRepo.findActiveOwnedBy(Fixtures.CLIENT_PK, Fixtures.USER_ID)).thenReturn(Optional.of(client));

        Result<ServiceClient> result = service.update(Fixtures.USER_ID, Fixtures.CLIENT_PK,
            new ServiceClientCommands.Update(null, null, null, null, List.of("https://app.example.com/cb#"), null));

        assertThat(error(result).message()).isEqualTo("Redirect URIs must not contain a fragment.");
        assertThat(client.redirectUris).containsExactly(Fixtures.REDIRECT_URI);
        verify(clientRepo, never()).update(any());
    }

    @Test
    @DisplayName("register should require the mandatory fields")
    void register_shouldRequireMandatoryFields() {
        Result<ServiceClientCommands.IssuedSecret> result = service.register(Fixtures.USER_ID,
            new ServiceClientCommands.Register(null, null, null, null, null, null));

        assertThat(error(result).code()).isEqualTo("MISSING_PARAMS");
    }

    // ========================================
    // MAINTENANCE
    // ========================================

    @Test
    @DisplayName("rotateSecret should replace the stored hash")
    void rotateSecret_shouldReplaceHash() {
        ServiceClient client = Fixtures.client("user:read");
        when(clientRepo.findActiveOwnedBy(Fixtures.CLIENT_PK, Fixtures.USER_ID)).thenReturn(Optional.of(client));
        when(secretHasher.hash(anyString())).thenReturn("new:hash");

        Result<ServiceClientCommands.IssuedSecret> result = service.rotateSecret(Fixtures.USER_ID, Fixtures.CLIENT_PK);

        assertThat(((Result.Success<ServiceClientCommands.IssuedSecret>) result).value().clientSecret())
            .startsWith("scs_");
        assertThat(client.clientSecretHash).isEqualTo("new:hash");
        verify(clientRepo).update(client);
    }

    @Test
    @DisplayName("revoke should set revokedAt on an owned client")
    void revoke_shouldSetRevokedAt() {
        ServiceClient client = Fixtures.client("user:read");
        when(clientRepo.findActiveOwnedBy(Fixtures.CLIENT_PK, Fixtures.USER_ID)).thenReturn(Optional.of(client));

        Result<ServiceClient> result = service.revoke(Fixtures.USER_ID, Fixtures.CLIENT_PK);

        assertThat(((Result.Success<ServiceClient>) result).value().isRevoked()).isTrue();
        verify(clientRepo).update(client);
    }

    @Test
    @DisplayName("maintenance operations should return not found for clients the user does not own")
    void maintenance_shouldReturnNotFound_whenNotOwned() {
        when(clientRepo.findActiveOwnedBy(Fixtures.CLIENT_PK, "someone-else")).thenReturn(Optional.empty());

        assertThat(UseCaseError.httpStatus(error(service.rotateSecret("someone-else", Fixtures.CLIENT_PK))))
            .isEqualTo(404);
        assertThat(UseCaseError.httpStatus(error(service.revoke("someone-else", Fixtures.CLIENT_PK))))
            .isEqualTo(404);
        assertThat(UseCaseError.httpStatus(error(service.recentTokenAudits("someone-else", Fixtures.CLIENT_PK))))
            .isEqualTo(404);
        verifyNoInteractions(auditRepo);
    }

    @Test
    @DisplayName("update should change only the given fields")
    void update_shouldApplyPartialChanges() {
        ServiceClient client = Fixtures.client("user:read");
        when(clientRepo.findActiveOwnedBy(Fixtures.CLIENT_PK, Fixtures.USER_ID)).thenReturn(Optional.of(client));

        Result<ServiceClient> result = service.update(Fixtures.USER_ID, Fixtures.CLIENT_PK,
            new ServiceClientCommands.Update("Renamed", null, null, null, null, List.of("user:read", "user:write")));

        ServiceClient updated = ((Result.Success<ServiceClient>) result).value();
        assertThat(updated.name).isEqualTo("Renamed");
        assertThat(updated.allowedScopes).containsExactly("user:read", "user:write");
        assertThat(updated.redirectUris).containsExactly(Fixtures.REDIRECT_URI);
        verify(clientRepo).update(client);
    }

    @Test
    @DisplayName("recentTokenAudits should return the audit rows of an owned client")
    void recentTokenAudits_shouldReturnRows() {
        ServiceTokenAudit row = ServiceTokenAudit.builder()
            .id("1")
            .serviceClientId(Fixtures.CLIENT_PK)
            .userId(Fixtures.USER_ID)
            .scope("user:read")
            .build();
        when(clientRepo.findActiveOwnedBy(Fixtures.CLIENT_PK, Fixtures.USER_ID))
            .thenReturn(Optional.of(Fixtures.client("user:read")));
        when(auditRepo.findByServiceClient(Fixtures.CLIENT_PK, ServiceClientService.AUDIT_PAGE_SIZE))
            .thenReturn(List.of(row));

        Result<List<ServiceTokenAudit>> result = service.recentTokenAudits(Fixtures.USER_ID, Fixtures.CLIENT_PK);

        assertThat(((Result.Success<List<ServiceTokenAudit>>) result).value()).containsExactly(row);
    }

    // ========================================
    // ADMIN REVIEW
    // ========================================

    @Test
    @DisplayName("review should set the trust level and append a review record")
    void review_shouldSetTrustLevelAndAppendReview() {
        ServiceClient client = Fixtures.client("user:read");
        when(clientRepo.findActiveById(Fixtures.CLIENT_PK)).thenReturn(Optional.of(client));

        Result<ServiceClient> result = service.review(admin(), Fixtures.CLIENT_PK,
            new ServiceClientCommands.Review("TRUSTED", "Checked the homepage"));

        assertThat(((Result.Success<ServiceClient>) result).value().trustLevel).isEqualTo(TrustLevel.TRUSTED);
        verify(clientRepo).update(client);

        ArgumentCaptor<ServiceClientReview> captor = ArgumentCaptor.forClass(ServiceClientReview.class);
        verify(reviewRepo).append(captor.capture());
        ServiceClientReview review = captor.getValue();
        assertThat(review.serviceClientId()).isEqualTo(Fixtures.CLIENT_PK);
        assertThat(review.reviewedByUserId()).isEqualTo("usr-admin");
        assertThat(review.status()).isEqualTo(TrustLevel.TRUSTED);
        assertThat(review.notes()).isEqualTo("Checked the homepage");
        assertThat(review.createdAt()).isNotNull();
    }

    @Test
    @DisplayName("review should store empty notes when none are given")
    void review_shouldDefaultNotesToEmpty() {
        ServiceClient client = Fixtures.client("user:read");
        client.trustLevel = TrustLevel.TRUSTED;
        when(clientRepo.findActiveById(Fixtures.CLIENT_PK)).thenReturn(Optional.of(client));

        service.review(admin(), Fixtures.CLIENT_PK, new ServiceClientCommands.Review("UNTRUSTED", null));

        assertThat(client.trustLevel).isEqualTo(TrustLevel.UNTRUSTED);
        ArgumentCaptor<ServiceClientReview> captor = ArgumentCaptor.forClass(ServiceClientReview.class);
        verify(reviewRepo).append(captor.capture());
        assertThat(captor.getValue().notes()).isEmpty();
    }

    @Test
    @DisplayName("review should return not found for a revoked or unknown client")
    void review_shouldReturnNotFound_whenClientMissing() {
        when(clientRepo.findActiveById(Fixtures.CLIENT_PK)).thenReturn(Optional.empty());

        Result<ServiceClient> result = service.review(admin(), Fixtures.CLIENT_PK,
            new ServiceClientCommands.Review("TRUSTED", null));

        assertThat(UseCaseError.httpStatus(error(result))).isEqualTo(404);
        assertThat(error(result).message()).isEqualTo("App not found.");
        verifyNoInteractions(reviewRepo);
    }

    @Test
    @DisplayName("review should be forbidden for users without admin access")
    void review_shouldBeForbidden_forPlainUsers() {
        Result<ServiceClient> result = service.review(Fixtures.user(), Fixtures.CLIENT_PK,
            new ServiceClientCommands.Review("TRUSTED", null));

        assertThat(UseCaseError.httpStatus(error(result))).isEqualTo(403);
        assertThat(error(result).message()).isEqualTo("Admin access required.");
        verifyNoInteractions(clientRepo, reviewRepo);
    }

    @Test
    @DisplayName("review should accept root users")
    void review_shouldAcceptRootUsers() {
        ServiceClient client = Fixtures.client("user:read");
        when(clientRepo.findActiveById(Fixtures.CLIENT_PK)).thenReturn(Optional.of(client));
        User root = new User("usr-root", "root@example.com", PermissionLevel.ROOT);

        Result<ServiceClient> result = service.review(root, Fixtures.CLIENT_PK,
            new ServiceClientCommands.Review("TRUSTED", null));

        assertThat(result).isInstanceOf(Result.Success.class);
        verify(reviewRepo).append(any(ServiceClientReview.class));
    }

    @Test
    @DisplayName("review should reject an unknown trust level before any lookup")
    void review_shouldRejectUnknownTrustLevel() {
        Result<ServiceClient> result = service.review(admin(), Fixtures.CLIENT_PK,
            new ServiceClientCommands.Review("trusted", null));

        assertThat(UseCaseError.httpStatus(error(result))).isEqualTo(400);
        assertThat(error(result).message()).isEqualTo("Invalid update payload.");
        verifyNoInteractions(clientRepo, reviewRepo);
    }

    private static User admin() {
        return new User("usr-admin", "admin@example.com", PermissionLevel.ADMIN);
    }

    private static ServiceClientCommands.Register register(String name, List<String> redirectUris, List<String> scopes) {
        return new ServiceClientCommands.Register(name, "Example", "https://app.example.com", null, redirectUris, scopes);
    }

    private static UseCaseError error(Result<?> result) {
        assertThat(result).isInstanceOf(Result.Failure.class);
        return ((Result.Failure<?>) result).error();
    }
}
