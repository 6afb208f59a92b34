package tech.lapse.platform.grant;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.lapse.platform.authentication.AuthContext;
import tech.lapse.platform.common.Result;
import tech.lapse.platform.common.api.ApiErrorCode;
import tech.lapse.platform.common.errors.UseCaseError;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * User-facing grant management: list and revoke.
 *
 * <p>Revoking a grant stops new token exchanges and consent auto-reissue for
 * that client. Delegated tokens already issued stay valid until they expire.
 */
@ApplicationScoped
public class ServiceGrantService {

    private static final Logger LOG = Logger.getLogger(ServiceGrantService.class);

    @Inject
    ServiceGrantRepository grantRepo;

    public Result<List<GrantSummary>> listActiveGrants(AuthContext auth) {
        if (!auth.isAuthenticated()) {
            return Result.failure(authenticationRequired());
        }
        return Result.success(grantRepo.listActiveByUser(auth.user().id));
    }

    @Transactional
    public Result<ServiceGrant> revoke(AuthContext auth, String grantId) {
        if (!auth.isAuthenticated()) {
            return Result.failure(authenticationRequired());
        }
        if (grantId == null || grantId.isBlank()) {
            return Result.failure(new UseCaseError.ValidationError(
                ApiErrorCode.MISSING_PARAMS.name(), "grantId is required."));
        }

        Optional<ServiceGrant> grant = grantRepo.findByIdAndUser(grantId, auth.user().id);
        if (grant.isEmpty()) {
            return Result.failure(new UseCaseError.NotFoundError(
                ApiErrorCode.NOT_FOUND.name(), "Grant not found."));
        }

        Instant now = Instant.now();
        grantRepo.revoke(grantId, now);
        ServiceGrant revoked = grant.get();
        revoked.revokedAt = now;

        LOG.infof("Grant revoked: %s (client %s, user %s)", grantId, revoked.serviceClientId, revoked.userId);
        return Result.success(revoked);
    }

    private static UseCaseError authenticationRequired() {
        return new UseCaseError.AuthenticationError(ApiErrorCode.NO_PERMISSION.name(), "Authentication required.");
    }
}
