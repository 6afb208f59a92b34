package tech.lapse.platform.serviceclient;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.lapse.platform.audit.ServiceTokenAudit;
import tech.lapse.platform.audit.ServiceTokenAuditRepository;
import tech.lapse.platform.authorization.ScopeCatalog;
import tech.lapse.platform.authorization.Scopes;
import tech.lapse.platform.common.Result;
import tech.lapse.platform.common.api.ApiErrorCode;
import tech.lapse.platform.common.errors.UseCaseError;
import tech.lapse.platform.shared.EntityType;
import tech.lapse.platform.shared.TsidGenerator;
import tech.lapse.platform.user.User;

import java.net.URI;
import java.net.URISyntaxException;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Registration, maintenance and authentication of service clients.
 *
 * <p>Public client ids look like {@code svc_<24 hex>} and secrets like
 * {@code scs_<48 hex>}. Secrets are hashed with {@link ServiceSecretHasher}
 * before they are stored; the plaintext is returned once.
 */
@ApplicationScoped
public class ServiceClientService {

    private static final Logger LOG = Logger.getLogger(ServiceClientService.class);
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final HexFormat HEX = HexFormat.of();

    static final String CLIENT_ID_PREFIX = "svc_";
    static final String CLIENT_SECRET_PREFIX = "scs_";
    static final int NAME_MIN_LENGTH = 2;
    static final int NAME_MAX_LENGTH = 48;
    static final int DESCRIPTION_MAX_LENGTH = 200;
    static final int AUDIT_PAGE_SIZE = 50;

    @Inject
    ServiceClientRepository clientRepo;

    @Inject
    ServiceSecretHasher secretHasher;

    @Inject
    ScopeCatalog scopeCatalog;

    @Inject
    ServiceTokenAuditRepository auditRepo;

    @Inject
    ServiceClientReviewRepository reviewRepo;

    /**
     * Authenticate a client by public id and plaintext secret. Empty for an
     * unknown or revoked client and for a wrong secret.
     */
    public Optional<ServiceClient> authenticate(String clientId, String clientSecret) {
        if (clientId == null || clientId.isEmpty() || clientSecret == null || clientSecret.isEmpty()) {
            return Optional.empty();
        }
        Optional<ServiceClient> client = clientRepo.findActiveByClientId(clientId);
        if (client.isEmpty()) {
            LOG.infof("Client authentication failed: unknown or revoked client_id: %s", clientId);
            return Optional.empty();
        }
        if (!secretHasher.verify(clientSecret, client.get().clientSecretHash)) {
            LOG.warnf("Client authentication failed: invalid secret for client_id: %s", clientId);
            return Optional.empty();
        }
        return client;
    }

    public void touchLastUsed(String id, Instant usedAt) {
        clientRepo.touchLastUsed(id, usedAt);
    }

    public List<ServiceClient> listOwned(String ownerUserId) {
        return clientRepo.findActiveByOwner(ownerUserId);
    }

    /**
     * The most recent token exchanges of one of the owner's clients, newest first.
     */
    public Result<List<ServiceTokenAudit>> recentTokenAudits(String ownerUserId, String id) {
        if (clientRepo.findActiveOwnedBy(id, ownerUserId).isEmpty()) {
            return Result.failure(appNotFound());
        }
        return Result.success(auditRepo.findByServiceClient(id, AUDIT_PAGE_SIZE));
    }

    @Transactional
    public Result<ServiceClientCommands.IssuedSecret> register(String ownerUserId, ServiceClientCommands.Register command) {
        if (command.name() == null || command.homepageUrl() == null
                || command.redirectUris() == null || command.scopes() == null) {
            return Result.failure(new UseCaseError.ValidationError(
                ApiErrorCode.MISSING_PARAMS.name(), "name, homepageUrl, redirectUris and scopes are required."));
        }

        Optional<UseCaseError> nameError = validateName(command.name());
        if (nameError.isPresent()) {
            return Result.failure(nameError.get());
        }
        Optional<UseCaseError> descriptionError = validateDescription(command.description());
        if (descriptionError.isPresent()) {
            return Result.failure(descriptionError.get());
        }

        List<String> scopes = Scopes.normalize(command.scopes());
        Optional<UseCaseError> scopeError = validateScopes(scopes);
        if (scopeError.isPresent()) {
            return Result.failure(scopeError.get());
        }

        List<String> redirectUris = normalizeUris(command.redirectUris());
        Optional<UseCaseError> urlError = validateUrls(command.homepageUrl(), command.iconUrl(), redirectUris);
        if (urlError.isPresent()) {
            return Result.failure(urlError.get());
        }

        String clientSecret = generateSecret();

        ServiceClient client = new ServiceClient();
        client.id = TsidGenerator.generate(EntityType.SERVICE_CLIENT);
        client.clientId = generateClientId();
        client.clientSecretHash = secretHasher.hash(clientSecret);
        client.name = command.name().trim();
        client.description = command.description() != null ? command.description() : "";
        client.homepageUrl = command.homepageUrl();
        client.iconUrl = command.iconUrl();
        client.allowedScopes = scopes;
        client.redirectUris = redirectUris;
        client.trustLevel = TrustLevel.UNTRUSTED;
        client.createdByUserId = ownerUserId;
        clientRepo.persist(client);

        LOG.infof("Service client registered: %s (%s) by user %s", client.clientId, client.id, ownerUserId);
        return Result.success(new ServiceClientCommands.IssuedSecret(client, clientSecret));
    }

    @Transactional
    public Result<ServiceClient> update(String ownerUserId, String id, ServiceClientCommands.Update command) {
        Optional<ServiceClient> existing = clientRepo.findActiveOwnedBy(id, ownerUserId);
        if (existing.isEmpty()) {
            return Result.failure(appNotFound());
        }
        ServiceClient client = existing.get();

        if (command.name() != null) {
            Optional<UseCaseError> nameError = validateName(command.name());
            if (nameError.isPresent()) {
                return Result.failure(nameError.get());
            }
        }
        Optional<UseCaseError> descriptionError = validateDescription(command.description());
        if (descriptionError.isPresent()) {
            return Result.failure(descriptionError.get());
        }

        List<String> scopes = client.allowedScopes;
        if (command.scopes() != null) {
            scopes = Scopes.normalize(command.scopes());
            Optional<UseCaseError> scopeError = validateScopes(scopes);
            if (scopeError.isPresent()) {
                return Result.failure(scopeError.get());
            }
        }

        String homepageUrl = command.homepageUrl() != null ? command.homepageUrl() : client.homepageUrl;
        String iconUrl = command.iconUrl() != null ? command.iconUrl() : client.iconUrl;
        List<String> redirectUris = command.redirectUris() != null
            ? normalizeUris(command.redirectUris())
            : client.redirectUris;
        Optional<UseCaseError> urlError = validateUrls(homepageUrl, iconUrl, redirectUris);
        if (urlError.isPresent()) {
            return Result.failure(urlError.get());
        }

        if (command.name() != null) {
            client.name = command.name().trim();
        }
        if (command.description() != null) {
            client.description = command.description();
        }
        client.homepageUrl = homepageUrl;
        client.iconUrl = iconUrl;
        client.redirectUris = redirectUris;
        client.allowedScopes = scopes;
        clientRepo.update(client);

        LOG.infof("Service client updated: %s", client.clientId);
        return Result.success(client);
    }

    /**
     * Replace the secret. The previous secret stops working as soon as the
     * transaction commits.
     */
    @Transactional
    public Result<ServiceClientCommands.IssuedSecret> rotateSecret(String ownerUserId, String id) {
        Optional<ServiceClient> existing = clientRepo.findActiveOwnedBy(id, ownerUserId);
        if (existing.isEmpty()) {
            return Result.failure(appNotFound());
        }
        ServiceClient client = existing.get();
        String clientSecret = generateSecret();
        client.clientSecretHash = secretHasher.hash(clientSecret);
        clientRepo.update(client);

        LOG.infof("Service client secret rotated: %s", client.clientId);
        return Result.success(new ServiceClientCommands.IssuedSecret(client, clientSecret));
    }

    @Transactional
    public Result<ServiceClient> revoke(String ownerUserId, String id) {
        Optional<ServiceClient> existing = clientRepo.findActiveOwnedBy(id, ownerUserId);
        if (existing.isEmpty()) {
            return Result.failure(appNotFound());
        }
        ServiceClient client = existing.get();
        client.revokedAt = Instant.now();
        clientRepo.update(client);

        LOG.infof("Service client revoked: %s", client.clientId);
        return Result.success(client);
    }

    /**
     * Set a client's trust level and append the review that records it.
     * Only admins may review; any active client may be reviewed, whoever owns it.
     */
    @Transactional
    public Result<ServiceClient> review(User reviewer, String id, ServiceClientCommands.Review command) {
        if (!reviewer.isAdmin()) {
            LOG.warnf("User %s attempted to review service client %s without admin access", reviewer.id, id);
            return Result.failure(new UseCaseError.AuthorizationError(
                ApiErrorCode.NO_PERMISSION.name(), "Admin access required."));
        }
        TrustLevel trustLevel = parseTrustLevel(command.trustLevel());
        if (trustLevel == null) {
            return Result.failure(invalid("Invalid update payload."));
        }
        Optional<ServiceClient> existing = clientRepo.findActiveById(id);
        if (existing.isEmpty()) {
            return Result.failure(appNotFound());
        }
        ServiceClient client = existing.get();
        client.trustLevel = trustLevel;
        clientRepo.update(client);

        reviewRepo.append(ServiceClientReview.builder()
            .serviceClientId(client.id)
            .reviewedByUserId(reviewer.id)
            .status(trustLevel)
            .notes(command.notes() != null ? command.notes() : "")
            .createdAt(Instant.now())
            .build());

        LOG.infof("Service client %s marked %s by user %s", client.clientId, trustLevel, reviewer.id);
        return Result.success(client);
    }

    private static TrustLevel parseTrustLevel(String value) {
        if (value == null) {
            return null;
        }
        for (TrustLevel level : TrustLevel.values()) {
            if (level.name().equals(value)) {
                return level;
            }
        }
        return null;
    }

    private Optional<UseCaseError> validateName(String name) {
        String trimmed = name.trim();
        if (trimmed.length() < NAME_MIN_LENGTH || trimmed.length() > NAME_MAX_LENGTH) {
            return Optional.of(invalid("Name must be between " + NAME_MIN_LENGTH + " and " + NAME_MAX_LENGTH + " characters."));
        }
        return Optional.empty();
    }

    private Optional<UseCaseError> validateDescription(String description) {
        if (description != null && description.length() > DESCRIPTION_MAX_LENGTH) {
            return Optional.of(invalid("Description must be at most " + DESCRIPTION_MAX_LENGTH + " characters."));
        }
        return Optional.empty();
    }

    private Optional<UseCaseError> validateScopes(List<String> scopes) {
        if (scopes.isEmpty()) {
            return Optional.of(invalid("At least one scope is required."));
        }
        List<String> unknown = scopeCatalog.unknown(scopes);
        if (!unknown.isEmpty()) {
            return Optional.of(invalid("Unknown scopes: " + String.join(", ", unknown)));
        }
        if (Scopes.hasDuplicates(scopes)) {
            return Optional.of(invalid("Duplicate scopes are not allowed."));
        }
        return Optional.empty();
    }

    private Optional<UseCaseError> validateUrls(String homepageUrl, String iconUrl, List<String> redirectUris) {
        Optional<String> homepageHost = httpHost(homepageUrl);
        if (homepageHost.isEmpty()) {
            return Optional.of(invalid("homepageUrl must be an absolute http(s) URL."));
        }
        if (iconUrl != null && !iconUrl.isEmpty() && httpHost(iconUrl).isEmpty()) {
            return Optional.of(invalid("iconUrl must be an absolute http(s) URL."));
        }
        if (redirectUris.isEmpty()) {
            return Optional.of(invalid("At least one redirect URI is required."));
        }
        for (String redirectUri : redirectUris) {
            Optional<String> host = httpHost(redirectUri);
            if (host.isEmpty()) {
                return Optional.of(invalid("Redirect URIs must be absolute http(s) URLs."));
            }
            if (hasFragment(redirectUri)) {
                return Optional.of(invalid("Redirect URIs must not contain a fragment."));
            }
            if (!host.get().equals(homepageHost.get())) {
                return Optional.of(invalid("Redirect URIs must match the homepage domain."));
            }
        }
        return Optional.empty();
    }

    private static List<String> normalizeUris(List<String> uris) {
        return uris.stream()
            .filter(uri -> uri != null && !uri.isBlank())
            .map(String::trim)
            .toList();
    }

    private static boolean hasFragment(String url) {
        try {
            return new URI(url).getRawFragment() != null;
        } catch (URISyntaxException e) {
            return true;
        }
    }

    private static Optional<String> httpHost(String url) {
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            if (scheme == null || uri.getHost() == null) {
                return Optional.empty();
            }
            String lower = scheme.toLowerCase(Locale.ROOT);
            if (!lower.equals("http") && !lower.equals("https")) {
                return Optional.empty();
            }
            return Optional.of(uri.getHost().toLowerCase(Locale.ROOT));
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
    }

    private static UseCaseError invalid(String message) {
        return new UseCaseError.ValidationError(ApiErrorCode.ERROR.name(), message);
    }

    private static UseCaseError appNotFound() {
        return new UseCaseError.NotFoundError(ApiErrorCode.NOT_FOUND.name(), "App not found.");
    }

    static String generateClientId() {
        return CLIENT_ID_PREFIX + randomHex(12);
    }

    static String generateSecret() {
        return CLIENT_SECRET_PREFIX + randomHex(24);
    }

    private static String randomHex(int bytes) {
        byte[] buffer = new byte[bytes];
        SECURE_RANDOM.nextBytes(buffer);
        return HEX.formatHex(buffer);
    }
}
