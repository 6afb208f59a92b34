package tech.lapse.platform.authentication;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.jwt.auth.principal.DefaultJWTParser;
import io.smallrye.jwt.build.Jwt;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.json.JsonString;
import org.eclipse.microprofile.jwt.JsonWebToken;
import org.jboss.logging.Logger;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Issues and verifies primary and delegated tokens.
 *
 * <p>Both kinds are RS256 JWTs signed with the key from {@link JwtKeyService}.
 * Primary tokens carry {@code userId} and {@code email} only and have no
 * audience or issuer. Delegated tokens add {@code actorId} and {@code scopes}
 * and are pinned to {@link #DELEGATED_AUDIENCE} / {@link #DELEGATED_ISSUER}.
 *
 * <p>A token that carries any delegated marker is never accepted as a primary
 * token, so a delegated token cannot be replayed to obtain first-party access.
 */
@ApplicationScoped
public class TokenService {

    private static final Logger LOG = Logger.getLogger(TokenService.class);

    public static final String DELEGATED_AUDIENCE = "lapse-rest";
    public static final String DELEGATED_ISSUER = "lapse";
    public static final Duration PRIMARY_TOKEN_LIFETIME = Duration.ofDays(30);
    public static final long DELEGATED_TOKEN_TTL_SECONDS = 900;

    static final String CLAIM_USER_ID = "userId";
    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_ACTOR_ID = "actorId";
    static final String CLAIM_SCOPES = "scopes";

    @Inject
    JwtKeyService keyService;

    @Inject
    ObjectMapper objectMapper;

    /**
     * Issue a 30-day primary token for a directly authenticated user.
     */
    public String issuePrimary(String userId, String email) {
        Instant now = Instant.now();
        var builder = Jwt.claims()
                .subject(userId)
                .claim(CLAIM_USER_ID, userId);
        if (email != null) {
            builder.claim(CLAIM_EMAIL, email);
        }
        return builder
                .issuedAt(now)
                .expiresAt(now.plus(PRIMARY_TOKEN_LIFETIME))
                .jws()
                .keyId(keyService.getKeyId())
                .sign(keyService.getPrivateKey());
    }

    /**
     * Issue a delegated token. Scopes are written as given; callers validate
     * them against the grant and the catalog first.
     */
    public String issueDelegated(String userId, String email, String actorId, List<String> scopes, long ttlSeconds) {
        Instant now = Instant.now();
        var builder = Jwt.claims()
                .subject(userId)
                .audience(DELEGATED_AUDIENCE)
                .issuer(DELEGATED_ISSUER)
                .claim(CLAIM_USER_ID, userId)
                .claim(CLAIM_ACTOR_ID, actorId)
                .claim(CLAIM_SCOPES, List.copyOf(scopes));
        if (email != null) {
            builder.claim(CLAIM_EMAIL, email);
        }
        return builder
                .issuedAt(now)
                .expiresAt(now.plusSeconds(ttlSeconds))
                .jws()
                .keyId(keyService.getKeyId())
                .sign(keyService.getPrivateKey());
    }

    public TokenVerification<PrimaryToken> verifyPrimary(String token) {
        TokenVerification<JsonWebToken> parsed = parse(token);
        if (parsed instanceof TokenVerification.Invalid<JsonWebToken> invalid) {
            return TokenVerification.invalid(invalid.reason());
        }
        JsonWebToken jwt = ((TokenVerification.Valid<JsonWebToken>) parsed).claims();

        if (hasDelegatedMarkers(jwt)) {
            LOG.debug("Delegated token presented where a primary token is required");
            return TokenVerification.invalid("delegated token is not a primary token");
        }

        String userId = stringClaim(jwt, CLAIM_USER_ID);
        if (userId == null || userId.isBlank()) {
            return TokenVerification.invalid("missing userId claim");
        }
        return TokenVerification.valid(new PrimaryToken(userId, stringClaim(jwt, CLAIM_EMAIL)));
    }

    public TokenVerification<DelegatedToken> verifyDelegated(String token) {
        TokenVerification<JsonWebToken> parsed = parse(token);
        if (parsed instanceof TokenVerification.Invalid<JsonWebToken> invalid) {
            return TokenVerification.invalid(invalid.reason());
        }
        JsonWebToken jwt = ((TokenVerification.Valid<JsonWebToken>) parsed).claims();

        Set<String> audience = jwt.getAudience();
        if (audience == null || !audience.equals(Set.of(DELEGATED_AUDIENCE))) {
            LOG.debugf("Delegated token audience mismatch: %s", audience);
            return TokenVerification.invalid("audience mismatch");
        }
        if (!DELEGATED_ISSUER.equals(jwt.getIssuer())) {
            LOG.debugf("Delegated token issuer mismatch: %s", jwt.getIssuer());
            return TokenVerification.invalid("issuer mismatch");
        }

        String userId = stringClaim(jwt, CLAIM_USER_ID);
        String actorId = stringClaim(jwt, CLAIM_ACTOR_ID);
        if (userId == null || userId.isBlank() || actorId == null || actorId.isBlank()) {
            return TokenVerification.invalid("missing userId or actorId claim");
        }

        List<String> scopes = scopeClaim(jwt);
        if (scopes == null) {
            return TokenVerification.invalid("scopes claim must be an array of strings");
        }
        if (scopes.isEmpty()) {
            return TokenVerification.invalid("scopes claim is empty");
        }
        if (new HashSet<>(scopes).size() != scopes.size()) {
            return TokenVerification.invalid("scopes claim contains duplicates");
        }

        return TokenVerification.valid(new DelegatedToken(userId, stringClaim(jwt, CLAIM_EMAIL), actorId, scopes));
    }

    /**
     * Decode the claims without verifying the signature and report whether the
     * token carries any delegated marker: an {@code actorId}, the delegated
     * audience or the delegated issuer. Used to keep delegated tokens away
     * from code paths that would otherwise fall back to primary verification.
     */
    public boolean looksDelegated(String token) {
        if (token == null) {
            return false;
        }
        String[] parts = token.split("\\.");
        if (parts.length < 2) {
            return false;
        }
        try {
            byte[] json = Base64.getUrlDecoder().decode(parts[1]);
            JsonNode claims = objectMapper.readTree(new String(json, StandardCharsets.UTF_8));
            if (claims == null || !claims.isObject()) {
                return false;
            }
            JsonNode actorId = claims.get(CLAIM_ACTOR_ID);
            if (actorId != null && !actorId.isNull()) {
                return true;
            }
            if (matches(claims.get("aud"), DELEGATED_AUDIENCE)) {
                return true;
            }
            return matches(claims.get("iss"), DELEGATED_ISSUER);
        } catch (Exception e) {
            LOG.debugf("Could not decode token claims: %s", e.getMessage());
            return false;
        }
    }

    private TokenVerification<JsonWebToken> parse(String token) {
        if (token == null || token.isBlank()) {
            return TokenVerification.invalid("missing token");
        }
        try {
            JsonWebToken jwt = new DefaultJWTParser().verify(token, keyService.getPublicKey());

            // The parser allows clock skew; expiry is enforced exactly here
            if (jwt.getExpirationTime() <= Instant.now().getEpochSecond()) {
                LOG.debug("Token expired");
                return TokenVerification.invalid("token expired");
            }
            return TokenVerification.valid(jwt);
        } catch (Exception e) {
            LOG.debugf("Token validation failed: %s", e.getMessage());
            return TokenVerification.invalid("signature or format invalid");
        }
    }

    private boolean hasDelegatedMarkers(JsonWebToken jwt) {
        if (jwt.getClaim(CLAIM_ACTOR_ID) != null) {
            return true;
        }
        Set<String> audience = jwt.getAudience();
        if (audience != null && audience.contains(DELEGATED_AUDIENCE)) {
            return true;
        }
        return DELEGATED_ISSUER.equals(jwt.getIssuer());
    }

    private static boolean matches(JsonNode node, String expected) {
        if (node == null) {
            return false;
        }
        if (node.isTextual()) {
            return expected.equals(node.asText());
        }
        if (node.isArray()) {
            for (JsonNode element : node) {
                if (element.isTextual() && expected.equals(element.asText())) {
                    return true;
                }
            }
        }
        return false;
    }

    private static String stringClaim(JsonWebToken jwt, String name) {
        Object value = jwt.getClaim(name);
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof JsonString js) {
            return js.getString();
        }
        return null;
    }

    /**
     * Scopes trimmed with blanks removed, or null when the claim is missing or
     * holds anything other than strings.
     */
    private static List<String> scopeClaim(JsonWebToken jwt) {
        Object value = jwt.getClaim(CLAIM_SCOPES);
        if (!(value instanceof Collection<?> collection)) {
            return null;
        }
        List<String> scopes = new ArrayList<>(collection.size());
        for (Object element : collection) {
            String scope;
            if (element instanceof JsonString js) {
                scope = js.getString();
            } else if (element instanceof String s) {
                scope = s;
            } else {
                return null;
            }
            String trimmed = scope.trim();
            if (!trimmed.isEmpty()) {
                scopes.add(trimmed);
            }
        }
        return scopes;
    }
}
