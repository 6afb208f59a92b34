package tech.lapse.platform.test;

import tech.lapse.platform.authentication.AuthContext;
import tech.lapse.platform.grant.ServiceGrant;
import tech.lapse.platform.serviceclient.ServiceClient;
import tech.lapse.platform.serviceclient.TrustLevel;
import tech.lapse.platform.user.User;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Domain objects shared by the unit tests.
 */
public final class Fixtures {

    public static final String USER_ID = "usr-0001";
    public static final String CLIENT_PK = "scl_0HZTEST00001";
    public static final String CLIENT_ID = "svc_0123456789abcdef01234567";
    public static final String REDIRECT_URI = "https://app.example.com/callback";

    private Fixtures() {
    }

    public static User user() {
        return new User(USER_ID, "ada@example.com");
    }

    public static ServiceClient client(String... allowedScopes) {
        ServiceClient client = new ServiceClient();
        client.id = CLIENT_PK;
        client.clientId = CLIENT_ID;
        client.clientSecretHash = "00:00";
        client.name = "Example App";
        client.description = "";
        client.homepageUrl = "https://app.example.com";
        client.allowedScopes = new ArrayList<>(List.of(allowedScopes));
        client.redirectUris = new ArrayList<>(List.of(REDIRECT_URI));
        client.trustLevel = TrustLevel.UNTRUSTED;
        client.createdByUserId = USER_ID;
        client.createdAt = Instant.parse("2025-01-01T00:00:00Z");
        client.updatedAt = client.createdAt;
        return client;
    }

    public static ServiceGrant grant(String... scopes) {
        ServiceGrant grant = new ServiceGrant();
        grant.id = "sgr_0HZTEST00001";
        grant.serviceClientId = CLIENT_PK;
        grant.userId = USER_ID;
        grant.scopes = new ArrayList<>(List.of(scopes));
        grant.createdAt = Instant.parse("2025-01-02T00:00:00Z");
        grant.updatedAt = grant.createdAt;
        return grant;
    }

    public static AuthContext primaryAuth() {
        return AuthContext.primary(user());
    }

    public static AuthContext delegatedAuth(String... scopes) {
        return AuthContext.delegated(user(), client(scopes), List.of(scopes));
    }
}
