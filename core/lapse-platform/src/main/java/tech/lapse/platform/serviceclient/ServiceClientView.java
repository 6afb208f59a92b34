package tech.lapse.platform.serviceclient;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.List;

/**
 * Public metadata of a service client, as shown on the consent screen and in
 * the developer console. Never includes the secret hash.
 */
@Schema(description = "Service client metadata")
public record ServiceClientView(
    String id,
    String name,
    String clientId,
    List<String> scopes,
    List<String> redirectUris,
    TrustLevel trustLevel,
    String description,
    String homepageUrl,
    String iconUrl
) {

    public static ServiceClientView from(ServiceClient client) {
        return new ServiceClientView(
            client.id,
            client.name,
            client.clientId,
            List.copyOf(client.allowedScopes),
            List.copyOf(client.redirectUris),
            client.trustLevel,
            client.description,
            client.homepageUrl,
            client.iconUrl);
    }
}
