package tech.lapse.platform.serviceclient;

import java.util.List;

/**
 * Inputs and outputs of the developer-facing service client operations.
 */
public final class ServiceClientCommands {

    private ServiceClientCommands() {
    }

    public record Register(
        String name,
        String description,
        String homepageUrl,
        String iconUrl,
        List<String> redirectUris,
        List<String> scopes
    ) {}

    /**
     * Partial update; null fields are left unchanged.
     */
    public record Update(
        String name,
        String description,
        String homepageUrl,
        String iconUrl,
        List<String> redirectUris,
        List<String> scopes
    ) {}

    /**
     * Admin trust decision; {@code trustLevel} is a {@link TrustLevel} name.
     */
    public record Review(
        String trustLevel,
        String notes
    ) {}

    /**
     * A client together with its plaintext secret. Only produced at
     * registration and rotation.
     */
    public record IssuedSecret(ServiceClient client, String clientSecret) {}
}
