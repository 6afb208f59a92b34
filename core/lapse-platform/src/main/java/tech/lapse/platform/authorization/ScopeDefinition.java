package tech.lapse.platform.authorization;

/**
 * A delegatable scope with its consent-screen description and display group.
 */
public record ScopeDefinition(String name, String description, String group) {
}
