package tech.lapse.platform.authorization;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable catalog of the scopes a service client may request.
 *
 * Built once at startup by {@link ScopeCatalogProducer} and injected where
 * scopes are validated. Iteration order is registration order, which is also
 * the order the consent screen lists them in.
 */
public final class ScopeCatalog {

    public static final String GROUP_TIMELAPSES = "Timelapses";
    public static final String GROUP_COMMENTS = "Comments";
    public static final String GROUP_PROFILE = "Profile";

    private final Map<String, ScopeDefinition> scopes;

    private ScopeCatalog(Map<String, ScopeDefinition> scopes) {
        this.scopes = Collections.unmodifiableMap(scopes);
    }

    /**
     * The scopes of the Lapse REST surface.
     */
    public static ScopeCatalog defaults() {
        return builder()
            .scope("timelapse:read", "View your timelapses", GROUP_TIMELAPSES)
            .scope("timelapse:write", "Create and update timelapses", GROUP_TIMELAPSES)
            .scope("snapshot:read", "View timelapse snapshots", GROUP_TIMELAPSES)
            .scope("snapshot:write", "Delete timelapse snapshots", GROUP_TIMELAPSES)
            .scope("comment:write", "Create and delete comments", GROUP_COMMENTS)
            .scope("user:read", "Read your profile", GROUP_PROFILE)
            .scope("user:write", "Update your profile", GROUP_PROFILE)
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean contains(String scope) {
        return scopes.containsKey(scope);
    }

    public Optional<ScopeDefinition> find(String scope) {
        return Optional.ofNullable(scopes.get(scope));
    }

    /**
     * Scopes from the given collection that the catalog does not know, in input order.
     */
    public List<String> unknown(Collection<String> requested) {
        return requested.stream()
            .filter(scope -> !scopes.containsKey(scope))
            .toList();
    }

    public List<String> names() {
        return List.copyOf(scopes.keySet());
    }

    public List<ScopeDefinition> definitions() {
        return List.copyOf(scopes.values());
    }

    /**
     * Definitions for the given scope names, skipping names the catalog does not know.
     */
    public List<ScopeDefinition> describe(Collection<String> names) {
        List<ScopeDefinition> result = new ArrayList<>();
        for (String name : names) {
            ScopeDefinition definition = scopes.get(name);
            if (definition != null) {
                result.add(definition);
            }
        }
        return result;
    }

    public static final class Builder {

        private final Map<String, ScopeDefinition> scopes = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder scope(String name, String description, String group) {
            if (scopes.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate scope: " + name);
            }
            scopes.put(name, new ScopeDefinition(name, description, group));
            return this;
        }

        public ScopeCatalog build() {
            return new ScopeCatalog(new LinkedHashMap<>(scopes));
        }
    }
}
