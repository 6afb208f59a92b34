package tech.lapse.platform.shared;

/**
 * Entity types owned by the delegated access core, with their 3-character ID prefixes.
 *
 * IDs are stored with the prefix: "{prefix}_{tsid}" (e.g., "scl_0HZXEQ5Y8JY5Z").
 * Audit rows are append-only and high volume, so they skip the prefix.
 */
public enum EntityType {

    SERVICE_CLIENT("scl"),
    SERVICE_GRANT("sgr"),
    SERVICE_CLIENT_REVIEW("scr"),
    SERVICE_TOKEN_AUDIT("sta", false);

    private final String prefix;
    private final boolean usePrefix;

    EntityType(String prefix) {
        this(prefix, true);
    }

    EntityType(String prefix, boolean usePrefix) {
        this.prefix = prefix;
        this.usePrefix = usePrefix;
    }

    public String prefix() {
        return prefix;
    }

    public boolean usePrefix() {
        return usePrefix;
    }
}
