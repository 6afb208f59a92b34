package tech.lapse.platform.shared;

import com.github.f4b6a3.tsid.TsidCreator;

import java.util.Objects;

/**
 * Row id generation. TSIDs are time-sortable 64-bit ids, rendered as
 * 13 Crockford base32 characters and prefixed with the entity type.
 */
public final class TsidGenerator {

    public static final String SEPARATOR = "_";

    private TsidGenerator() {
    }

    /**
     * Generate a new ID for the given entity type, e.g. "sgr_0HZXEQ5Y8JY5Z".
     */
    public static String generate(EntityType type) {
        Objects.requireNonNull(type, "EntityType must not be null");
        String tsid = TsidCreator.getTsid().toString();
        return type.usePrefix() ? type.prefix() + SEPARATOR + tsid : tsid;
    }
}
