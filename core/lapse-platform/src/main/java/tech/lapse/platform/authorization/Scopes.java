package tech.lapse.platform.authorization;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Helpers for scope lists. Scope lists are ordered; order is kept as given.
 */
public final class Scopes {

    private Scopes() {
    }

    /**
     * Trims every entry and drops blank ones. Duplicates are kept so callers
     * can reject them explicitly.
     */
    public static List<String> normalize(Collection<String> scopes) {
        if (scopes == null) {
            return List.of();
        }
        List<String> result = new ArrayList<>(scopes.size());
        for (String scope : scopes) {
            if (scope == null) {
                continue;
            }
            String trimmed = scope.trim();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return result;
    }

    /**
     * Splits a space-delimited scope string, dropping blanks and repeated
     * entries (first occurrence wins).
     */
    public static List<String> parseDelimited(String scope) {
        if (scope == null || scope.isBlank()) {
            return List.of();
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String part : scope.trim().split("\\s+")) {
            if (!part.isEmpty()) {
                unique.add(part);
            }
        }
        return List.copyOf(unique);
    }

    public static boolean hasDuplicates(Collection<String> scopes) {
        return new HashSet<>(scopes).size() != scopes.size();
    }

    /**
     * Entries of {@code requested} that are also in {@code allowed}, in requested order.
     */
    public static List<String> intersect(Collection<String> requested, Collection<String> allowed) {
        Set<String> allowedSet = new HashSet<>(allowed);
        return requested.stream()
            .filter(allowedSet::contains)
            .toList();
    }

    /**
     * Entries of {@code requested} that are not in {@code allowed}, in requested order.
     */
    public static List<String> missing(Collection<String> requested, Collection<String> allowed) {
        Set<String> allowedSet = new HashSet<>(allowed);
        return requested.stream()
            .filter(scope -> !allowedSet.contains(scope))
            .toList();
    }

    public static String join(Collection<String> scopes) {
        return String.join(" ", scopes);
    }
}
