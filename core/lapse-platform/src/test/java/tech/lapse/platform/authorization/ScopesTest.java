package tech.lapse.platform.authorization;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ScopesTest {

    @Test
    @DisplayName("normalize should trim and drop blanks but keep duplicates")
    void normalize_shouldTrimAndDropBlanks() {
        List<String> result = Scopes.normalize(Arrays.asList(" user:read", "", null, "user:read ", "  "));

        assertThat(result).containsExactly("user:read", "user:read");
        assertThat(Scopes.normalize(null)).isEmpty();
    }

    @Test
    @DisplayName("parseDelimited should split on whitespace and drop repeats")
    void parseDelimited_shouldSplitAndDedupe() {
        assertThat(Scopes.parseDelimited("  timelapse:read \t user:read timelapse:read "))
            .containsExactly("timelapse:read", "user:read");
        assertThat(Scopes.parseDelimited("   ")).isEmpty();
        assertThat(Scopes.parseDelimited(null)).isEmpty();
    }

    @Test
    @DisplayName("intersect and missing should keep requested order")
    void intersectAndMissing_shouldKeepRequestedOrder() {
        List<String> requested = List.of("user:write", "timelapse:read", "user:read");
        List<String> allowed = List.of("user:read", "timelapse:read");

        assertThat(Scopes.intersect(requested, allowed)).containsExactly("timelapse:read", "user:read");
        assertThat(Scopes.missing(requested, allowed)).containsExactly("user:write");
    }

    @Test
    @DisplayName("hasDuplicates should detect repeated entries")
    void hasDuplicates_shouldDetectRepeats() {
        assertThat(Scopes.hasDuplicates(List.of("a", "b", "a"))).isTrue();
        assertThat(Scopes.hasDuplicates(List.of("a", "b"))).isFalse();
    }
}
