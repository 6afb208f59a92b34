package tech.lapse.platform.authorization;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ScopeCatalogTest {

    private final ScopeCatalog catalog = ScopeCatalog.defaults();

    @Test
    @DisplayName("defaults should contain the seven delegatable scopes in order")
    void defaults_shouldContainDelegatableScopes() {
        assertThat(catalog.names()).containsExactly(
            "timelapse:read", "timelapse:write", "snapshot:read", "snapshot:write",
            "comment:write", "user:read", "user:write");
        assertThat(catalog.contains("global:read")).isFalse();
    }

    @Test
    @DisplayName("find should return description and group")
    void find_shouldReturnDescriptionAndGroup() {
        ScopeDefinition definition = catalog.find("comment:write").orElseThrow();

        assertThat(definition.description()).isEqualTo("Create and delete comments");
        assertThat(definition.group()).isEqualTo(ScopeCatalog.GROUP_COMMENTS);
    }

    @Test
    @DisplayName("unknown should list names missing from the catalog")
    void unknown_shouldListMissingNames() {
        assertThat(catalog.unknown(List.of("user:read", "admin", "global:read")))
            .containsExactly("admin", "global:read");
    }

    @Test
    @DisplayName("describe should skip unknown names and keep input order")
    void describe_shouldSkipUnknownNames() {
        assertThat(catalog.describe(List.of("user:write", "nope", "timelapse:read")))
            .extracting(ScopeDefinition::name)
            .containsExactly("user:write", "timelapse:read");
    }

    @Test
    @DisplayName("builder should reject duplicate scope names")
    void builder_shouldRejectDuplicates() {
        ScopeCatalog.Builder builder = ScopeCatalog.builder().scope("a:read", "A", "A");

        assertThatThrownBy(() -> builder.scope("a:read", "again", "A"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
