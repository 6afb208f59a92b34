package tech.lapse.platform.gateway;

import java.util.List;
import java.util.Optional;

/**
 * Lookup of the procedures exposed under {@code /rest/{router}/{procedure}}.
 */
public interface RestProcedureCatalog {

    Optional<RestProcedureDefinition> find(String router, String procedure);

    List<RestProcedureDefinition> all();
}
