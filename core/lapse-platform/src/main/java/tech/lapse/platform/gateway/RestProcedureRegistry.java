package tech.lapse.platform.gateway;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Any;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Index of the {@link RestProcedure} beans by router and procedure name.
 */
@ApplicationScoped
public class RestProcedureRegistry {

    private static final Logger LOG = Logger.getLogger(RestProcedureRegistry.class);

    @Inject
    @Any
    Instance<RestProcedure> procedures;

    private final Map<String, RestProcedure> byKey = new HashMap<>();

    @PostConstruct
    void init() {
        for (RestProcedure procedure : procedures) {
            register(procedure);
        }
        LOG.infof("Registered %d REST procedure implementations", byKey.size());
    }

    void register(RestProcedure procedure) {
        String key = DefaultRestProcedureCatalog.key(procedure.router(), procedure.procedure());
        RestProcedure previous = byKey.put(key, procedure);
        if (previous != null) {
            throw new IllegalStateException("Duplicate REST procedure implementation: " + key);
        }
    }

    public Optional<RestProcedure> find(String router, String procedure) {
        return Optional.ofNullable(byKey.get(DefaultRestProcedureCatalog.key(router, procedure)));
    }
}
