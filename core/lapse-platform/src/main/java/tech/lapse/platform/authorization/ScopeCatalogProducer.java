package tech.lapse.platform.authorization;

import io.quarkus.runtime.Startup;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

/**
 * Produces the application-wide {@link ScopeCatalog}.
 */
@ApplicationScoped
public class ScopeCatalogProducer {

    private static final Logger LOG = Logger.getLogger(ScopeCatalogProducer.class);

    @Produces
    @Singleton
    @Startup
    ScopeCatalog scopeCatalog() {
        ScopeCatalog catalog = ScopeCatalog.defaults();
        LOG.infof("Scope catalog initialized with %d scopes", catalog.names().size());
        return catalog;
    }
}
