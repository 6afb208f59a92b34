package tech.lapse.platform.gateway;

import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static tech.lapse.platform.gateway.ProcedureType.MUTATION;
import static tech.lapse.platform.gateway.ProcedureType.QUERY;

/**
 * The REST surface of Lapse. Replace by declaring another
 * {@link RestProcedureCatalog} bean.
 */
@ApplicationScoped
@DefaultBean
public class DefaultRestProcedureCatalog implements RestProcedureCatalog {

    private final Map<String, RestProcedureDefinition> procedures = new LinkedHashMap<>();

    public DefaultRestProcedureCatalog() {
        // timelapse
        register("timelapse", "query", RestMethod.GET, QUERY, "timelapse:read", "Fetch a timelapse by id", false);
        register("timelapse", "createDraft", RestMethod.POST, MUTATION, "timelapse:write", "Create a draft timelapse", true);
        register("timelapse", "commit", RestMethod.POST, MUTATION, "timelapse:write", "Commit a draft timelapse", true);
        register("timelapse", "update", RestMethod.PATCH, MUTATION, "timelapse:write", "Update timelapse metadata", true);
        register("timelapse", "delete", RestMethod.DELETE, MUTATION, "timelapse:write", "Delete a timelapse", true);
        register("timelapse", "publish", RestMethod.POST, MUTATION, "timelapse:write", "Publish a timelapse", true);
        register("timelapse", "findByUser", RestMethod.GET, QUERY, "timelapse:read", "List timelapses by user", false);
        register("timelapse", "syncWithHackatime", RestMethod.POST, MUTATION, "timelapse:write", "Sync timelapse with Hackatime", true);

        // user
        register("user", "myself", RestMethod.GET, QUERY, "user:read", "Get current user", false);
        register("user", "query", RestMethod.GET, QUERY, "user:read", "Fetch user profile", false);
        register("user", "update", RestMethod.PATCH, MUTATION, "user:write", "Update user profile", true);
        register("user", "getDevices", RestMethod.GET, QUERY, "user:read", "List registered devices", true);
        register("user", "registerDevice", RestMethod.POST, MUTATION, "user:write", "Register a new device", true);
        register("user", "removeDevice", RestMethod.DELETE, MUTATION, "user:write", "Remove a device", true);
        register("user", "signOut", RestMethod.POST, MUTATION, null, "Sign out the current user", false);
        register("user", "hackatimeProjects", RestMethod.GET, QUERY, "user:read", "List Hackatime projects", true);
        register("user", "getTotalTimelapseTime", RestMethod.GET, QUERY, "user:read", "Get total timelapse time", false);
        register("user", "emitHeartbeat", RestMethod.POST, MUTATION, "user:write", "Emit user heartbeat", true);

        // snapshot
        register("snapshot", "delete", RestMethod.DELETE, MUTATION, "snapshot:write", "Delete a snapshot", true);
        register("snapshot", "findByTimelapse", RestMethod.GET, QUERY, "snapshot:read", "List snapshots by timelapse", false);

        // comment
        register("comment", "create", RestMethod.POST, MUTATION, "comment:write", "Create a comment", true);
        register("comment", "delete", RestMethod.DELETE, MUTATION, "comment:write", "Delete a comment", true);

        // global; global:read is not delegatable, so service clients cannot call these
        register("global", "weeklyLeaderboard", RestMethod.GET, QUERY, "global:read", "Get weekly leaderboard", false);
        register("global", "recentTimelapses", RestMethod.GET, QUERY, "global:read", "Get recent timelapses", false);
        register("global", "activeUsers", RestMethod.GET, QUERY, "global:read", "Get active users count", false);
    }

    @Override
    public Optional<RestProcedureDefinition> find(String router, String procedure) {
        return Optional.ofNullable(procedures.get(key(router, procedure)));
    }

    @Override
    public List<RestProcedureDefinition> all() {
        return new ArrayList<>(procedures.values());
    }

    private void register(String router, String procedure, RestMethod method, ProcedureType type,
                          String scope, String summary, boolean requiresAuth) {
        procedures.put(key(router, procedure), new RestProcedureDefinition(
            router, procedure, method, type, scope == null ? List.of() : List.of(scope), summary, requiresAuth));
    }

    static String key(String router, String procedure) {
        return router + "." + procedure;
    }
}
