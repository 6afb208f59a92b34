package tech.lapse.platform.gateway.procedures;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.enterprise.context.ApplicationScoped;
import tech.lapse.platform.common.api.ApiResult;
import tech.lapse.platform.gateway.ProcedureContext;
import tech.lapse.platform.gateway.RestProcedure;
import tech.lapse.platform.user.User;

import java.util.HashMap;
import java.util.Map;

/**
 * {@code user.myself}: the profile of the calling user, or a null user for
 * anonymous callers.
 */
@ApplicationScoped
public class MyselfProcedure implements RestProcedure {

    @Override
    public String router() {
        return "user";
    }

    @Override
    public String procedure() {
        return "myself";
    }

    @Override
    public Object invoke(ProcedureContext context, JsonNode input) {
        User user = context.user();
        Map<String, Object> data = new HashMap<>();
        data.put("user", user != null ? new UserProfile(user.id, user.email) : null);
        return ApiResult.ok(data);
    }

    public record UserProfile(String id, String email) {}
}
