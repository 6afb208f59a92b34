package tech.lapse.platform.gateway;

import tech.lapse.platform.common.api.ProtocolError;

/**
 * Status and body produced by the gateway for one call.
 */
public record GatewayResponse(int status, Object body) {

    public static GatewayResponse ok(Object body) {
        return new GatewayResponse(200, body);
    }

    public static GatewayResponse error(int status, String error, String description) {
        return new GatewayResponse(status, new ProtocolError(error, description));
    }

    public boolean isSuccess() {
        return status == 200;
    }
}
