package tech.lapse.platform.gateway;

public enum RestMethod {
    GET,
    POST,
    PATCH,
    DELETE
}
