package tech.lapse.platform.gateway;

public enum ProcedureType {
    QUERY,
    MUTATION
}
