package tech.lapse.platform.oauth;

/**
 * States of the consent flow. {@code INIT} is the POST that opens the flow;
 * the others are where a request ends up.
 */
public enum ConsentState {
    INIT,
    AUTO_REISSUE,
    AWAITING_DECISION,
    APPROVED,
    DENIED
}
