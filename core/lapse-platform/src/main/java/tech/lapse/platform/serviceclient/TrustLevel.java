package tech.lapse.platform.serviceclient;

/**
 * Operator-assigned trust level of a service client. Shown on the consent
 * screen; it does not change what a client may be granted.
 */
public enum TrustLevel {
    UNTRUSTED,
    TRUSTED
}
