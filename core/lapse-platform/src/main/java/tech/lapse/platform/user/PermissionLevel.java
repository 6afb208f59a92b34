package tech.lapse.platform.user;

/**
 * Site-wide permission level of a user.
 */
public enum PermissionLevel {
    USER,
    ADMIN,
    ROOT
}
