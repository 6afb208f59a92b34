package tech.lapse.platform.user;

/**
 * A Lapse user. Owned by the identity subsystem; the delegated access core
 * only reads it.
 */
public class User {

    public String id;

    public String email;

    public PermissionLevel permissionLevel = PermissionLevel.USER;

    public User() {
    }

    public User(String id, String email) {
        this.id = id;
        this.email = email;
    }

    public User(String id, String email, PermissionLevel permissionLevel) {
        this.id = id;
        this.email = email;
        this.permissionLevel = permissionLevel != null ? permissionLevel : PermissionLevel.USER;
    }

    /**
     * Admins and root users may review service clients.
     */
    public boolean isAdmin() {
        return permissionLevel == PermissionLevel.ADMIN || permissionLevel == PermissionLevel.ROOT;
    }
}
