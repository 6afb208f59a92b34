package tech.lapse.platform.user.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.Immutable;
import tech.lapse.platform.user.PermissionLevel;

/**
 * Read-only JPA mapping of the users table.
 */
@Entity
@Immutable
@Table(name = "users")
public class UserEntity {

    @Id
    @Column(name = "id", length = 64)
    public String id;

    @Column(name = "email", nullable = false, length = 320)
    public String email;

    @Enumerated(EnumType.STRING)
    @Column(name = "permission_level", nullable = false, length = 20)
    public PermissionLevel permissionLevel;

    public UserEntity() {
    }
}
