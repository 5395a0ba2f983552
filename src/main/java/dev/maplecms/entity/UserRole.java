package dev.maplecms.entity;

/**
 * Role values for users, ordered from most to least privileged.
 * Entity fields remain as String for R2DBC compatibility.
 */
public enum UserRole {
    ADMIN(3),
    EDITOR(2),
    AUTHOR(1),
    VIEWER(0);

    private final int level;

    UserRole(int level) {
        this.level = level;
    }

    /**
     * Check if the given role string matches this enum value.
     */
    public boolean matches(String role) {
        return this.name().equals(role);
    }

    /**
     * True when {@code role} grants at least the privileges of this role.
     */
    public boolean isSatisfiedBy(String role) {
        UserRole other = fromString(role);
        return other != null && other.level >= this.level;
    }

    public static UserRole fromString(String role) {
        if (role == null) {
            return null;
        }
        try {
            return UserRole.valueOf(role.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
