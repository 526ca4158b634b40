package com.bastion.security;

import java.util.Locale;
import java.util.Optional;

/**
 * Tenant-scoped roles, declared in ascending order of privilege.
 * <p>
 * The hierarchy is total: {@code VIEWER < MEMBER < ADMIN}. Authorization compares positions
 * with {@link #atLeast(Role)} instead of enumerating implied roles, so adding a role means
 * inserting it at the right place in this declaration.
 */
public enum Role {

    VIEWER("viewer"),
    MEMBER("member"),
    ADMIN("admin");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    /** The wire representation used in token claims (e.g. "member"). */
    public String value() {
        return value;
    }

    /**
     * Whether this role is at or above {@code minimum} in the hierarchy.
     */
    public boolean atLeast(Role minimum) {
        return compareTo(minimum) >= 0;
    }

    /**
     * Looks up a role by its wire value, ignoring case and surrounding whitespace.
     *
     * @return the matching role, or empty if the value is null or unknown
     */
    public static Optional<Role> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        for (Role role : values()) {
            if (role.value.equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
