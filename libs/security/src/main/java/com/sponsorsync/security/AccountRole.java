package com.sponsorsync.security;

import java.util.Optional;

/**
 * Account types a profile can hold. The role decides which listings a principal may create.
 * <p>
 * There is no hierarchy: a sponsor is never an organizer and vice versa.
 */
public enum AccountRole {

    SPONSOR("sponsor"),
    ORGANIZER("organizer");

    private final String value;

    AccountRole(String value) {
        this.value = value;
    }

    /** The canonical stored representation (e.g., "sponsor"). */
    public String value() {
        return value;
    }

    /**
     * Looks up a role by its stored value or its constant name, ignoring case.
     *
     * @param value the string to match
     * @return the matching role, or empty if not found
     */
    public static Optional<AccountRole> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.strip();
        for (AccountRole role : values()) {
            if (role.value.equalsIgnoreCase(normalized) || role.name().equalsIgnoreCase(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
