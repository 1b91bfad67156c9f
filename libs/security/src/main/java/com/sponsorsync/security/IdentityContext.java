package com.sponsorsync.security;

import java.util.Optional;
import java.util.UUID;

/**
 * The caller of a single request, as established by the external identity provider.
 *
 * <p>Passed explicitly into every policy and store call. Nothing in the platform reads the current
 * principal from ambient or thread-local state.
 *
 * @param principal the authenticated principal identifier, or {@code null} for anonymous requests
 */
public record IdentityContext(UUID principal) {

    private static final IdentityContext ANONYMOUS = new IdentityContext(null);

    /** Context for a request that carried no valid credentials. */
    public static IdentityContext anonymous() {
        return ANONYMOUS;
    }

    /**
     * Context for an authenticated principal.
     *
     * @throws IllegalArgumentException if principal is null
     */
    public static IdentityContext authenticated(UUID principal) {
        if (principal == null) {
            throw new IllegalArgumentException("principal must not be null");
        }
        return new IdentityContext(principal);
    }

    public boolean isAuthenticated() {
        return principal != null;
    }

    public Optional<UUID> principalId() {
        return Optional.ofNullable(principal);
    }
}
