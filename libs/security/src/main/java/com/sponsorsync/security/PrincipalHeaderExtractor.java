package com.sponsorsync.security;

import java.util.UUID;

/**
 * Resolves the {@link IdentityContext} from the principal header set by the upstream identity
 * provider (gateway). The header carries the opaque principal UUID and nothing else.
 */
public final class PrincipalHeaderExtractor {

    /** Header carrying the authenticated principal identifier. */
    public static final String PRINCIPAL_HEADER = "X-Principal-Id";

    private PrincipalHeaderExtractor() {
        // utility class
    }

    /**
     * Parses a principal header value.
     *
     * @param headerValue the raw header value (may be null)
     * @return the authenticated context, or anonymous if the header is missing or malformed
     */
    public static IdentityContext extract(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return IdentityContext.anonymous();
        }
        try {
            return IdentityContext.authenticated(UUID.fromString(headerValue.strip()));
        } catch (IllegalArgumentException e) {
            // Not a UUID: treat as unauthenticated
            return IdentityContext.anonymous();
        }
    }
}
