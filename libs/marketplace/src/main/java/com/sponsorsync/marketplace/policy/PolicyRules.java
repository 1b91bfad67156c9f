package com.sponsorsync.marketplace.policy;

import com.sponsorsync.security.AccountRole;

/**
 * The building blocks of the marketplace permission matrix.
 * <p>
 * Creation rules combine a role-eligibility check ({@link #principalHasRole}) with an
 * ownership-binding check ({@link #principalEquals}), so a row can be neither created by the
 * wrong kind of account nor attributed to somebody else.
 */
public final class PolicyRules {

    private PolicyRules() {
        // utility class
    }

    /** Any authenticated principal. Used for the public marketplace listings. */
    public static PolicyRule anyAuthenticated() {
        return (principal, row, lookup) -> true;
    }

    /** The row's field holds the principal's id. */
    public static PolicyRule principalEquals(String field) {
        return (principal, row, lookup) -> row.uuid(field)
                .map(principal::equals)
                .orElse(false);
    }

    /** The principal's own profile exists and carries the given role. */
    public static PolicyRule principalHasRole(AccountRole role) {
        return (principal, row, lookup) -> lookup.roleOf(principal)
                .map(role::equals)
                .orElse(false);
    }

    /** The sponsor offer referenced by the field exists and is owned by the principal. */
    public static PolicyRule ownsReferencedOffer(String field) {
        return (principal, row, lookup) -> row.uuid(field)
                .flatMap(lookup::ownerOfOffer)
                .map(principal::equals)
                .orElse(false);
    }
}
