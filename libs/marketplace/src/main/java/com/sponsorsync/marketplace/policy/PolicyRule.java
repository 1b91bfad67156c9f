package com.sponsorsync.marketplace.policy;

import com.sponsorsync.marketplace.model.Row;
import java.util.UUID;

/**
 * One cell of the permission matrix: a predicate over the acting principal and a row.
 * <p>
 * The row is the stored row for read and update, and the candidate fields for create. The
 * principal is always authenticated; anonymous callers are rejected before any rule runs.
 */
@FunctionalInterface
public interface PolicyRule {

    boolean permits(UUID principal, Row row, OwnershipLookup lookup);

    /** Both rules must permit. Short-circuits on the first denial. */
    default PolicyRule and(PolicyRule other) {
        return (principal, row, lookup) ->
                permits(principal, row, lookup) && other.permits(principal, row, lookup);
    }
}
