package com.sponsorsync.marketplace.access;

import com.sponsorsync.marketplace.integrity.ConstraintViolationException;
import com.sponsorsync.marketplace.integrity.IntegrityEnforcer;
import com.sponsorsync.marketplace.model.EntityKind;
import com.sponsorsync.marketplace.model.FieldNames;
import com.sponsorsync.marketplace.model.Row;
import com.sponsorsync.marketplace.policy.PolicyEngine;
import com.sponsorsync.marketplace.store.EntityNotFoundException;
import com.sponsorsync.marketplace.store.EntityStore;
import com.sponsorsync.security.IdentityContext;
import com.sponsorsync.security.Operation;
import com.sponsorsync.security.PermissionDeniedException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authorize-then-act over the entity store, for every entity kind.
 * <p>
 * Every call takes the caller's {@link IdentityContext} explicitly. The policy engine runs before
 * the store is written; the integrity enforcer runs after the allow decision, as part of the
 * write. Updates re-check the policy inside the store's row mutation, so ownership cannot change
 * between the check and the write.
 */
public class MarketplaceAccess {

    private static final Logger log = LoggerFactory.getLogger(MarketplaceAccess.class);

    private final EntityStore store;
    private final PolicyEngine policy;
    private final IntegrityEnforcer integrity;

    public MarketplaceAccess(EntityStore store, PolicyEngine policy, IntegrityEnforcer integrity) {
        this.store = Objects.requireNonNull(store, "store");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.integrity = Objects.requireNonNull(integrity, "integrity");
    }

    /**
     * @throws PermissionDeniedException if the caller is anonymous or may not read the row
     * @throws EntityNotFoundException   if no row has the id
     */
    public Row get(IdentityContext identity, EntityKind kind, UUID id) {
        rejectAnonymous(identity, kind, Operation.READ);
        Row row = store.get(kind, id).orElseThrow(() -> new EntityNotFoundException(kind, id));
        policy.enforce(identity, kind, Operation.READ, row);
        return row;
    }

    /**
     * Rows matching the equality filter that the caller may read. Rows the read rule rejects are
     * left out rather than failing the whole call.
     *
     * @throws PermissionDeniedException    if the caller is anonymous
     * @throws ConstraintViolationException if the filter names an unknown field or a bad value
     */
    public List<Row> list(IdentityContext identity, EntityKind kind, Map<String, ?> filter) {
        rejectAnonymous(identity, kind, Operation.READ);
        Map<String, Object> criteria = integrity.coerceFilter(kind, filter);
        return store.list(kind, criteria).stream()
                .filter(row -> policy.authorize(identity, kind, Operation.READ, row).isAllowed())
                .toList();
    }

    /**
     * Authorizes the candidate fields, completes them (id, timestamps, typed values) and inserts.
     *
     * @throws PermissionDeniedException    if the create rule denies
     * @throws ConstraintViolationException if the fields break an integrity rule
     */
    public Row create(IdentityContext identity, EntityKind kind, Map<String, ?> fields) {
        policy.enforce(identity, kind, Operation.CREATE, Row.of(fields));
        Row prepared = integrity.prepareInsert(kind, fields);
        Row stored = store.insert(kind, prepared);
        log.info("Created {} {} for principal {}", kind.value(), stored.id(), identity.principal());
        return stored;
    }

    /**
     * Applies a patch. The update rule must allow both the current row and the patched row, so an
     * owner cannot hand the row over to another principal.
     *
     * @throws PermissionDeniedException    if the update rule denies either row
     * @throws EntityNotFoundException      if no row has the id
     * @throws ConstraintViolationException if the patch breaks an integrity rule
     */
    public Row update(IdentityContext identity, EntityKind kind, UUID id, Map<String, ?> patch) {
        rejectAnonymous(identity, kind, Operation.UPDATE);
        if (!policy.supports(kind, Operation.UPDATE)) {
            policy.enforce(identity, kind, Operation.UPDATE, Row.empty());
        }
        Row updated = store.update(kind, id, current -> {
            policy.enforce(identity, kind, Operation.UPDATE, current);
            Row next = integrity.prepareUpdate(kind, current, patch);
            policy.enforce(identity, kind, Operation.UPDATE, next);
            return next;
        });
        log.info("Updated {} {} for principal {}", kind.value(), id, identity.principal());
        return updated;
    }

    /**
     * No kind has a delete rule, so this always fails with a permission error.
     *
     * @throws PermissionDeniedException     if the delete rule denies
     * @throws UnsupportedOperationException if a delete rule exists; row removal is not implemented
     */
    public void delete(IdentityContext identity, EntityKind kind, UUID id) {
        Row target = id == null ? Row.empty() : Row.of(Map.of(FieldNames.ID, id));
        policy.enforce(identity, kind, Operation.DELETE, target);
        throw new UnsupportedOperationException("Deleting " + kind.value() + " rows is not implemented");
    }

    private static void rejectAnonymous(IdentityContext identity, EntityKind kind, Operation operation) {
        if (!identity.isAuthenticated()) {
            throw new PermissionDeniedException(kind.value(), operation);
        }
    }
}
