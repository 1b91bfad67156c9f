package com.sponsorsync.marketplace.store;

import com.sponsorsync.marketplace.integrity.ConstraintViolationException;
import com.sponsorsync.marketplace.model.EntityKind;
import com.sponsorsync.marketplace.model.FieldNames;
import com.sponsorsync.marketplace.model.Row;
import com.sponsorsync.marketplace.policy.OwnershipLookup;
import com.sponsorsync.security.AccountRole;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Durable storage of the four marketplace entity kinds.
 * <p>
 * The store assumes its caller has already been authorized. It guards referential and key
 * integrity only: every reference must point at an existing row and a primary key can be taken
 * once. Rows passed in are expected to be fully prepared (typed, timestamped, with an id).
 */
public interface EntityStore extends OwnershipLookup {

    Optional<Row> get(EntityKind kind, UUID id);

    /**
     * Rows whose fields equal every entry of {@code criteria}, oldest first. An empty map matches
     * all rows.
     */
    List<Row> list(EntityKind kind, Map<String, Object> criteria);

    /**
     * @return the stored row
     * @throws ConstraintViolationException for a dangling reference or an id that already exists
     */
    Row insert(EntityKind kind, Row row);

    /**
     * Replaces a row with the result of {@code mutation} applied to its current state. No other
     * write to the same row can happen between reading the current state and writing the result.
     * An exception thrown by the mutation aborts the update and leaves the row unchanged.
     *
     * @return the stored row
     * @throws EntityNotFoundException if no row has the id
     * @throws ConstraintViolationException for a dangling reference in the new row
     */
    Row update(EntityKind kind, UUID id, UnaryOperator<Row> mutation);

    @Override
    default Optional<AccountRole> roleOf(UUID profileId) {
        return get(EntityKind.PROFILE, profileId)
                .map(row -> row.get(FieldNames.ROLE, AccountRole.class));
    }

    @Override
    default Optional<UUID> ownerOfOffer(UUID sponsorOfferId) {
        return get(EntityKind.SPONSOR_OFFER, sponsorOfferId)
                .flatMap(row -> row.uuid(FieldNames.PROFILE_ID));
    }
}
