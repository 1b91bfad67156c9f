package com.sponsorsync.marketplace.store;

import com.sponsorsync.marketplace.integrity.ConstraintViolationException;
import com.sponsorsync.marketplace.model.EntityKind;
import com.sponsorsync.marketplace.model.FieldNames;
import com.sponsorsync.marketplace.model.Row;
import com.sponsorsync.marketplace.schema.EntitySchemas;
import com.sponsorsync.marketplace.schema.FieldSpec;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Reference checking and row ordering shared by the store implementations.
 */
public abstract class AbstractEntityStore implements EntityStore {

    /** Byte order of the 16 id bytes, as PostgreSQL and H2 sort a {@code UUID} column. */
    protected static final Comparator<UUID> ID_ORDER = Comparator
            .<UUID, Long>comparing(UUID::getMostSignificantBits, Long::compareUnsigned)
            .thenComparing(UUID::getLeastSignificantBits, Long::compareUnsigned);

    /** Oldest first, ties broken by id; matches {@code ORDER BY created_at, id}. */
    protected static final Comparator<Row> CREATION_ORDER = Comparator
            .comparing((Row row) -> row.get(FieldNames.CREATED_AT, Instant.class),
                    Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Row::id, Comparator.nullsLast(ID_ORDER));

    protected abstract boolean exists(EntityKind kind, UUID id);

    /**
     * @throws ConstraintViolationException naming the first reference field whose target is missing
     */
    protected void requireReferences(EntityKind kind, Row row) {
        for (FieldSpec spec : EntitySchemas.of(kind).references()) {
            UUID target = row.uuid(spec.name()).orElse(null);
            if (target == null) {
                throw new ConstraintViolationException(spec.name(), "must not be null");
            }
            if (!exists(spec.references(), target)) {
                throw new ConstraintViolationException(spec.name(),
                        "references a missing " + spec.references().value());
            }
        }
    }

    protected static boolean matches(Row row, Map<String, Object> criteria) {
        for (Map.Entry<String, Object> criterion : criteria.entrySet()) {
            if (!Objects.equals(row.get(criterion.getKey()), criterion.getValue())) {
                return false;
            }
        }
        return true;
    }
}
