package com.sponsorsync.marketplace.store;

import com.sponsorsync.marketplace.integrity.ConstraintViolationException;
import com.sponsorsync.marketplace.model.EntityKind;
import com.sponsorsync.marketplace.model.FieldNames;
import com.sponsorsync.marketplace.model.Row;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Store backed by one {@link ConcurrentHashMap} per entity kind.
 * <p>
 * Updates run inside {@link ConcurrentHashMap#compute}, which holds the row's bin for the
 * duration of the mutation. Rows are never removed, so a reference checked before an insert
 * stays valid.
 */
public class InMemoryEntityStore extends AbstractEntityStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEntityStore.class);

    private final Map<EntityKind, ConcurrentHashMap<UUID, Row>> tables = new EnumMap<>(EntityKind.class);

    public InMemoryEntityStore() {
        for (EntityKind kind : EntityKind.values()) {
            tables.put(kind, new ConcurrentHashMap<>());
        }
    }

    @Override
    public Optional<Row> get(EntityKind kind, UUID id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tables.get(kind).get(id));
    }

    @Override
    public List<Row> list(EntityKind kind, Map<String, Object> criteria) {
        return tables.get(kind).values().stream()
                .filter(row -> matches(row, criteria))
                .sorted(CREATION_ORDER)
                .toList();
    }

    @Override
    public Row insert(EntityKind kind, Row row) {
        UUID id = row.id();
        if (id == null) {
            throw new ConstraintViolationException(FieldNames.ID, "must not be null");
        }
        requireReferences(kind, row);
        if (tables.get(kind).putIfAbsent(id, row) != null) {
            throw new ConstraintViolationException(FieldNames.ID, "already exists");
        }
        log.debug("Inserted {} {}", kind.value(), id);
        return row;
    }

    @Override
    public Row update(EntityKind kind, UUID id, UnaryOperator<Row> mutation) {
        if (id == null) {
            throw new EntityNotFoundException(kind, null);
        }
        Row updated = tables.get(kind).compute(id, (key, current) -> {
            if (current == null) {
                throw new EntityNotFoundException(kind, id);
            }
            Row next = Objects.requireNonNull(mutation.apply(current), "mutation result");
            requireReferences(kind, next);
            return next;
        });
        log.debug("Updated {} {}", kind.value(), id);
        return updated;
    }

    @Override
    protected boolean exists(EntityKind kind, UUID id) {
        return tables.get(kind).containsKey(id);
    }
}
