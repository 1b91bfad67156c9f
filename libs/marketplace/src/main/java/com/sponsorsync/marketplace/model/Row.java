package com.sponsorsync.marketplace.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * An immutable field-name to value map: a stored row, a candidate row for insert, or the result of
 * applying a patch. Null values are allowed (a nullable column, or a missing candidate field).
 */
public final class Row {

    private static final Row EMPTY = new Row(Map.of());

    private final Map<String, Object> fields;

    private Row(Map<String, Object> fields) {
        this.fields = fields;
    }

    public static Row of(Map<String, ?> fields) {
        if (fields == null || fields.isEmpty()) {
            return EMPTY;
        }
        return new Row(Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
    }

    public static Row empty() {
        return EMPTY;
    }

    public Object get(String field) {
        return fields.get(field);
    }

    /**
     * Returns the field value cast to the given type.
     *
     * @throws ClassCastException if the stored value has another type
     */
    public <T> T get(String field, Class<T> type) {
        return type.cast(fields.get(field));
    }

    /**
     * Reads a field as a UUID, accepting either a {@link UUID} or its string form. Anything else,
     * including an unparseable string, yields empty.
     */
    public Optional<UUID> uuid(String field) {
        Object value = fields.get(field);
        if (value instanceof UUID id) {
            return Optional.of(id);
        }
        if (value instanceof String text) {
            try {
                return Optional.of(UUID.fromString(text.strip()));
            } catch (IllegalArgumentException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /** The row's primary key, or null for a candidate that has none yet. */
    public UUID id() {
        return uuid(FieldNames.ID).orElse(null);
    }

    /** Returns a copy of this row with one field replaced. */
    public Row with(String field, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.put(field, value);
        return new Row(Collections.unmodifiableMap(copy));
    }

    /** Unmodifiable view of all fields. */
    public Map<String, Object> fields() {
        return fields;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Row other && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "Row" + fields;
    }
}
