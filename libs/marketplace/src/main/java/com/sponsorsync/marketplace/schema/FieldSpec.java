package com.sponsorsync.marketplace.schema;

import com.sponsorsync.marketplace.model.EntityKind;

/**
 * Declares one field of an entity: its storage column, type and integrity constraints.
 *
 * @param name       field name used by the library (camelCase)
 * @param column     relational column name (snake_case)
 * @param type       value type
 * @param required   whether the value must be non-null
 * @param mutability how the value may change after insert
 * @param positive   whether a numeric value must be strictly greater than zero
 * @param size       maximum characters of a text value or total digits of a decimal value,
 *                   0 when unbounded
 * @param references entity kind this field points to, or null if it is not a foreign key
 */
public record FieldSpec(
        String name,
        String column,
        FieldType type,
        boolean required,
        Mutability mutability,
        boolean positive,
        int size,
        EntityKind references) {

    /** Total digits of a money amount ({@code NUMERIC(14, 2)}). */
    public static final int AMOUNT_PRECISION = 14;

    /** Primary key. */
    public static FieldSpec key(String name) {
        return new FieldSpec(name, "id", FieldType.IDENTIFIER, true, Mutability.IMMUTABLE, false, 0, null);
    }

    /** Required, mutable text of at most {@code maxLength} characters. */
    public static FieldSpec text(String name, String column, int maxLength) {
        return new FieldSpec(name, column, FieldType.TEXT, true, Mutability.MUTABLE, false, maxLength, null);
    }

    /** Nullable, mutable text of at most {@code maxLength} characters. */
    public static FieldSpec optionalText(String name, String column, int maxLength) {
        return new FieldSpec(name, column, FieldType.TEXT, false, Mutability.MUTABLE, false, maxLength, null);
    }

    /** Required money amount, strictly positive. */
    public static FieldSpec amount(String name, String column) {
        return new FieldSpec(name, column, FieldType.DECIMAL, true, Mutability.MUTABLE, true, AMOUNT_PRECISION, null);
    }

    /** Required calendar date. */
    public static FieldSpec date(String name, String column) {
        return new FieldSpec(name, column, FieldType.DATE, true, Mutability.MUTABLE, false, 0, null);
    }

    /** Required account role, fixed once set. */
    public static FieldSpec role(String name, String column) {
        return new FieldSpec(name, column, FieldType.ROLE, true, Mutability.IMMUTABLE, false, 0, null);
    }

    /** Required foreign key to another entity kind. */
    public static FieldSpec reference(String name, String column, EntityKind target) {
        return new FieldSpec(name, column, FieldType.IDENTIFIER, true, Mutability.MUTABLE, false, 0, target);
    }

    /** Timestamp maintained by the integrity enforcer. */
    public static FieldSpec timestamp(String name, String column) {
        return new FieldSpec(name, column, FieldType.TIMESTAMP, true, Mutability.MANAGED, false, 0, null);
    }

    public boolean isBounded() {
        return size > 0;
    }

    public boolean isReference() {
        return references != null;
    }
}
