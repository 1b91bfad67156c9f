package com.sponsorsync.marketplace.schema;

/** Value types a marketplace field can hold. */
public enum FieldType {
    IDENTIFIER,
    TEXT,
    DECIMAL,
    DATE,
    TIMESTAMP,
    ROLE
}
