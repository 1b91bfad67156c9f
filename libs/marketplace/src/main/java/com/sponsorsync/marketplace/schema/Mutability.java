package com.sponsorsync.marketplace.schema;

/** How a field may change after the row is created. */
public enum Mutability {
    /** Set on insert and changeable by a patch. */
    MUTABLE,
    /** Set on insert; a patch may repeat the current value but never change it. */
    IMMUTABLE,
    /** Maintained by the integrity enforcer; caller-supplied values are ignored. */
    MANAGED
}
