package com.sponsorsync.marketplace.integrity;

/**
 * A data-integrity rule failed: a missing required field, an out-of-range value, an attempted
 * change of an immutable field, a duplicate key or a dangling reference.
 * <p>
 * Always the caller's fault, never transient. Retrying the same input fails the same way.
 */
public class ConstraintViolationException extends RuntimeException {

    private final String field;

    public ConstraintViolationException(String field, String reason) {
        super(field + " " + reason);
        this.field = field;
    }

    public ConstraintViolationException(String field, String reason, Throwable cause) {
        super(field + " " + reason, cause);
        this.field = field;
    }

    /** Name of the offending field. */
    public String field() {
        return field;
    }
}
