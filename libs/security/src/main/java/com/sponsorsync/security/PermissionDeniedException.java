package com.sponsorsync.security;

/**
 * Thrown when the policy engine denies an operation.
 * <p>
 * The message names the resource kind and operation only. It never says whether the targeted row
 * exists, so a denial cannot be used to probe for rows the caller may not see.
 */
public class PermissionDeniedException extends RuntimeException {

    private final String resource;
    private final Operation operation;

    public PermissionDeniedException(String resource, Operation operation) {
        super("Permission denied: %s on %s".formatted(operation.value(), resource));
        this.resource = resource;
        this.operation = operation;
    }

    public String resource() {
        return resource;
    }

    public Operation operation() {
        return operation;
    }
}
