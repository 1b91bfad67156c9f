package com.sponsorsync.security;

/** Row operations subject to access control. */
public enum Operation {
    READ("read"),
    CREATE("create"),
    UPDATE("update"),
    DELETE("delete");

    private final String value;

    Operation(String value) {
        this.value = value;
    }

    /** Lower-case name used in logs, metric tags and error messages. */
    public String value() {
        return value;
    }
}
