package com.sponsorsync.security;

/** Outcome of an authorization check. There is deliberately no "not found" outcome. */
public enum Decision {
    ALLOW,
    DENY;

    public boolean isAllowed() {
        return this == ALLOW;
    }

    public static Decision of(boolean allowed) {
        return allowed ? ALLOW : DENY;
    }
}
