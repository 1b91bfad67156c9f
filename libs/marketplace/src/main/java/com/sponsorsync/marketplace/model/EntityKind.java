package com.sponsorsync.marketplace.model;

/** The four resource kinds of the marketplace. */
public enum EntityKind {
    PROFILE("profile"),
    EVENT("event"),
    SPONSOR_OFFER("sponsor_offer"),
    SPONSOR_EVENT_TYPE("sponsor_event_type");

    private final String value;

    EntityKind(String value) {
        this.value = value;
    }

    /** Canonical string representation, used in logs, metric tags and error messages. */
    public String value() {
        return value;
    }
}
