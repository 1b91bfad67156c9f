package com.sponsorsync.marketplace.model;

import static com.sponsorsync.marketplace.model.FieldNames.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/** Caller-supplied fields for a new {@link SponsorEventType}. */
public record SponsorEventTypeDraft(UUID sponsorOfferId, String eventType) {

    public Map<String, Object> toFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(SPONSOR_OFFER_ID, sponsorOfferId);
        fields.put(EVENT_TYPE, eventType);
        return fields;
    }
}
