package com.sponsorsync.marketplace.model;

import static com.sponsorsync.marketplace.model.FieldNames.*;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/** Caller-supplied fields for a new {@link SponsorOffer}. */
public record SponsorOfferDraft(UUID profileId, BigDecimal amount, String description) {

    public Map<String, Object> toFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(PROFILE_ID, profileId);
        fields.put(AMOUNT, amount);
        fields.put(DESCRIPTION, description);
        return fields;
    }
}
