package com.sponsorsync.marketplace.model;

import static com.sponsorsync.marketplace.model.FieldNames.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/** Caller-supplied fields for a new {@link Event}. */
public record EventDraft(
        String name,
        String type,
        BigDecimal amount,
        String city,
        String description,
        LocalDate date,
        UUID organizerId) {

    public Map<String, Object> toFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(NAME, name);
        fields.put(TYPE, type);
        fields.put(AMOUNT, amount);
        fields.put(CITY, city);
        fields.put(DESCRIPTION, description);
        fields.put(DATE, date);
        fields.put(ORGANIZER_ID, organizerId);
        return fields;
    }
}
