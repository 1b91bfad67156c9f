package com.sponsorsync.marketplace.model;

import static com.sponsorsync.marketplace.model.FieldNames.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A sponsorship opportunity published by an organizer.
 *
 * @param id          event id
 * @param name        event name
 * @param type        event type, matched against sponsor event types
 * @param amount      sponsorship amount sought, strictly positive
 * @param city        where the event takes place
 * @param description free-form description
 * @param date        event date
 * @param organizerId owning organizer's profile id
 * @param createdAt   creation time
 * @param updatedAt   last modification time
 */
public record Event(
        UUID id,
        String name,
        String type,
        BigDecimal amount,
        String city,
        String description,
        LocalDate date,
        UUID organizerId,
        Instant createdAt,
        Instant updatedAt) {

    public static Event fromRow(Row row) {
        return new Event(
                row.get(ID, UUID.class),
                row.get(NAME, String.class),
                row.get(TYPE, String.class),
                row.get(AMOUNT, BigDecimal.class),
                row.get(CITY, String.class),
                row.get(DESCRIPTION, String.class),
                row.get(DATE, LocalDate.class),
                row.get(ORGANIZER_ID, UUID.class),
                row.get(CREATED_AT, Instant.class),
                row.get(UPDATED_AT, Instant.class));
    }
}
