package com.sponsorsync.marketplace.model;

import static com.sponsorsync.marketplace.model.FieldNames.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Tags a sponsor offer with an event type it applies to. Append-only.
 *
 * @param id             tag id
 * @param sponsorOfferId the tagged offer
 * @param eventType      event type the offer covers
 * @param createdAt      creation time
 */
public record SponsorEventType(UUID id, UUID sponsorOfferId, String eventType, Instant createdAt) {

    public static SponsorEventType fromRow(Row row) {
        return new SponsorEventType(
                row.get(ID, UUID.class),
                row.get(SPONSOR_OFFER_ID, UUID.class),
                row.get(EVENT_TYPE, String.class),
                row.get(CREATED_AT, Instant.class));
    }
}
