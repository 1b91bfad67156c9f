package com.sponsorsync.marketplace.model;

import static com.sponsorsync.marketplace.model.FieldNames.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A sponsor's standing sponsorship capacity.
 *
 * @param id          offer id
 * @param profileId   owning sponsor's profile id
 * @param amount      amount the sponsor is willing to commit, strictly positive
 * @param description optional free-form description
 * @param createdAt   creation time
 * @param updatedAt   last modification time
 */
public record SponsorOffer(
        UUID id,
        UUID profileId,
        BigDecimal amount,
        String description,
        Instant createdAt,
        Instant updatedAt) {

    public static SponsorOffer fromRow(Row row) {
        return new SponsorOffer(
                row.get(ID, UUID.class),
                row.get(PROFILE_ID, UUID.class),
                row.get(AMOUNT, BigDecimal.class),
                row.get(DESCRIPTION, String.class),
                row.get(CREATED_AT, Instant.class),
                row.get(UPDATED_AT, Instant.class));
    }
}
