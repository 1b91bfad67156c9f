package com.sponsorsync.marketplace.model;

import static com.sponsorsync.marketplace.model.FieldNames.*;

import com.sponsorsync.security.AccountRole;
import java.time.Instant;
import java.util.UUID;

/**
 * A principal's account record. The id is the principal identifier itself.
 *
 * @param id          principal identifier (primary key, immutable)
 * @param name        display name of the account holder
 * @param companyName company the account acts for
 * @param role        sponsor or organizer; fixed at provisioning
 * @param createdAt   creation time
 * @param updatedAt   last modification time
 */
public record Profile(
        UUID id,
        String name,
        String companyName,
        AccountRole role,
        Instant createdAt,
        Instant updatedAt) {

    public static Profile fromRow(Row row) {
        return new Profile(
                row.get(ID, UUID.class),
                row.get(NAME, String.class),
                row.get(COMPANY_NAME, String.class),
                row.get(ROLE, AccountRole.class),
                row.get(CREATED_AT, Instant.class),
                row.get(UPDATED_AT, Instant.class));
    }
}
