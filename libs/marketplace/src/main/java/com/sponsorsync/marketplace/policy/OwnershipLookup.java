package com.sponsorsync.marketplace.policy;

import com.sponsorsync.security.AccountRole;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only questions the policy rules ask about existing rows.
 * <p>
 * Both lookups return empty when the row does not exist, so a rule cannot tell "missing" from
 * "not yours" and denies either way.
 */
public interface OwnershipLookup {

    /** Role of the profile with the given id. */
    Optional<AccountRole> roleOf(UUID profileId);

    /** Owning profile id of the sponsor offer with the given id. */
    Optional<UUID> ownerOfOffer(UUID sponsorOfferId);
}
