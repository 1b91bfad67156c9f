package com.sponsorsync.marketplaceservice.api;

import com.sponsorsync.marketplace.model.Profile;
import java.time.Instant;
import java.util.UUID;

/** Profile as returned over HTTP, with the role in its lowercase wire form. */
public record ProfileResponse(
        UUID id,
        String name,
        String companyName,
        String role,
        Instant createdAt,
        Instant updatedAt) {

    public static ProfileResponse from(Profile profile) {
        return new ProfileResponse(
                profile.id(),
                profile.name(),
                profile.companyName(),
                profile.role().value(),
                profile.createdAt(),
                profile.updatedAt());
    }
}
