package com.sponsorsync.marketplaceservice.api;

import com.sponsorsync.marketplace.model.ProfileDraft;
import jakarta.validation.constraints.NotBlank;

/**
 * Body of {@code POST /api/v1/profiles}. The profile id is taken from the caller's identity, never
 * from the body.
 */
public record ProvisionProfileRequest(
        @NotBlank String name,
        @NotBlank String companyName,
        @NotBlank String role) {

    public ProfileDraft toDraft() {
        return new ProfileDraft(name, companyName, role);
    }
}
