package com.sponsorsync.marketplace.access;

import com.sponsorsync.marketplace.model.EntityKind;
import com.sponsorsync.marketplace.model.Profile;

/**
 * Profiles are only created through {@link ProfileProvisioner}; there is no user-facing create.
 */
public class ProfileAccess extends EntityAccess<Profile> {

    public ProfileAccess(MarketplaceAccess access) {
        super(access, EntityKind.PROFILE, Profile::fromRow);
    }
}
