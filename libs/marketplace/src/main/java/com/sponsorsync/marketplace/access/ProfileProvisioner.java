package com.sponsorsync.marketplace.access;

import com.sponsorsync.marketplace.integrity.ConstraintViolationException;
import com.sponsorsync.marketplace.integrity.IntegrityEnforcer;
import com.sponsorsync.marketplace.model.EntityKind;
import com.sponsorsync.marketplace.model.Profile;
import com.sponsorsync.marketplace.model.ProfileDraft;
import com.sponsorsync.marketplace.model.Row;
import com.sponsorsync.marketplace.store.EntityStore;
import com.sponsorsync.security.AccountRole;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates a principal's profile at onboarding.
 * <p>
 * This is the identity-provisioning flow, run on behalf of the identity provider rather than as
 * a user action, so no policy rule is consulted. The profile id is the principal id, which makes a
 * second profile for the same principal a duplicate key.
 */
public class ProfileProvisioner {

    private static final Logger log = LoggerFactory.getLogger(ProfileProvisioner.class);

    private final EntityStore store;
    private final IntegrityEnforcer integrity;

    public ProfileProvisioner(EntityStore store, IntegrityEnforcer integrity) {
        this.store = Objects.requireNonNull(store, "store");
        this.integrity = Objects.requireNonNull(integrity, "integrity");
    }

    /**
     * @throws ConstraintViolationException if a field is invalid or the principal already has a
     *                                      profile
     */
    public Profile provision(UUID principalId, ProfileDraft draft) {
        if (principalId == null) {
            throw new IllegalArgumentException("principalId must not be null");
        }
        Row prepared = integrity.prepareInsert(EntityKind.PROFILE, draft.toFields(principalId));
        Profile profile = Profile.fromRow(store.insert(EntityKind.PROFILE, prepared));
        log.info("Provisioned {} profile for principal {}", profile.role().value(), principalId);
        return profile;
    }

    public Profile provision(UUID principalId, String name, String companyName, AccountRole role) {
        return provision(principalId, new ProfileDraft(name, companyName, role == null ? null : role.value()));
    }
}
