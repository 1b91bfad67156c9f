package com.sponsorsync.marketplace.access;

import com.sponsorsync.marketplace.model.EntityKind;
import com.sponsorsync.marketplace.model.SponsorEventType;
import com.sponsorsync.marketplace.model.SponsorEventTypeDraft;
import com.sponsorsync.security.IdentityContext;
import java.util.Map;

/**
 * Sponsor event types are append-only: {@link #update} and {@link #delete} are always denied.
 */
public class SponsorEventTypeAccess extends EntityAccess<SponsorEventType> {

    public SponsorEventTypeAccess(MarketplaceAccess access) {
        super(access, EntityKind.SPONSOR_EVENT_TYPE, SponsorEventType::fromRow);
    }

    public SponsorEventType create(IdentityContext identity, SponsorEventTypeDraft draft) {
        return create(identity, draft.toFields());
    }

    public SponsorEventType create(IdentityContext identity, Map<String, ?> fields) {
        return super.create(identity, fields);
    }
}
