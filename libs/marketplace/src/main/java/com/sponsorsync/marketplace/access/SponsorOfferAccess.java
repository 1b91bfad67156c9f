package com.sponsorsync.marketplace.access;

import com.sponsorsync.marketplace.model.EntityKind;
import com.sponsorsync.marketplace.model.SponsorOffer;
import com.sponsorsync.marketplace.model.SponsorOfferDraft;
import com.sponsorsync.security.IdentityContext;
import java.util.Map;

public class SponsorOfferAccess extends EntityAccess<SponsorOffer> {

    public SponsorOfferAccess(MarketplaceAccess access) {
        super(access, EntityKind.SPONSOR_OFFER, SponsorOffer::fromRow);
    }

    public SponsorOffer create(IdentityContext identity, SponsorOfferDraft draft) {
        return create(identity, draft.toFields());
    }

    public SponsorOffer create(IdentityContext identity, Map<String, ?> fields) {
        return super.create(identity, fields);
    }
}
