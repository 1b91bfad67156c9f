package com.sponsorsync.marketplace.access;

import com.sponsorsync.marketplace.model.EntityKind;
import com.sponsorsync.marketplace.model.Event;
import com.sponsorsync.marketplace.model.EventDraft;
import com.sponsorsync.security.IdentityContext;
import java.util.Map;

public class EventAccess extends EntityAccess<Event> {

    public EventAccess(MarketplaceAccess access) {
        super(access, EntityKind.EVENT, Event::fromRow);
    }

    public Event create(IdentityContext identity, EventDraft draft) {
        return create(identity, draft.toFields());
    }

    /** Loosely typed variant for request bodies. */
    public Event create(IdentityContext identity, Map<String, ?> fields) {
        return super.create(identity, fields);
    }
}
