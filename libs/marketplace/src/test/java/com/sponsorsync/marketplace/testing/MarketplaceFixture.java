package com.sponsorsync.marketplace.testing;

import com.sponsorsync.marketplace.access.EventAccess;
import com.sponsorsync.marketplace.access.MarketplaceAccess;
import com.sponsorsync.marketplace.access.ProfileAccess;
import com.sponsorsync.marketplace.access.ProfileProvisioner;
import com.sponsorsync.marketplace.access.SponsorEventTypeAccess;
import com.sponsorsync.marketplace.access.SponsorOfferAccess;
import com.sponsorsync.marketplace.integrity.IntegrityEnforcer;
import com.sponsorsync.marketplace.policy.PolicyEngine;
import com.sponsorsync.marketplace.policy.PolicyTable;
import com.sponsorsync.marketplace.store.EntityStore;
import com.sponsorsync.observability.MetricFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/** Wires the marketplace core over a given store, the way the service configuration does. */
public final class MarketplaceFixture {

    public final MutableClock clock = MutableClock.startingAt("2026-02-01T08:00:00Z");
    public final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    public final EntityStore store;
    public final MarketplaceAccess access;
    public final ProfileProvisioner provisioner;
    public final ProfileAccess profiles;
    public final EventAccess events;
    public final SponsorOfferAccess offers;
    public final SponsorEventTypeAccess eventTypes;

    public MarketplaceFixture(EntityStore store) {
        this.store = store;
        IntegrityEnforcer integrity = new IntegrityEnforcer(clock);
        PolicyEngine policy = new PolicyEngine(PolicyTable.marketplace(), store,
                new MetricFactory(registry, "marketplace-test"));
        this.access = new MarketplaceAccess(store, policy, integrity);
        this.provisioner = new ProfileProvisioner(store, integrity);
        this.profiles = new ProfileAccess(access);
        this.events = new EventAccess(access);
        this.offers = new SponsorOfferAccess(access);
        this.eventTypes = new SponsorEventTypeAccess(access);
    }
}
