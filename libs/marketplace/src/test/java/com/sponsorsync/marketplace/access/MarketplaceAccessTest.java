package com.sponsorsync.marketplace.access;

import static com.sponsorsync.marketplace.model.FieldNames.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.sponsorsync.marketplace.integrity.ConstraintViolationException;
import com.sponsorsync.marketplace.model.EntityKind;
import com.sponsorsync.marketplace.model.Event;
import com.sponsorsync.marketplace.model.EventDraft;
import com.sponsorsync.marketplace.model.Profile;
import com.sponsorsync.marketplace.model.SponsorEventType;
import com.sponsorsync.marketplace.model.SponsorEventTypeDraft;
import com.sponsorsync.marketplace.model.SponsorOffer;
import com.sponsorsync.marketplace.model.SponsorOfferDraft;
import com.sponsorsync.marketplace.store.EntityNotFoundException;
import com.sponsorsync.marketplace.store.InMemoryEntityStore;
import com.sponsorsync.marketplace.testing.MarketplaceFixture;
import com.sponsorsync.security.AccountRole;
import com.sponsorsync.security.IdentityContext;
import com.sponsorsync.security.PermissionDeniedException;
import com.sponsorsync.security.testing.TestIdentities;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("MarketplaceAccess")
class MarketplaceAccessTest {

    private MarketplaceFixture marketplace;
    private IdentityContext organizer;
    private IdentityContext sponsor;
    private Event event;
    private SponsorOffer offer;

    @BeforeEach
    void setUp() {
        marketplace = new MarketplaceFixture(new InMemoryEntityStore());
        organizer = TestIdentities.random();
        sponsor = TestIdentities.random();
        marketplace.provisioner.provision(organizer.principal(), "Olga", "Events Inc", AccountRole.ORGANIZER);
        marketplace.provisioner.provision(sponsor.principal(), "Sam", "Brand Co", AccountRole.SPONSOR);
        event = marketplace.events.create(organizer, draftFor(organizer.principal(), "10.00"));
        offer = marketplace.offers.create(sponsor, new SponsorOfferDraft(sponsor.principal(), BigDecimal.TEN, "Music"));
    }

    private static EventDraft draftFor(UUID organizerId, String amount) {
        return new EventDraft("Jazz Night", "concert", new BigDecimal(amount), "Lyon", "Live jazz",
                LocalDate.of(2026, 7, 4), organizerId);
    }

    @Nested
    @DisplayName("anonymous callers")
    class Anonymous {

        private final IdentityContext anonymous = TestIdentities.anonymous();

        @Test
        @DisplayName("are denied every operation")
        void deniedEverything() {
            assertThatThrownBy(() -> marketplace.events.get(anonymous, event.id()))
                    .isInstanceOf(PermissionDeniedException.class);
            assertThatThrownBy(() -> marketplace.events.list(anonymous, Map.of()))
                    .isInstanceOf(PermissionDeniedException.class);
            assertThatThrownBy(() -> marketplace.events.create(anonymous, draftFor(organizer.principal(), "5")))
                    .isInstanceOf(PermissionDeniedException.class);
            assertThatThrownBy(() -> marketplace.events.update(anonymous, event.id(), Map.of(NAME, "x")))
                    .isInstanceOf(PermissionDeniedException.class);
            assertThatThrownBy(() -> marketplace.offers.delete(anonymous, offer.id()))
                    .isInstanceOf(PermissionDeniedException.class);
        }

        @Test
        @DisplayName("cannot tell a missing row from a forbidden one")
        void noExistenceLeak() {
            assertThatThrownBy(() -> marketplace.events.get(anonymous, UUID.randomUUID()))
                    .isInstanceOf(PermissionDeniedException.class);
        }
    }

    @Nested
    @DisplayName("reads")
    class Reads {

        @Test
        @DisplayName("get of a missing row is NotFound for an authenticated caller")
        void missing() {
            assertThatThrownBy(() -> marketplace.events.get(sponsor, UUID.randomUUID()))
                    .isInstanceOf(EntityNotFoundException.class);
        }

        @Test
        @DisplayName("another principal's profile is PermissionDenied")
        void foreignProfile() {
            assertThatThrownBy(() -> marketplace.profiles.get(sponsor, organizer.principal()))
                    .isInstanceOf(PermissionDeniedException.class);
            assertThat(marketplace.profiles.get(sponsor, sponsor.principal()).role()).isEqualTo(AccountRole.SPONSOR);
        }

        @Test
        @DisplayName("listing profiles returns only the caller's own")
        void listOwnProfile() {
            assertThat(marketplace.profiles.list(sponsor, Map.of()))
                    .extracting(Profile::id)
                    .containsExactly(sponsor.principal());
        }

        @Test
        @DisplayName("listings are public to any authenticated principal and filterable")
        void publicListings() {
            IdentityContext stranger = TestIdentities.random();
            assertThat(marketplace.events.list(stranger, Map.of(ORGANIZER_ID, organizer.principal().toString())))
                    .containsExactly(event);
            assertThat(marketplace.events.list(stranger, Map.of(CITY, "Paris"))).isEmpty();
            assertThat(marketplace.offers.list(stranger, Map.of())).containsExactly(offer);
        }

        @Test
        @DisplayName("rejects a filter on an unknown field")
        void unknownFilter() {
            assertThatThrownBy(() -> marketplace.events.list(sponsor, Map.of("owner", "x")))
                    .isInstanceOf(ConstraintViolationException.class);
        }
    }

    @Nested
    @DisplayName("creates")
    class Creates {

        @Test
        @DisplayName("integrity rules apply after the allow decision")
        void zeroAmount() {
            assertThatThrownBy(() -> marketplace.events.create(organizer, draftFor(organizer.principal(), "0")))
                    .isInstanceOf(ConstraintViolationException.class)
                    .hasMessageContaining(AMOUNT);
            assertThat(marketplace.events.create(organizer, draftFor(organizer.principal(), "0.01")).amount())
                    .isEqualTo(new BigDecimal("0.01"));
        }

        @Test
        @DisplayName("a denied create is reported as denial, not as an integrity error")
        void deniedBeforeValidation() {
            assertThatThrownBy(() -> marketplace.events.create(sponsor, draftFor(sponsor.principal(), "0")))
                    .isInstanceOf(PermissionDeniedException.class);
        }

        @Test
        @DisplayName("a sponsor may tag only their own offer")
        void tagOwnOfferOnly() {
            IdentityContext otherSponsor = TestIdentities.random();
            marketplace.provisioner.provision(otherSponsor.principal(), "Tia", "Other", AccountRole.SPONSOR);

            SponsorEventType tag = marketplace.eventTypes.create(sponsor, new SponsorEventTypeDraft(offer.id(), "concert"));
            assertThat(marketplace.eventTypes.get(otherSponsor, tag.id())).isEqualTo(tag);
            assertThatThrownBy(() -> marketplace.eventTypes.create(otherSponsor,
                    new SponsorEventTypeDraft(offer.id(), "concert")))
                    .isInstanceOf(PermissionDeniedException.class);
        }

        @Test
        @DisplayName("profiles cannot be created through the access layer")
        void noProfileCreate() {
            IdentityContext newcomer = TestIdentities.random();
            assertThatThrownBy(() -> marketplace.access.create(newcomer, EntityKind.PROFILE,
                    Map.of(ID, newcomer.principal(), NAME, "N", COMPANY_NAME, "C", ROLE, "sponsor")))
                    .isInstanceOf(PermissionDeniedException.class);
        }
    }

    @Nested
    @DisplayName("updates")
    class Updates {

        @Test
        @DisplayName("the owner may update, and updatedAt advances")
        void ownerUpdates() {
            marketplace.clock.advance(Duration.ofMinutes(1));
            Event updated = marketplace.events.update(organizer, event.id(), Map.of(CITY, "Nice", AMOUNT, "12.5"));
            assertThat(updated.city()).isEqualTo("Nice");
            assertThat(updated.amount()).isEqualTo(new BigDecimal("12.50"));
            assertThat(updated.updatedAt()).isAfter(event.updatedAt());
            assertThat(updated.createdAt()).isEqualTo(event.createdAt());
        }

        @Test
        @DisplayName("an owner cannot hand an event over to another organizer")
        void noReassignment() {
            IdentityContext other = TestIdentities.random();
            marketplace.provisioner.provision(other.principal(), "Otto", "Other", AccountRole.ORGANIZER);

            assertThatThrownBy(() -> marketplace.events.update(organizer, event.id(),
                    Map.of(ORGANIZER_ID, other.principal().toString())))
                    .isInstanceOf(PermissionDeniedException.class);
            assertThat(marketplace.events.get(organizer, event.id()).organizerId()).isEqualTo(organizer.principal());
        }

        @Test
        @DisplayName("an owner cannot hand an offer over to another sponsor")
        void noOfferReassignment() {
            assertThatThrownBy(() -> marketplace.offers.update(sponsor, offer.id(),
                    Map.of(PROFILE_ID, organizer.principal())))
                    .isInstanceOf(PermissionDeniedException.class);
        }

        @Test
        @DisplayName("an unchanged profile payload still advances updatedAt")
        void idempotentProfileUpdate() {
            Profile before = marketplace.profiles.get(sponsor, sponsor.principal());
            marketplace.clock.advance(Duration.ofSeconds(30));
            Profile after = marketplace.profiles.update(sponsor, sponsor.principal(),
                    Map.of(NAME, before.name(), COMPANY_NAME, before.companyName()));

            assertThat(after.updatedAt()).isAfter(before.updatedAt());
            assertThat(after).usingRecursiveComparison().ignoringFields("updatedAt").isEqualTo(before);
        }

        @Test
        @DisplayName("a profile's role cannot change")
        void immutableRole() {
            assertThatThrownBy(() -> marketplace.profiles.update(sponsor, sponsor.principal(), Map.of(ROLE, "organizer")))
                    .isInstanceOf(ConstraintViolationException.class)
                    .hasMessage("role is immutable");
        }

        @Test
        @DisplayName("another principal may not update a profile")
        void foreignProfile() {
            assertThatThrownBy(() -> marketplace.profiles.update(organizer, sponsor.principal(), Map.of(NAME, "x")))
                    .isInstanceOf(PermissionDeniedException.class);
        }

        @Test
        @DisplayName("sponsor event types are append-only")
        void appendOnly() {
            SponsorEventType tag = marketplace.eventTypes.create(sponsor, new SponsorEventTypeDraft(offer.id(), "concert"));
            assertThatThrownBy(() -> marketplace.eventTypes.update(sponsor, tag.id(), Map.of(EVENT_TYPE, "festival")))
                    .isInstanceOf(PermissionDeniedException.class);
        }

        @Test
        @DisplayName("updating a missing row is NotFound")
        void missing() {
            assertThatThrownBy(() -> marketplace.events.update(organizer, UUID.randomUUID(), Map.of(NAME, "x")))
                    .isInstanceOf(EntityNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("deletes")
    class Deletes {

        @Test
        @DisplayName("are denied for every kind, even to owners")
        void denied() {
            assertThatThrownBy(() -> marketplace.events.delete(organizer, event.id()))
                    .isInstanceOf(PermissionDeniedException.class);
            assertThatThrownBy(() -> marketplace.offers.delete(sponsor, offer.id()))
                    .isInstanceOf(PermissionDeniedException.class);
            assertThatThrownBy(() -> marketplace.profiles.delete(sponsor, sponsor.principal()))
                    .isInstanceOf(PermissionDeniedException.class);
            assertThat(marketplace.events.get(organizer, event.id())).isEqualTo(event);
        }
    }
}
