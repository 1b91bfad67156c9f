package com.sponsorsync.marketplace.access;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.sponsorsync.marketplace.integrity.ConstraintViolationException;
import com.sponsorsync.marketplace.model.Profile;
import com.sponsorsync.marketplace.model.ProfileDraft;
import com.sponsorsync.marketplace.store.InMemoryEntityStore;
import com.sponsorsync.marketplace.testing.MarketplaceFixture;
import com.sponsorsync.security.AccountRole;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ProfileProvisioner")
class ProfileProvisionerTest {

    private MarketplaceFixture marketplace;

    @BeforeEach
    void setUp() {
        marketplace = new MarketplaceFixture(new InMemoryEntityStore());
    }

    @Test
    @DisplayName("creates a profile keyed by the principal id")
    void provisions() {
        UUID principal = UUID.randomUUID();
        Profile profile = marketplace.provisioner.provision(principal, new ProfileDraft("Ada", "Acme", "organizer"));

        assertThat(profile.id()).isEqualTo(principal);
        assertThat(profile.role()).isEqualTo(AccountRole.ORGANIZER);
        assertThat(profile.createdAt()).isEqualTo(profile.updatedAt());
        assertThat(marketplace.store.roleOf(principal)).contains(AccountRole.ORGANIZER);
    }

    @Test
    @DisplayName("allows exactly one profile per principal")
    void onePerPrincipal() {
        UUID principal = UUID.randomUUID();
        marketplace.provisioner.provision(principal, "Ada", "Acme", AccountRole.SPONSOR);

        assertThatThrownBy(() -> marketplace.provisioner.provision(principal, "Ada", "Acme", AccountRole.ORGANIZER))
                .isInstanceOf(ConstraintViolationException.class)
                .hasMessage("id already exists");
        assertThat(marketplace.store.roleOf(principal)).contains(AccountRole.SPONSOR);
    }

    @Test
    @DisplayName("rejects an unknown role")
    void unknownRole() {
        assertThatThrownBy(() -> marketplace.provisioner.provision(UUID.randomUUID(), new ProfileDraft("A", "B", "admin")))
                .isInstanceOf(ConstraintViolationException.class)
                .satisfies(e -> assertThat(((ConstraintViolationException) e).field()).isEqualTo("role"));
    }

    @Test
    @DisplayName("rejects a missing role")
    void missingRole() {
        assertThatThrownBy(() -> marketplace.provisioner.provision(UUID.randomUUID(), "A", "B", null))
                .isInstanceOf(ConstraintViolationException.class)
                .hasMessage("role must not be null");
    }

    @Test
    @DisplayName("requires a principal")
    void requiresPrincipal() {
        assertThatThrownBy(() -> marketplace.provisioner.provision(null, new ProfileDraft("A", "B", "sponsor")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
