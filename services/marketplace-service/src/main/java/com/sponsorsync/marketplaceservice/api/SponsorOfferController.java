package com.sponsorsync.marketplaceservice.api;

import com.sponsorsync.marketplace.access.SponsorOfferAccess;
import com.sponsorsync.marketplace.model.SponsorOffer;
import com.sponsorsync.security.IdentityContext;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Sponsor offers. Filterable by {@code profileId}. */
@RestController
@RequestMapping("/api/v1/sponsor-offers")
public class SponsorOfferController {

    private final SponsorOfferAccess offers;

    public SponsorOfferController(SponsorOfferAccess offers) {
        this.offers = offers;
    }

    @PostMapping
    public ResponseEntity<SponsorOffer> create(IdentityContext identity, @RequestBody Map<String, Object> fields) {
        SponsorOffer created = offers.create(identity, fields);
        return ResponseEntity.created(URI.create("/api/v1/sponsor-offers/" + created.id())).body(created);
    }

    @GetMapping
    public List<SponsorOffer> list(IdentityContext identity, @RequestParam Map<String, String> filter) {
        return offers.list(identity, filter);
    }

    @GetMapping("/{id}")
    public SponsorOffer get(IdentityContext identity, @PathVariable UUID id) {
        return offers.get(identity, id);
    }

    @PatchMapping("/{id}")
    public SponsorOffer update(IdentityContext identity, @PathVariable UUID id, @RequestBody Map<String, Object> patch) {
        return offers.update(identity, id, patch);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(IdentityContext identity, @PathVariable UUID id) {
        offers.delete(identity, id);
        return ResponseEntity.noContent().build();
    }
}
