package com.sponsorsync.marketplaceservice.api;

import com.sponsorsync.marketplace.access.SponsorEventTypeAccess;
import com.sponsorsync.marketplace.model.SponsorEventType;
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

/**
 * Event-type tags on sponsor offers. Append-only: {@code PATCH} and {@code DELETE} always answer
 * 403.
 */
@RestController
@RequestMapping("/api/v1/sponsor-event-types")
public class SponsorEventTypeController {

    private final SponsorEventTypeAccess eventTypes;

    public SponsorEventTypeController(SponsorEventTypeAccess eventTypes) {
        this.eventTypes = eventTypes;
    }

    @PostMapping
    public ResponseEntity<SponsorEventType> create(IdentityContext identity, @RequestBody Map<String, Object> fields) {
        SponsorEventType created = eventTypes.create(identity, fields);
        return ResponseEntity.created(URI.create("/api/v1/sponsor-event-types/" + created.id())).body(created);
    }

    @GetMapping
    public List<SponsorEventType> list(IdentityContext identity, @RequestParam Map<String, String> filter) {
        return eventTypes.list(identity, filter);
    }

    @GetMapping("/{id}")
    public SponsorEventType get(IdentityContext identity, @PathVariable UUID id) {
        return eventTypes.get(identity, id);
    }

    @PatchMapping("/{id}")
    public SponsorEventType update(IdentityContext identity, @PathVariable UUID id, @RequestBody Map<String, Object> patch) {
        return eventTypes.update(identity, id, patch);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(IdentityContext identity, @PathVariable UUID id) {
        eventTypes.delete(identity, id);
        return ResponseEntity.noContent().build();
    }
}
