package com.sponsorsync.marketplaceservice.api;

import com.sponsorsync.marketplace.access.EventAccess;
import com.sponsorsync.marketplace.model.Event;
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

/** Events published by organizers. Filterable by any field, e.g. {@code ?organizerId=&type=&city=}. */
@RestController
@RequestMapping("/api/v1/events")
public class EventController {

    private final EventAccess events;

    public EventController(EventAccess events) {
        this.events = events;
    }

    @PostMapping
    public ResponseEntity<Event> create(IdentityContext identity, @RequestBody Map<String, Object> fields) {
        Event created = events.create(identity, fields);
        return ResponseEntity.created(URI.create("/api/v1/events/" + created.id())).body(created);
    }

    @GetMapping
    public List<Event> list(IdentityContext identity, @RequestParam Map<String, String> filter) {
        return events.list(identity, filter);
    }

    @GetMapping("/{id}")
    public Event get(IdentityContext identity, @PathVariable UUID id) {
        return events.get(identity, id);
    }

    @PatchMapping("/{id}")
    public Event update(IdentityContext identity, @PathVariable UUID id, @RequestBody Map<String, Object> patch) {
        return events.update(identity, id, patch);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(IdentityContext identity, @PathVariable UUID id) {
        events.delete(identity, id);
        return ResponseEntity.noContent().build();
    }
}
