package com.sponsorsync.marketplace.store;

import com.sponsorsync.marketplace.model.EntityKind;
import java.util.UUID;

/**
 * Thrown when a row addressed by id does not exist.
 */
public class EntityNotFoundException extends RuntimeException {

    private final EntityKind kind;
    private final UUID id;

    public EntityNotFoundException(EntityKind kind, UUID id) {
        super("%s %s not found".formatted(kind.value(), id));
        this.kind = kind;
        this.id = id;
    }

    public EntityKind kind() {
        return kind;
    }

    public UUID id() {
        return id;
    }
}
