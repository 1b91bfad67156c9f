package com.sponsorsync.marketplace.access;

import com.sponsorsync.marketplace.model.EntityKind;
import com.sponsorsync.marketplace.model.Row;
import com.sponsorsync.security.IdentityContext;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;

/**
 * Typed view of {@link MarketplaceAccess} for one entity kind.
 *
 * @param <T> the record type rows are mapped to
 */
public abstract class EntityAccess<T> {

    private final MarketplaceAccess access;
    private final EntityKind kind;
    private final Function<Row, T> mapper;

    protected EntityAccess(MarketplaceAccess access, EntityKind kind, Function<Row, T> mapper) {
        this.access = Objects.requireNonNull(access, "access");
        this.kind = kind;
        this.mapper = mapper;
    }

    public EntityKind kind() {
        return kind;
    }

    public T get(IdentityContext identity, UUID id) {
        return mapper.apply(access.get(identity, kind, id));
    }

    public List<T> list(IdentityContext identity, Map<String, ?> filter) {
        return access.list(identity, kind, filter).stream().map(mapper).toList();
    }

    public T update(IdentityContext identity, UUID id, Map<String, ?> patch) {
        return mapper.apply(access.update(identity, kind, id, patch));
    }

    public void delete(IdentityContext identity, UUID id) {
        access.delete(identity, kind, id);
    }

    protected T create(IdentityContext identity, Map<String, ?> fields) {
        return mapper.apply(access.create(identity, kind, fields));
    }
}
