package com.sponsorsync.marketplace.schema;

import com.sponsorsync.marketplace.model.EntityKind;
import java.util.List;
import java.util.Optional;

/**
 * Field declarations and storage layout of one entity kind.
 *
 * @param kind        the entity kind
 * @param table       relational table name
 * @param generatedId whether ids are generated on insert (false for profiles, keyed by principal)
 * @param fields      all fields, primary key first
 */
public record EntitySchema(EntityKind kind, String table, boolean generatedId, List<FieldSpec> fields) {

    public EntitySchema {
        fields = List.copyOf(fields);
    }

    public Optional<FieldSpec> field(String name) {
        return fields.stream().filter(f -> f.name().equals(name)).findFirst();
    }

    public boolean hasField(String name) {
        return field(name).isPresent();
    }

    /** Foreign-key fields, checked on every write. */
    public List<FieldSpec> references() {
        return fields.stream().filter(FieldSpec::isReference).toList();
    }
}
