package com.sponsorsync.marketplace.schema;

import static org.assertj.core.api.Assertions.assertThat;

import com.sponsorsync.marketplace.model.EntityKind;
import com.sponsorsync.marketplace.model.FieldNames;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EntitySchemas")
class EntitySchemasTest {

    @ParameterizedTest(name = "{0} has an immutable primary key and a managed createdAt")
    @EnumSource(EntityKind.class)
    void everyKindIsDeclared(EntityKind kind) {
        EntitySchema schema = EntitySchemas.of(kind);
        assertThat(schema.kind()).isEqualTo(kind);
        assertThat(schema.fields().get(0).name()).isEqualTo(FieldNames.ID);
        assertThat(schema.field(FieldNames.ID).orElseThrow().mutability()).isEqualTo(Mutability.IMMUTABLE);
        assertThat(schema.field(FieldNames.CREATED_AT).orElseThrow().mutability()).isEqualTo(Mutability.MANAGED);
    }

    @Test
    @DisplayName("only profiles take their id from the caller")
    void profileIdIsNotGenerated() {
        assertThat(EntitySchemas.of(EntityKind.PROFILE).generatedId()).isFalse();
        assertThat(EntitySchemas.of(EntityKind.EVENT).generatedId()).isTrue();
    }

    @Test
    @DisplayName("declares the ownership chain as references")
    void ownershipChain() {
        assertThat(EntitySchemas.of(EntityKind.EVENT).references())
                .extracting(FieldSpec::references).containsExactly(EntityKind.PROFILE);
        assertThat(EntitySchemas.of(EntityKind.SPONSOR_OFFER).references())
                .extracting(FieldSpec::references).containsExactly(EntityKind.PROFILE);
        assertThat(EntitySchemas.of(EntityKind.SPONSOR_EVENT_TYPE).references())
                .extracting(FieldSpec::references).containsExactly(EntityKind.SPONSOR_OFFER);
        assertThat(EntitySchemas.of(EntityKind.PROFILE).references()).isEmpty();
    }

    @Test
    @DisplayName("only the sponsor offer description is nullable")
    void nullability() {
        for (EntityKind kind : EntityKind.values()) {
            for (FieldSpec field : EntitySchemas.of(kind).fields()) {
                boolean optional = kind == EntityKind.SPONSOR_OFFER && field.name().equals(FieldNames.DESCRIPTION);
                assertThat(field.required()).as("%s.%s", kind.value(), field.name()).isEqualTo(!optional);
            }
        }
    }

    @Test
    @DisplayName("amounts must be positive")
    void positiveAmounts() {
        assertThat(EntitySchemas.of(EntityKind.EVENT).field(FieldNames.AMOUNT).orElseThrow().positive()).isTrue();
        assertThat(EntitySchemas.of(EntityKind.SPONSOR_OFFER).field(FieldNames.AMOUNT).orElseThrow().positive()).isTrue();
    }
}
