package com.sponsorsync.marketplace.schema;

import static com.sponsorsync.marketplace.model.FieldNames.*;

import com.sponsorsync.marketplace.model.EntityKind;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Schema registry for the four marketplace entity kinds. Matches the Flyway migration in the
 * database module.
 */
public final class EntitySchemas {

    private static final Map<EntityKind, EntitySchema> SCHEMAS = new EnumMap<>(EntityKind.class);

    static {
        register(new EntitySchema(EntityKind.PROFILE, "profiles", false, List.of(
                FieldSpec.key(ID),
                FieldSpec.text(NAME, "name", 255),
                FieldSpec.text(COMPANY_NAME, "company_name", 255),
                FieldSpec.role(ROLE, "role"),
                FieldSpec.timestamp(CREATED_AT, "created_at"),
                FieldSpec.timestamp(UPDATED_AT, "updated_at"))));

        register(new EntitySchema(EntityKind.EVENT, "events", true, List.of(
                FieldSpec.key(ID),
                FieldSpec.text(NAME, "name", 255),
                FieldSpec.text(TYPE, "type", 100),
                FieldSpec.amount(AMOUNT, "amount"),
                FieldSpec.text(CITY, "city", 255),
                FieldSpec.text(DESCRIPTION, "description", 4000),
                FieldSpec.date(DATE, "event_date"),
                FieldSpec.reference(ORGANIZER_ID, "organizer_id", EntityKind.PROFILE),
                FieldSpec.timestamp(CREATED_AT, "created_at"),
                FieldSpec.timestamp(UPDATED_AT, "updated_at"))));

        register(new EntitySchema(EntityKind.SPONSOR_OFFER, "sponsor_offers", true, List.of(
                FieldSpec.key(ID),
                FieldSpec.reference(PROFILE_ID, "profile_id", EntityKind.PROFILE),
                FieldSpec.amount(AMOUNT, "amount"),
                FieldSpec.optionalText(DESCRIPTION, "description", 4000),
                FieldSpec.timestamp(CREATED_AT, "created_at"),
                FieldSpec.timestamp(UPDATED_AT, "updated_at"))));

        register(new EntitySchema(EntityKind.SPONSOR_EVENT_TYPE, "sponsor_event_types", true, List.of(
                FieldSpec.key(ID),
                FieldSpec.reference(SPONSOR_OFFER_ID, "sponsor_offer_id", EntityKind.SPONSOR_OFFER),
                FieldSpec.text(EVENT_TYPE, "event_type", 100),
                FieldSpec.timestamp(CREATED_AT, "created_at"))));
    }

    private EntitySchemas() {
        // utility class
    }

    public static EntitySchema of(EntityKind kind) {
        return SCHEMAS.get(kind);
    }

    private static void register(EntitySchema schema) {
        SCHEMAS.put(schema.kind(), schema);
    }
}
