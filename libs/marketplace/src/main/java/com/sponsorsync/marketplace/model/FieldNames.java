package com.sponsorsync.marketplace.model;

/** Field names shared by schemas, policy rules and the typed records. */
public final class FieldNames {

    public static final String ID = "id";
    public static final String NAME = "name";
    public static final String COMPANY_NAME = "companyName";
    public static final String ROLE = "role";
    public static final String TYPE = "type";
    public static final String AMOUNT = "amount";
    public static final String CITY = "city";
    public static final String DESCRIPTION = "description";
    public static final String DATE = "date";
    public static final String ORGANIZER_ID = "organizerId";
    public static final String PROFILE_ID = "profileId";
    public static final String SPONSOR_OFFER_ID = "sponsorOfferId";
    public static final String EVENT_TYPE = "eventType";
    public static final String CREATED_AT = "createdAt";
    public static final String UPDATED_AT = "updatedAt";

    private FieldNames() {
        // constants
    }
}
