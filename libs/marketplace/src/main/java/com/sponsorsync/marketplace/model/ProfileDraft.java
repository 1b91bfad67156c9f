package com.sponsorsync.marketplace.model;

import static com.sponsorsync.marketplace.model.FieldNames.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Onboarding data for a principal's {@link Profile}. The role is kept as text so that an
 * unsupported value is reported as a violation on the {@code role} field.
 */
public record ProfileDraft(String name, String companyName, String role) {

    public Map<String, Object> toFields(UUID principalId) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(ID, principalId);
        fields.put(NAME, name);
        fields.put(COMPANY_NAME, companyName);
        fields.put(ROLE, role);
        return fields;
    }
}
