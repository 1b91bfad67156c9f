package com.sponsorsync.marketplace.policy;

import static com.sponsorsync.marketplace.policy.PolicyRules.anyAuthenticated;
import static com.sponsorsync.marketplace.policy.PolicyRules.ownsReferencedOffer;
import static com.sponsorsync.marketplace.policy.PolicyRules.principalEquals;
import static com.sponsorsync.marketplace.policy.PolicyRules.principalHasRole;

import com.sponsorsync.marketplace.model.EntityKind;
import com.sponsorsync.marketplace.model.FieldNames;
import com.sponsorsync.security.AccountRole;
import com.sponsorsync.security.Operation;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * The permission matrix as data: entity kind × operation → rule.
 * <p>
 * A missing cell means the operation is not supported for that kind and is always denied. New
 * kinds or operations are added here, never in {@link PolicyEngine}.
 */
public final class PolicyTable {

    private final Map<EntityKind, Map<Operation, PolicyRule>> rules;

    private PolicyTable(Map<EntityKind, Map<Operation, PolicyRule>> rules) {
        this.rules = rules;
    }

    public Optional<PolicyRule> ruleFor(EntityKind kind, Operation operation) {
        Map<Operation, PolicyRule> byOperation = rules.get(kind);
        return byOperation == null ? Optional.empty() : Optional.ofNullable(byOperation.get(operation));
    }

    public boolean supports(EntityKind kind, Operation operation) {
        return ruleFor(kind, operation).isPresent();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The marketplace matrix.
     * <p>
     * Profiles have no create rule: they are created by identity provisioning, not by a user
     * action. Nothing can be deleted, and sponsor event types are append-only.
     */
    public static PolicyTable marketplace() {
        return builder()
                .grant(EntityKind.PROFILE, Operation.READ, principalEquals(FieldNames.ID))
                .grant(EntityKind.PROFILE, Operation.UPDATE, principalEquals(FieldNames.ID))

                .grant(EntityKind.EVENT, Operation.READ, anyAuthenticated())
                .grant(EntityKind.EVENT, Operation.CREATE,
                        principalHasRole(AccountRole.ORGANIZER).and(principalEquals(FieldNames.ORGANIZER_ID)))
                .grant(EntityKind.EVENT, Operation.UPDATE, principalEquals(FieldNames.ORGANIZER_ID))

                .grant(EntityKind.SPONSOR_OFFER, Operation.READ, anyAuthenticated())
                .grant(EntityKind.SPONSOR_OFFER, Operation.CREATE,
                        principalHasRole(AccountRole.SPONSOR).and(principalEquals(FieldNames.PROFILE_ID)))
                .grant(EntityKind.SPONSOR_OFFER, Operation.UPDATE, principalEquals(FieldNames.PROFILE_ID))

                .grant(EntityKind.SPONSOR_EVENT_TYPE, Operation.READ, anyAuthenticated())
                .grant(EntityKind.SPONSOR_EVENT_TYPE, Operation.CREATE,
                        ownsReferencedOffer(FieldNames.SPONSOR_OFFER_ID))
                .build();
    }

    public static final class Builder {

        private final Map<EntityKind, Map<Operation, PolicyRule>> rules = new EnumMap<>(EntityKind.class);

        private Builder() {
        }

        /**
         * @throws IllegalStateException if the cell already holds a rule
         */
        public Builder grant(EntityKind kind, Operation operation, PolicyRule rule) {
            Map<Operation, PolicyRule> byOperation =
                    rules.computeIfAbsent(kind, k -> new EnumMap<>(Operation.class));
            if (byOperation.putIfAbsent(operation, rule) != null) {
                throw new IllegalStateException(
                        "Rule already defined for " + kind.value() + " " + operation.value());
            }
            return this;
        }

        public PolicyTable build() {
            Map<EntityKind, Map<Operation, PolicyRule>> copy = new EnumMap<>(EntityKind.class);
            rules.forEach((kind, byOperation) -> copy.put(kind, new EnumMap<>(byOperation)));
            return new PolicyTable(copy);
        }
    }
}
