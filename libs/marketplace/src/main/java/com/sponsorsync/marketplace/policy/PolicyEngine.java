package com.sponsorsync.marketplace.policy;

import com.sponsorsync.marketplace.model.EntityKind;
import com.sponsorsync.marketplace.model.Row;
import com.sponsorsync.observability.MetricFactory;
import com.sponsorsync.security.Decision;
import com.sponsorsync.security.IdentityContext;
import com.sponsorsync.security.Operation;
import com.sponsorsync.security.PermissionDeniedException;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether an identity may perform an operation on a row.
 * <p>
 * The engine only looks rules up in its {@link PolicyTable}; it never branches on entity kind.
 * The principal is always passed in explicitly, so the engine can be exercised without any
 * request context.
 * <p>
 * {@link #authorize} returns one opaque {@link Decision#DENY} for anonymous callers, unsupported
 * operations, rows that do not match and references that do not exist. It does not throw for a
 * well-formed request.
 */
public class PolicyEngine {

    private static final Logger log = LoggerFactory.getLogger(PolicyEngine.class);

    public static final String DECISIONS_METRIC = "sponsorsync.policy.decisions";

    private final PolicyTable table;
    private final OwnershipLookup lookup;
    private final MetricFactory metrics;

    public PolicyEngine(PolicyTable table, OwnershipLookup lookup, MetricFactory metrics) {
        this.table = Objects.requireNonNull(table, "table");
        this.lookup = Objects.requireNonNull(lookup, "lookup");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * @param identity  the caller, possibly anonymous
     * @param kind      entity kind being accessed
     * @param operation requested operation
     * @param row       the stored row, or the candidate fields for create
     */
    public Decision authorize(IdentityContext identity, EntityKind kind, Operation operation, Row row) {
        Decision decision = evaluate(identity, kind, operation, row);
        log.debug("Policy {} {} {} for principal {}",
                decision, operation.value(), kind.value(), identity.principal());
        metrics.counter(DECISIONS_METRIC, "Row-level policy decisions",
                "kind", kind.value(),
                "operation", operation.value(),
                "decision", decision.name().toLowerCase(Locale.ROOT))
                .increment();
        return decision;
    }

    /**
     * Same as {@link #authorize} but fails instead of returning a denial.
     *
     * @throws PermissionDeniedException if the decision is DENY
     */
    public void enforce(IdentityContext identity, EntityKind kind, Operation operation, Row row) {
        if (!authorize(identity, kind, operation, row).isAllowed()) {
            throw new PermissionDeniedException(kind.value(), operation);
        }
    }

    public boolean supports(EntityKind kind, Operation operation) {
        return table.supports(kind, operation);
    }

    private Decision evaluate(IdentityContext identity, EntityKind kind, Operation operation, Row row) {
        if (!identity.isAuthenticated()) {
            return Decision.DENY;
        }
        Optional<PolicyRule> rule = table.ruleFor(kind, operation);
        if (rule.isEmpty()) {
            return Decision.DENY;
        }
        try {
            return Decision.of(rule.get().permits(identity.principal(), row, lookup));
        } catch (RuntimeException e) {
            log.warn("Policy rule for {} {} failed, denying: {}", operation.value(), kind.value(), e.toString());
            return Decision.DENY;
        }
    }
}
