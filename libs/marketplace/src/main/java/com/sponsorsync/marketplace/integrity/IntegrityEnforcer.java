package com.sponsorsync.marketplace.integrity;

import static com.sponsorsync.marketplace.model.FieldNames.ID;
import static com.sponsorsync.marketplace.model.FieldNames.UPDATED_AT;

import com.sponsorsync.marketplace.model.EntityKind;
import com.sponsorsync.marketplace.model.Row;
import com.sponsorsync.marketplace.schema.EntitySchema;
import com.sponsorsync.marketplace.schema.EntitySchemas;
import com.sponsorsync.marketplace.schema.FieldSpec;
import com.sponsorsync.marketplace.schema.Mutability;
import com.sponsorsync.security.AccountRole;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates and completes rows before they are written.
 *
 * <p>Driven entirely by {@link EntitySchemas}: type coercion, required fields, the role
 * enumeration, amount positivity and scale, immutable fields, id generation and timestamps.
 * Runs after the policy engine has allowed the write and knows nothing about principals.
 *
 * <p>Time is read from the injected {@link Clock} and truncated to microseconds, the resolution
 * of a PostgreSQL {@code timestamptz}, so stored and in-memory timestamps compare equal.
 */
public class IntegrityEnforcer {

    private static final Logger log = LoggerFactory.getLogger(IntegrityEnforcer.class);

    /** Fractional digits kept for money amounts ({@code NUMERIC(14, 2)}). */
    public static final int AMOUNT_SCALE = 2;

    private final Clock clock;
    private final Supplier<UUID> idGenerator;

    public IntegrityEnforcer(Clock clock) {
        this(clock, UUID::randomUUID);
    }

    public IntegrityEnforcer(Clock clock, Supplier<UUID> idGenerator) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
    }

    /**
     * Builds the row to insert from caller-supplied fields.
     * <p>
     * Managed timestamps are set to now whatever the caller sent. For kinds with generated ids a
     * fresh id replaces any caller-supplied one.
     *
     * @throws ConstraintViolationException naming the first offending field
     */
    public Row prepareInsert(EntityKind kind, Map<String, ?> fields) {
        EntitySchema schema = EntitySchemas.of(kind);
        rejectUnknownFields(schema, fields.keySet());
        Instant now = now();

        Map<String, Object> row = new LinkedHashMap<>();
        for (FieldSpec spec : schema.fields()) {
            Object value;
            if (spec.mutability() == Mutability.MANAGED) {
                value = now;
            } else if (spec.name().equals(ID) && schema.generatedId()) {
                value = idGenerator.get();
            } else {
                value = validate(spec, fields.get(spec.name()));
            }
            row.put(spec.name(), value);
        }
        return Row.of(row);
    }

    /**
     * Applies a patch to the current row.
     * <p>
     * Fields absent from the patch keep their value. Immutable fields may only be repeated with
     * their current value. {@code updatedAt} is always advanced, even when nothing changed.
     *
     * @throws ConstraintViolationException naming the first offending field
     */
    public Row prepareUpdate(EntityKind kind, Row current, Map<String, ?> patch) {
        EntitySchema schema = EntitySchemas.of(kind);
        rejectUnknownFields(schema, patch.keySet());

        Map<String, Object> next = new LinkedHashMap<>(current.fields());
        for (Map.Entry<String, ?> entry : patch.entrySet()) {
            FieldSpec spec = schema.field(entry.getKey()).orElseThrow();
            switch (spec.mutability()) {
                case MANAGED -> {
                    // recomputed below
                }
                case IMMUTABLE -> {
                    Object requested = coerce(spec, entry.getValue());
                    if (!Objects.equals(requested, current.get(spec.name()))) {
                        throw violation(spec.name(), "is immutable");
                    }
                }
                case MUTABLE -> next.put(spec.name(), validate(spec, entry.getValue()));
            }
        }
        if (schema.hasField(UPDATED_AT)) {
            next.put(UPDATED_AT, now());
        }
        return Row.of(next);
    }

    /**
     * Converts equality-filter values to the types stored for each field.
     *
     * @throws ConstraintViolationException for unknown fields or unparseable values
     */
    public Map<String, Object> coerceFilter(EntityKind kind, Map<String, ?> filter) {
        EntitySchema schema = EntitySchemas.of(kind);
        rejectUnknownFields(schema, filter.keySet());
        Map<String, Object> criteria = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : filter.entrySet()) {
            FieldSpec spec = schema.field(entry.getKey()).orElseThrow();
            Object value = coerce(spec, entry.getValue());
            if (value instanceof BigDecimal amount) {
                value = normalizeScale(spec, amount);
            }
            criteria.put(spec.name(), value);
        }
        return criteria;
    }

    private Object validate(FieldSpec spec, Object raw) {
        Object value = coerce(spec, raw);
        if (value == null) {
            if (spec.required()) {
                throw violation(spec.name(), "must not be null");
            }
            return null;
        }
        if (value instanceof BigDecimal amount) {
            if (spec.positive() && amount.signum() <= 0) {
                throw violation(spec.name(), "must be greater than zero");
            }
            return normalizeScale(spec, amount);
        }
        if (value instanceof String text && spec.isBounded()
                && text.codePointCount(0, text.length()) > spec.size()) {
            throw violation(spec.name(), "must be at most " + spec.size() + " characters");
        }
        return value;
    }

    private Object coerce(FieldSpec spec, Object raw) {
        if (raw == null) {
            return null;
        }
        try {
            return switch (spec.type()) {
                case IDENTIFIER -> raw instanceof UUID ? raw : UUID.fromString(text(raw).strip());
                case TEXT -> text(raw).isBlank() ? null : raw;
                case DECIMAL -> toDecimal(raw);
                case DATE -> raw instanceof LocalDate ? raw : LocalDate.parse(text(raw).strip());
                case TIMESTAMP -> raw instanceof Instant ? raw : Instant.parse(text(raw).strip());
                case ROLE -> raw instanceof AccountRole ? raw : AccountRole.fromString(text(raw))
                        .orElseThrow(() -> new IllegalArgumentException("unknown role " + raw));
            };
        } catch (IllegalArgumentException | DateTimeParseException | ArithmeticException e) {
            throw violation(spec.name(), "has an invalid value", e);
        }
    }

    private static String text(Object raw) {
        if (raw instanceof String s) {
            return s;
        }
        throw new IllegalArgumentException("expected text but got " + raw.getClass().getSimpleName());
    }

    private static BigDecimal toDecimal(Object raw) {
        if (raw instanceof BigDecimal decimal) {
            return decimal;
        }
        if (raw instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        return new BigDecimal(text(raw).strip());
    }

    private BigDecimal normalizeScale(FieldSpec spec, BigDecimal amount) {
        if (spec.isBounded()) {
            int maxIntegerDigits = spec.size() - AMOUNT_SCALE;
            // long arithmetic: the scale of a parsed exponent may be close to Integer.MIN_VALUE
            if ((long) amount.precision() - amount.scale() > maxIntegerDigits) {
                throw violation(spec.name(), "must have at most " + maxIntegerDigits + " integer digits");
            }
        }
        if (amount.stripTrailingZeros().scale() > AMOUNT_SCALE) {
            throw violation(spec.name(), "must have at most " + AMOUNT_SCALE + " decimal places");
        }
        return amount.setScale(AMOUNT_SCALE);
    }

    private void rejectUnknownFields(EntitySchema schema, Set<String> names) {
        for (String name : names) {
            if (!schema.hasField(name)) {
                throw violation(name, "is not a field of " + schema.kind().value());
            }
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }

    private static ConstraintViolationException violation(String field, String reason) {
        log.debug("Constraint violation: {} {}", field, reason);
        return new ConstraintViolationException(field, reason);
    }

    private static ConstraintViolationException violation(String field, String reason, Throwable cause) {
        log.debug("Constraint violation: {} {} ({})", field, reason, cause.getMessage());
        return new ConstraintViolationException(field, reason, cause);
    }
}
