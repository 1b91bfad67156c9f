package com.sponsorsync.marketplace.store;

import com.sponsorsync.marketplace.integrity.ConstraintViolationException;
import com.sponsorsync.marketplace.model.EntityKind;
import com.sponsorsync.marketplace.model.FieldNames;
import com.sponsorsync.marketplace.model.Row;
import com.sponsorsync.marketplace.schema.EntitySchema;
import com.sponsorsync.marketplace.schema.EntitySchemas;
import com.sponsorsync.marketplace.schema.FieldSpec;
import com.sponsorsync.security.AccountRole;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Relational store over the tables created by the {@code V1__initial_schema} migration.
 * <p>
 * SQL is derived from {@link EntitySchemas}, so the column list of every statement follows the
 * declared fields. An update runs in one transaction that locks the row with
 * {@code SELECT ... FOR UPDATE}, applies the mutation, and writes the result back.
 * Foreign keys are checked before writing and are also enforced by the database.
 */
public class JdbcEntityStore extends AbstractEntityStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcEntityStore.class);

    private final JdbcClient jdbc;
    private final TransactionTemplate transactions;

    public JdbcEntityStore(JdbcClient jdbc, TransactionTemplate transactions) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
        this.transactions = Objects.requireNonNull(transactions, "transactions");
    }

    public JdbcEntityStore(DataSource dataSource) {
        this(JdbcClient.create(dataSource), new TransactionTemplate(new DataSourceTransactionManager(dataSource)));
    }

    @Override
    public Optional<Row> get(EntityKind kind, UUID id) {
        if (id == null) {
            return Optional.empty();
        }
        EntitySchema schema = EntitySchemas.of(kind);
        return jdbc.sql(selectSql(schema) + " WHERE id = ?")
                .param(id)
                .query(rowMapper(schema))
                .optional();
    }

    @Override
    public List<Row> list(EntityKind kind, Map<String, Object> criteria) {
        EntitySchema schema = EntitySchemas.of(kind);
        StringBuilder sql = new StringBuilder(selectSql(schema));
        List<Object> params = new ArrayList<>();
        String separator = " WHERE ";
        for (Map.Entry<String, Object> criterion : criteria.entrySet()) {
            FieldSpec spec = schema.field(criterion.getKey())
                    .orElseThrow(() -> new ConstraintViolationException(criterion.getKey(),
                            "is not a field of " + kind.value()));
            if (criterion.getValue() == null) {
                sql.append(separator).append(spec.column()).append(" IS NULL");
            } else {
                sql.append(separator).append(spec.column()).append(" = ?");
                params.add(toParameter(criterion.getValue()));
            }
            separator = " AND ";
        }
        sql.append(" ORDER BY created_at, id");
        return jdbc.sql(sql.toString())
                .params(params)
                .query(rowMapper(schema))
                .list();
    }

    @Override
    public Row insert(EntityKind kind, Row row) {
        if (row.id() == null) {
            throw new ConstraintViolationException(FieldNames.ID, "must not be null");
        }
        EntitySchema schema = EntitySchemas.of(kind);
        String columns = schema.fields().stream().map(FieldSpec::column).collect(Collectors.joining(", "));
        String placeholders = schema.fields().stream().map(f -> "?").collect(Collectors.joining(", "));
        List<Object> params = schema.fields().stream()
                .map(spec -> toParameter(row.get(spec.name())))
                .toList();

        transactions.executeWithoutResult(status -> {
            requireReferences(kind, row);
            try {
                jdbc.sql("INSERT INTO " + schema.table() + " (" + columns + ") VALUES (" + placeholders + ")")
                        .params(params)
                        .update();
            } catch (DuplicateKeyException e) {
                throw new ConstraintViolationException(FieldNames.ID, "already exists", e);
            }
        });
        log.debug("Inserted {} {}", kind.value(), row.id());
        return row;
    }

    @Override
    public Row update(EntityKind kind, UUID id, UnaryOperator<Row> mutation) {
        EntitySchema schema = EntitySchemas.of(kind);
        List<FieldSpec> writable = schema.fields().stream()
                .filter(spec -> !spec.name().equals(FieldNames.ID))
                .toList();
        String assignments = writable.stream()
                .map(spec -> spec.column() + " = ?")
                .collect(Collectors.joining(", "));

        Row updated = transactions.execute(status -> {
            Row current = jdbc.sql(selectSql(schema) + " WHERE id = ? FOR UPDATE")
                    .param(id)
                    .query(rowMapper(schema))
                    .optional()
                    .orElseThrow(() -> new EntityNotFoundException(kind, id));
            Row next = Objects.requireNonNull(mutation.apply(current), "mutation result");
            requireReferences(kind, next);

            List<Object> params = new ArrayList<>();
            writable.forEach(spec -> params.add(toParameter(next.get(spec.name()))));
            params.add(id);
            jdbc.sql("UPDATE " + schema.table() + " SET " + assignments + " WHERE id = ?")
                    .params(params)
                    .update();
            return next;
        });
        log.debug("Updated {} {}", kind.value(), id);
        return updated;
    }

    @Override
    protected boolean exists(EntityKind kind, UUID id) {
        return jdbc.sql("SELECT COUNT(*) FROM " + EntitySchemas.of(kind).table() + " WHERE id = ?")
                .param(id)
                .query(Long.class)
                .single() > 0;
    }

    private static String selectSql(EntitySchema schema) {
        return "SELECT " + schema.fields().stream().map(FieldSpec::column).collect(Collectors.joining(", "))
                + " FROM " + schema.table();
    }

    private static Object toParameter(Object value) {
        if (value instanceof Instant instant) {
            return Timestamp.from(instant);
        }
        if (value instanceof LocalDate date) {
            return Date.valueOf(date);
        }
        if (value instanceof AccountRole role) {
            return role.value();
        }
        return value;
    }

    private static RowMapper<Row> rowMapper(EntitySchema schema) {
        return (rs, rowNum) -> {
            Map<String, Object> fields = new LinkedHashMap<>();
            for (FieldSpec spec : schema.fields()) {
                fields.put(spec.name(), readColumn(rs, spec));
            }
            return Row.of(fields);
        };
    }

    private static Object readColumn(ResultSet rs, FieldSpec spec) throws SQLException {
        String column = spec.column();
        return switch (spec.type()) {
            case IDENTIFIER -> rs.getObject(column, UUID.class);
            case TEXT -> rs.getString(column);
            case DECIMAL -> rs.getBigDecimal(column);
            case DATE -> rs.getObject(column, LocalDate.class);
            case TIMESTAMP -> {
                OffsetDateTime timestamp = rs.getObject(column, OffsetDateTime.class);
                yield timestamp == null ? null : timestamp.toInstant();
            }
            case ROLE -> {
                String role = rs.getString(column);
                yield role == null ? null : AccountRole.fromString(role)
                        .orElseThrow(() -> new IllegalStateException("Unknown role in database: " + role));
            }
        };
    }
}
