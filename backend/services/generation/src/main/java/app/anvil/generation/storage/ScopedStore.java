package app.anvil.generation.storage;

import jakarta.persistence.EntityManager;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.SqlParameterValue;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Shared plumbing for the scope-bound stores. Status transitions are plain SQL so they can be
 * conditional; the persistence context is flushed before and cleared after every such statement
 * so later repository reads in the same transaction see the new row state.
 */
abstract class ScopedStore {

    protected final JdbcTemplate jdbcTemplate;
    protected final EntityManager entityManager;
    protected final Clock clock;
    protected final UUID tenantId;

    ScopedStore(JdbcTemplate jdbcTemplate, EntityManager entityManager, Clock clock, UUID tenantId) {
        this.jdbcTemplate = jdbcTemplate;
        this.entityManager = entityManager;
        this.clock = clock;
        this.tenantId = tenantId;
    }

    protected UUID requireTenant() {
        if (tenantId == null) {
            throw new IllegalStateException("Operation requires a tenant scope");
        }
        return tenantId;
    }

    protected <T> Optional<T> visible(Optional<T> row, Function<T, UUID> owner) {
        if (tenantId == null) {
            return row;
        }
        return row.filter(value -> tenantId.equals(owner.apply(value)));
    }

    /**
     * Runs an update whose SQL ends with its where clause; the tenant predicate is appended.
     */
    protected int update(String sql, Object... args) {
        entityManager.flush();
        List<Object> params = new ArrayList<>(Arrays.asList(args));
        int updated = jdbcTemplate.update(withTenant(sql, params), params.toArray());
        if (updated > 0) {
            entityManager.clear();
        }
        return updated;
    }

    /**
     * Runs an {@code update ... returning} statement. {@code returning} is the clause appended
     * after the tenant predicate.
     */
    protected <T> List<T> updateReturning(String sql, String returning, RowMapper<T> mapper, Object... args) {
        entityManager.flush();
        List<Object> params = new ArrayList<>(Arrays.asList(args));
        List<T> rows = jdbcTemplate.query(withTenant(sql, params) + "\n" + returning, mapper, params.toArray());
        if (!rows.isEmpty()) {
            entityManager.clear();
        }
        return rows;
    }

    protected Timestamp now() {
        return Timestamp.from(clock.instant());
    }

    protected static Timestamp timestamp(Instant instant) {
        return Timestamp.from(instant);
    }

    protected static SqlParameterValue text(String value) {
        return new SqlParameterValue(Types.VARCHAR, value);
    }

    protected static String placeholders(Collection<?> values) {
        return String.join(", ", Collections.nCopies(values.size(), "?"));
    }

    private String withTenant(String sql, List<Object> params) {
        if (tenantId == null) {
            return sql;
        }
        params.add(tenantId);
        return sql + "\n  and user_id = ?";
    }
}
