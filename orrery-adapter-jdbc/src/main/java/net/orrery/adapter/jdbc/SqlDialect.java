package net.orrery.adapter.jdbc;

import net.orrery.core.exception.UnsupportedDialectException;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Locale;
import java.util.UUID;

/**
 * The storage engines this adapter speaks, and what they can do.
 * <p>
 * Both support {@code INSERT ... ON CONFLICT (...) DO NOTHING}. Only PostgreSQL is
 * treated as supporting {@code UPDATE ... FROM}; SQLite links states with a
 * correlated subquery unless configured otherwise.
 */
public enum SqlDialect {
    POSTGRESQL(true) {
        @Override
        public void bindUuid(PreparedStatement ps, int idx, UUID id) throws SQLException {
            if (id == null) ps.setNull(idx, Types.OTHER); else ps.setObject(idx, id);
        }

        @Override
        public void bindJson(PreparedStatement ps, int idx, String json) throws SQLException {
            ps.setObject(idx, json, Types.OTHER);
        }

        @Override
        public String limitOffset(Integer limit, Integer offset) {
            return " LIMIT " + (limit == null ? "ALL" : limit) + " OFFSET " + (offset == null ? 0 : offset);
        }
    },
    SQLITE(false) {
        @Override
        public void bindUuid(PreparedStatement ps, int idx, UUID id) throws SQLException {
            if (id == null) ps.setNull(idx, Types.VARCHAR); else ps.setString(idx, id.toString());
        }

        @Override
        public void bindJson(PreparedStatement ps, int idx, String json) throws SQLException {
            ps.setString(idx, json);
        }

        @Override
        public String limitOffset(Integer limit, Integer offset) {
            // sqlite needs a LIMIT before OFFSET; -1 means none
            return " LIMIT " + (limit == null ? -1 : limit) + " OFFSET " + (offset == null ? 0 : offset);
        }
    };

    private final boolean supportsUpdateJoin;

    SqlDialect(boolean supportsUpdateJoin) {
        this.supportsUpdateJoin = supportsUpdateJoin;
    }

    public boolean supportsUpdateJoin() {
        return supportsUpdateJoin;
    }

    public abstract void bindUuid(PreparedStatement ps, int idx, UUID id) throws SQLException;

    public abstract void bindJson(PreparedStatement ps, int idx, String json) throws SQLException;

    public abstract String limitOffset(Integer limit, Integer offset);

    /** Conflict clause for the insert-or-ignore used on unique keys. */
    public String onConflictDoNothing(String... columns) {
        return " ON CONFLICT (" + String.join(", ", columns) + ") DO NOTHING";
    }

    /** Accepts the configuration spelling: {@code postgresql}, {@code postgres}, {@code sqlite}. */
    public static SqlDialect of(String id) {
        if (id == null || id.isBlank()) throw new UnsupportedDialectException(String.valueOf(id));
        return switch (id.trim().toLowerCase(Locale.ROOT)) {
            case "postgresql", "postgres" -> POSTGRESQL;
            case "sqlite" -> SQLITE;
            default -> throw new UnsupportedDialectException(id);
        };
    }

    /** From {@link java.sql.DatabaseMetaData#getDatabaseProductName()}. */
    public static SqlDialect fromProductName(String productName) {
        if (productName == null) throw new UnsupportedDialectException("null");
        String p = productName.toLowerCase(Locale.ROOT);
        if (p.contains("postgresql")) return POSTGRESQL;
        if (p.contains("sqlite")) return SQLITE;
        throw new UnsupportedDialectException(productName);
    }

    public static SqlDialect detect(DataSource ds) throws SQLException {
        try (Connection c = ds.getConnection()) {
            return fromProductName(c.getMetaData().getDatabaseProductName());
        }
    }
}
