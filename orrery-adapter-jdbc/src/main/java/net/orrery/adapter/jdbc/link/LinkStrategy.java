package net.orrery.adapter.jdbc.link;

import net.orrery.adapter.jdbc.SqlDialect;

import java.util.Locale;

/** Which {@link StateLinker} to use. Picked once at startup. */
public enum LinkStrategy {
    AUTO, UPDATE_JOIN, CORRELATED_SUBQUERY;

    public static LinkStrategy from(String s) {
        if (s == null || s.isBlank()) return AUTO;
        return LinkStrategy.valueOf(s.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }

    /** AUTO follows the dialect: update-join where supported, correlated subquery otherwise. */
    public StateLinker linkerFor(SqlDialect dialect) {
        return switch (this) {
            case UPDATE_JOIN -> new UpdateJoinStateLinker(dialect);
            case CORRELATED_SUBQUERY -> new CorrelatedSubqueryStateLinker(dialect);
            case AUTO -> dialect.supportsUpdateJoin()
                    ? new UpdateJoinStateLinker(dialect)
                    : new CorrelatedSubqueryStateLinker(dialect);
        };
    }
}
