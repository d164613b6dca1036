package net.orrery.adapter.jdbc;

import net.orrery.core.spi.TxRunner;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.Callable;

/** Plain-JDBC {@link TxRunner}: one connection per transaction, published through {@link TxContext}. */
public final class JdbcTxRunner implements TxRunner {
    private final DataSource ds;

    public JdbcTxRunner(DataSource ds) { this.ds = ds; }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        if (TxContext.get() != null) {
            // join the running transaction
            return body.call();
        }
        return inNewTransaction(body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        Connection suspended = TxContext.get();
        try {
            return inNewTransaction(body);
        } finally {
            if (suspended != null) TxContext.set(suspended);
        }
    }

    private <T> T inNewTransaction(Callable<T> body) throws Exception {
        try (Connection c = ds.getConnection()) {
            boolean prevAuto = c.getAutoCommit();
            c.setAutoCommit(false);
            TxContext.set(c);
            Throwable failure = null;
            try {
                T r = body.call();
                c.commit();
                return r;
            } catch (Throwable t) {
                failure = t;
                rollback(c, t);
                throw t;
            } finally {
                TxContext.clear();
                restoreAutoCommit(c, prevAuto, failure);
            }
        }
    }

    // a failed reset must not mask the body's or the rollback's exception
    static void restoreAutoCommit(Connection c, boolean autoCommit, Throwable failure) throws SQLException {
        try {
            c.setAutoCommit(autoCommit);
        } catch (SQLException e) {
            if (failure == null) throw e;
            failure.addSuppressed(e);
        }
    }

    private static void rollback(Connection c, Throwable cause) {
        try {
            c.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }
}
