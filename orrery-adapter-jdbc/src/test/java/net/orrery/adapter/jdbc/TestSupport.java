package net.orrery.adapter.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInstance;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Pooled DataSource plus Flyway schema per test class.
 * SQLite file database by default; subclasses override {@link #dialect()} and
 * {@link #configure(HikariConfig)} to point somewhere else.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public abstract class TestSupport {
    protected DataSource ds;
    protected JdbcTxRunner tx;
    private Path dbDir;

    protected SqlDialect dialect() {
        return SqlDialect.SQLITE;
    }

    protected void configure(HikariConfig cfg) throws Exception {
        dbDir = Files.createTempDirectory("orrery-test");
        cfg.setJdbcUrl("jdbc:sqlite:" + dbDir.resolve("orrery.db"));
        cfg.setDriverClassName("org.sqlite.JDBC");
        // writers queue on the database lock instead of failing with SQLITE_BUSY
        cfg.addDataSourceProperty("busy_timeout", "30000");
        cfg.addDataSourceProperty("transaction_mode", "IMMEDIATE");
        cfg.addDataSourceProperty("journal_mode", "WAL");
    }

    protected void stopExternal() {
    }

    @BeforeAll
    void setupDb() throws Exception {
        HikariConfig cfg = new HikariConfig();
        cfg.setMaximumPoolSize(8);
        cfg.setMinimumIdle(1);
        cfg.setConnectionTimeout(30_000);
        cfg.setIdleTimeout(60_000);
        configure(cfg);
        ds = new HikariDataSource(cfg);

        Flyway.configure()
                .dataSource(ds)
                .locations("classpath:db/migration/" + dialect().name().toLowerCase())
                .load()
                .migrate();
        tx = new JdbcTxRunner(ds);
    }

    @BeforeEach
    void wipeTables() throws Exception {
        tx.required(() -> {
            try (var st = TxContext.require().createStatement()) {
                for (String t : new String[]{"flow_run_state", "flow_run", "deployment_schedule", "deployment"}) {
                    st.execute("DELETE FROM " + t);
                }
            }
            return null;
        });
    }

    @AfterAll
    void cleanup() throws Exception {
        if (ds instanceof HikariDataSource h) h.close();
        stopExternal();
        if (dbDir != null) {
            try (var files = Files.walk(dbDir)) {
                files.sorted(java.util.Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
            }
        }
    }
}
