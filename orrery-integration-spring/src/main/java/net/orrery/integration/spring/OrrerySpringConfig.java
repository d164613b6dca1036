package net.orrery.integration.spring;

import net.orrery.adapter.jdbc.SqlDialect;
import net.orrery.adapter.jdbc.link.LinkStrategy;
import net.orrery.adapter.jdbc.link.StateLinker;
import net.orrery.adapter.jdbc.repo.JdbcDeploymentRepository;
import net.orrery.adapter.jdbc.repo.JdbcFlowRunRepository;
import net.orrery.core.spi.Clock;
import net.orrery.core.spi.DeploymentRepository;
import net.orrery.core.spi.FlowRunRepository;
import net.orrery.core.spi.TxRunner;
import net.orrery.integration.spring.tx.SpringTxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.Instant;

/** Storage wiring: transactions, dialect, state linker and the JDBC repositories. */
@Configuration
public class OrrerySpringConfig {
    private static final Logger log = LoggerFactory.getLogger(OrrerySpringConfig.class);

    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    /** {@code orrery.storage.dialect} wins; otherwise asked from the connection metadata. */
    @Bean
    public SqlDialect sqlDialect(DataSource ds, @Value("${orrery.storage.dialect:}") String configured) throws SQLException {
        SqlDialect dialect = configured.isBlank() ? SqlDialect.detect(ds) : SqlDialect.of(configured);
        log.info("Storage dialect: {}", dialect);
        return dialect;
    }

    @Bean
    public StateLinker stateLinker(SqlDialect dialect, @Value("${orrery.storage.link-strategy:auto}") String strategy) {
        StateLinker linker = LinkStrategy.from(strategy).linkerFor(dialect);
        log.info("State linking: {} ({})", linker.name(), strategy);
        return linker;
    }

    @Bean public Clock systemClock() { return Instant::now; }

    @Bean
    public DeploymentRepository deploymentRepository(SqlDialect dialect, Clock clock) {
        return new JdbcDeploymentRepository(dialect, clock);
    }

    @Bean
    public FlowRunRepository flowRunRepository(SqlDialect dialect, StateLinker linker) {
        return new JdbcFlowRunRepository(dialect, linker);
    }
}
