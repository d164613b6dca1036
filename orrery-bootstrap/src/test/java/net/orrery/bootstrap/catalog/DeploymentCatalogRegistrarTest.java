package net.orrery.bootstrap.catalog;

import net.orrery.adapter.jdbc.JdbcTxRunner;
import net.orrery.adapter.jdbc.SqlDialect;
import net.orrery.adapter.jdbc.repo.JdbcDeploymentRepository;
import net.orrery.bootstrap.props.OrreryProperties;
import net.orrery.core.model.ClockSpec;
import net.orrery.core.model.Deployment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeploymentCatalogRegistrarTest {
    static final UUID FLOW = UUID.fromString("7d1f4c2e-9a3b-4c5d-8e6f-0a1b2c3d4e5f");

    @TempDir
    Path dir;

    JdbcTxRunner tx;
    JdbcDeploymentRepository deployments;
    DeploymentCatalogRegistrar registrar;

    @BeforeEach
    void setup() {
        var ds = new DriverManagerDataSource("jdbc:sqlite:" + dir.resolve("catalog.db"));
        new ResourceDatabasePopulator(new ClassPathResource("db/migration/sqlite/V1__init.sql")).execute(ds);
        tx = new JdbcTxRunner(ds);
        deployments = new JdbcDeploymentRepository(SqlDialect.SQLITE);
        registrar = new DeploymentCatalogRegistrar(deployments, tx, ZoneId.of("Asia/Seoul"));
    }

    @Test
    void createsDeclaredDeploymentsOnce() throws Exception {
        OrreryProperties.Catalog catalog = catalog(deployment("hourly-etl",
                cron("0 * * * *", null),
                interval(Duration.ofMinutes(30), Instant.parse("2024-01-01T00:15:00Z"))));

        List<UUID> first = registrar.register(catalog);
        List<UUID> second = registrar.register(catalog);

        assertThat(first).hasSize(1);
        assertThat(second).isEmpty();
        Deployment d = tx.required(() -> deployments.findByName("hourly-etl")).orElseThrow();
        assertThat(d.flowId()).isEqualTo(FLOW);
        assertThat(d.schedules()).extracting(s -> s.clock().kind())
                .containsExactlyInAnyOrder(ClockSpec.Kind.CRON, ClockSpec.Kind.INTERVAL);
        assertThat(d.schedules()).filteredOn(s -> s.clock().kind() == ClockSpec.Kind.CRON)
                .singleElement()
                .satisfies(s -> {
                    assertThat(s.clock().timezone()).isEqualTo("Asia/Seoul");
                    assertThat(s.parameters()).containsEntry("source", "catalog");
                });
    }

    @Test
    void rejectsAmbiguousOrBrokenSchedules() {
        OrreryProperties.ScheduleDef both = cron("0 * * * *", "UTC");
        both.setInterval(Duration.ofHours(1));

        assertThatThrownBy(() -> registrar.register(catalog(deployment("both", both))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("exactly one of cron or interval");
        assertThatThrownBy(() -> registrar.register(catalog(deployment("bad-cron", cron("61 * * * *", "UTC")))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registrar.register(catalog(deployment("bad-zone", cron("0 * * * *", "Mars/Olympus")))))
                .isInstanceOf(java.time.DateTimeException.class);
    }

    // ===== helpers =====

    static OrreryProperties.Catalog catalog(OrreryProperties.DeploymentDef... defs) {
        var c = new OrreryProperties.Catalog();
        c.setDeployments(List.of(defs));
        return c;
    }

    static OrreryProperties.DeploymentDef deployment(String name, OrreryProperties.ScheduleDef... schedules) {
        var d = new OrreryProperties.DeploymentDef();
        d.setName(name);
        d.setFlowId(FLOW);
        d.setSchedules(List.of(schedules));
        return d;
    }

    static OrreryProperties.ScheduleDef cron(String expr, String tz) {
        var s = new OrreryProperties.ScheduleDef();
        s.setCron(expr);
        s.setTimezone(tz);
        s.setParameters(Map.of("source", "catalog"));
        return s;
    }

    static OrreryProperties.ScheduleDef interval(Duration every, Instant anchor) {
        var s = new OrreryProperties.ScheduleDef();
        s.setInterval(every);
        s.setAnchor(anchor);
        return s;
    }
}
