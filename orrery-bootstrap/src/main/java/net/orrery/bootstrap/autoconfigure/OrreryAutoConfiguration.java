package net.orrery.bootstrap.autoconfigure;

import net.orrery.bootstrap.catalog.DeploymentCatalogRegistrar;
import net.orrery.bootstrap.props.OrreryProperties;
import net.orrery.core.maintenance.OrphanRepairService;
import net.orrery.core.schedule.ScheduleClocks;
import net.orrery.core.service.DeploymentScheduler;
import net.orrery.core.service.OccurrenceGenerator;
import net.orrery.core.service.RunMaterializer;
import net.orrery.core.service.SchedulerTickService;
import net.orrery.core.spi.*;
import net.orrery.integration.spring.OrrerySpringConfig;
import net.orrery.integration.spring.cron.CronUtilsCalculator;
import net.orrery.integration.spring.sched.OrrerySchedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.ZoneId;

@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration",
        "org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration",
        "org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration"
})
@EnableConfigurationProperties(OrreryProperties.class)
@Import(OrrerySpringConfig.class) // integration-spring: repos/tx/clock wiring
public class OrreryAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(OrreryAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean(CronCalculator.class)
    public CronCalculator cronCalculator() {
        return new CronUtilsCalculator();
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleClocks scheduleClocks(CronCalculator cron) {
        return new ScheduleClocks(cron);
    }

    // --- core services ---

    @Bean
    @ConditionalOnMissingBean
    public OccurrenceGenerator occurrenceGenerator(DeploymentRepository deployments,
                                                   ScheduleClocks clocks,
                                                   TxRunner tx,
                                                   Clock clock) {
        return new OccurrenceGenerator(deployments, clocks, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public RunMaterializer runMaterializer(FlowRunRepository runs, TxRunner tx, Clock clock) {
        return new RunMaterializer(runs, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeploymentScheduler deploymentScheduler(OccurrenceGenerator generator,
                                                   RunMaterializer materializer,
                                                   TxRunner tx) {
        return new DeploymentScheduler(generator, materializer, tx);
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerTickService schedulerTickService(DeploymentRepository deployments,
                                                     DeploymentScheduler scheduler,
                                                     TxRunner tx,
                                                     Clock clock) {
        return new SchedulerTickService(deployments, scheduler, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public OrphanRepairService orphanRepairService(FlowRunRepository runs, TxRunner tx, Clock clock) {
        return new OrphanRepairService(runs, tx, clock);
    }

    // --- background scheduling; delays come from orrery.scheduler.*-delay-ms ---

    @Bean
    @ConditionalOnProperty(prefix = "orrery.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public OrrerySchedulers orrerySchedulers(SchedulerTickService tick,
                                             OrphanRepairService orphanRepair,
                                             OrreryProperties props) {
        var cfg = props.getScheduler();
        var s = new OrrerySchedulers(tick, orphanRepair);
        s.setMaxRuns(cfg.getMaxRuns());
        s.setHorizon(cfg.getHorizon());
        s.setPageSize(cfg.getPageSize());
        s.setOrphanMinAge(cfg.getOrphanMinAge());
        s.setOrphanBatch(cfg.getOrphanBatch());
        return s;
    }

    // --- catalog ---

    @Bean
    @ConditionalOnMissingBean
    public DeploymentCatalogRegistrar deploymentCatalogRegistrar(DeploymentRepository deployments,
                                                                 TxRunner tx,
                                                                 OrreryProperties props) {
        return new DeploymentCatalogRegistrar(deployments, tx, ZoneId.of(props.getZone()));
    }

    @Bean
    @ConditionalOnProperty(prefix = "orrery.catalog", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner catalogRunner(DeploymentCatalogRegistrar registrar, OrreryProperties props) {
        log.info("Catalog: {} deployment(s) declared", props.getCatalog().getDeployments().size());
        return args -> registrar.register(props.getCatalog());
    }
}
