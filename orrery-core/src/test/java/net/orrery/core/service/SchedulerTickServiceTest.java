package net.orrery.core.service;

import net.orrery.core.model.ClockSpec;
import net.orrery.core.model.Deployment;
import net.orrery.core.model.FlowRun;
import net.orrery.core.model.Schedule;
import net.orrery.core.schedule.ScheduleClocks;
import net.orrery.core.spi.Clock;
import net.orrery.core.spi.TxRunner;
import net.orrery.core.support.DirectTxRunner;
import net.orrery.core.support.InMemoryDeploymentRepository;
import net.orrery.core.support.InMemoryFlowRunRepository;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class SchedulerTickServiceTest {
    static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    final InMemoryDeploymentRepository deployments = new InMemoryDeploymentRepository();
    final InMemoryFlowRunRepository runs = new InMemoryFlowRunRepository();
    final TxRunner tx = new DirectTxRunner();
    final Clock clock = () -> NOW;
    final DeploymentScheduler scheduler = new DeploymentScheduler(
            new OccurrenceGenerator(deployments, new ScheduleClocks((f, e, z) -> null), tx, clock),
            new RunMaterializer(runs, tx, clock),
            tx);
    final SchedulerTickService tick = new SchedulerTickService(deployments, scheduler, tx, clock);

    Deployment seed(String name) throws Exception {
        return deployments.create(Deployment.ofNew(name, UUID.randomUUID(), List.of(
                Schedule.ofNew(ClockSpec.interval(Duration.ofHours(1)), Map.of()))));
    }

    @Test
    void schedulesEveryDeploymentAcrossPages() throws Exception {
        for (int i = 0; i < 5; i++) seed("d" + i);

        SchedulerTickService.TickReport report = tick.tickOnce(10, Duration.ofHours(2), 2);

        assertThat(report.deployments()).isEqualTo(5);
        assertThat(report.runsCreated()).isEqualTo(15);
        assertThat(report.failures()).isZero();
        assertThat(report.timestamp()).isEqualTo(NOW);
    }

    @Test
    void secondTickOverSameHorizonIsQuiet() throws Exception {
        seed("steady");
        tick.tickOnce(10, Duration.ofHours(5), 50);

        assertThat(tick.tickOnce(10, Duration.ofHours(5), 50).runsCreated()).isZero();
        assertThat(runs.all()).hasSize(6);
    }

    @Test
    void oneFailingDeploymentDoesNotStopTheRest() throws Exception {
        Deployment bad = seed("bad");
        Deployment good = seed("good");
        deployments.failOn(bad.id());

        SchedulerTickService.TickReport report = tick.tickOnce(10, Duration.ofHours(1), 50);

        assertThat(report.failures()).isEqualTo(1);
        assertThat(report.runsCreated()).isEqualTo(2);
        assertThat(runs.findByDeployment(good.id())).hasSize(2);
    }

    @Test
    void schedulerHonoursExplicitWindow() throws Exception {
        Deployment d = seed("explicit");

        List<FlowRun> created = scheduler.scheduleRuns(d.id(), NOW.plus(Duration.ofDays(1)), NOW.plus(Duration.ofDays(2)), 3);

        assertThat(created).hasSize(3);
        assertThat(created.get(0).expectedStartTime()).isEqualTo(NOW.plus(Duration.ofDays(1)));
    }
}
