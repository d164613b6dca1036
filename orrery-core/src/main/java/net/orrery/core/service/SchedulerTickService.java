package net.orrery.core.service;

import net.orrery.core.model.Deployment;
import net.orrery.core.spi.Clock;
import net.orrery.core.spi.DeploymentRepository;
import net.orrery.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/** One pass of the background scheduler over every deployment. */
public final class SchedulerTickService {
    private static final Logger log = LoggerFactory.getLogger(SchedulerTickService.class);

    private final DeploymentRepository deployments;
    private final DeploymentScheduler scheduler;
    private final TxRunner tx;
    private final Clock clock;

    public SchedulerTickService(DeploymentRepository deployments,
                                DeploymentScheduler scheduler,
                                TxRunner tx,
                                Clock clock) {
        this.deployments = deployments;
        this.scheduler = scheduler;
        this.tx = tx;
        this.clock = clock;
    }

    /**
     * Schedules runs in {@code [now, now + horizon]} for every deployment, one
     * transaction per deployment. A deployment that fails is logged and counted;
     * the next tick retries it.
     */
    public TickReport tickOnce(int maxRuns, Duration horizon, int pageSize) throws Exception {
        if (pageSize <= 0) throw new IllegalArgumentException("pageSize must be > 0: " + pageSize);
        Instant now = clock.now();
        Instant end = now.plus(horizon);

        int seen = 0;
        int created = 0;
        int failed = 0;
        int offset = 0;
        while (true) {
            final int pageOffset = offset;
            List<Deployment> page = tx.required(() -> deployments.findAll(pageOffset, pageSize));
            for (Deployment d : page) {
                seen++;
                try {
                    created += scheduler.scheduleRuns(d.id(), now, end, maxRuns).size();
                } catch (Exception e) {
                    failed++;
                    log.error("Scheduling failed for deployment {} ({})", d.name(), d.id(), e);
                }
            }
            if (page.size() < pageSize) break;
            offset += pageSize;
        }

        TickReport report = new TickReport(now, seen, created, failed);
        if (created > 0 || failed > 0) log.info("{}", report);
        return report;
    }

    public record TickReport(Instant timestamp, int deployments, int runsCreated, int failures) {}
}
