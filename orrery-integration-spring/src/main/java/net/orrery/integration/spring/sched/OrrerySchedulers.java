package net.orrery.integration.spring.sched;

import net.orrery.core.maintenance.OrphanRepairService;
import net.orrery.core.service.SchedulerTickService;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;

public class OrrerySchedulers {
    private final SchedulerTickService tickService;
    private final OrphanRepairService orphanRepair;

    private int maxRuns = 100;
    private Duration horizon = Duration.ofDays(365);
    private int pageSize = 200;
    private Duration orphanMinAge = Duration.ofMinutes(5);
    private int orphanBatch = 500;

    public OrrerySchedulers(SchedulerTickService tickService, OrphanRepairService orphanRepair) {
        this.tickService = tickService;
        this.orphanRepair = orphanRepair;
    }

    @Scheduled(fixedDelayString = "${orrery.scheduler.tick-delay-ms:10000}")
    public void tick() throws Exception {
        tickService.tickOnce(maxRuns, horizon, pageSize);
    }

    @Scheduled(fixedDelayString = "${orrery.scheduler.maintenance-delay-ms:60000}")
    public void maintenance() throws Exception {
        orphanRepair.runOnce(orphanMinAge, orphanBatch);
    }

    public void setMaxRuns(int maxRuns) {
        this.maxRuns = maxRuns;
    }

    public void setHorizon(Duration horizon) {
        this.horizon = horizon;
    }

    public void setPageSize(int pageSize) {
        this.pageSize = pageSize;
    }

    public void setOrphanMinAge(Duration orphanMinAge) {
        this.orphanMinAge = orphanMinAge;
    }

    public void setOrphanBatch(int orphanBatch) {
        this.orphanBatch = orphanBatch;
    }
}
