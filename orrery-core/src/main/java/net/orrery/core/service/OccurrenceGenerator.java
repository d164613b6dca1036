package net.orrery.core.service;

import net.orrery.core.exception.DeploymentNotFoundException;
import net.orrery.core.model.CandidateRun;
import net.orrery.core.model.Deployment;
import net.orrery.core.model.Schedule;
import net.orrery.core.schedule.ScheduleClocks;
import net.orrery.core.spi.Clock;
import net.orrery.core.spi.DeploymentRepository;
import net.orrery.core.spi.TxRunner;

import java.time.Instant;
import java.time.Period;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Expands a deployment's schedules into candidate runs. Reads the deployment and
 * nothing else; the result depends only on the arguments and the schedules' clocks.
 */
public final class OccurrenceGenerator {
    public static final int DEFAULT_MAX_RUNS = 100;
    public static final Period DEFAULT_HORIZON = Period.ofYears(1);

    private final DeploymentRepository deployments;
    private final ScheduleClocks clocks;
    private final TxRunner tx;
    private final Clock clock;

    public OccurrenceGenerator(DeploymentRepository deployments,
                               ScheduleClocks clocks,
                               TxRunner tx,
                               Clock clock) {
        this.deployments = deployments;
        this.clocks = clocks;
        this.tx = tx;
        this.clock = clock;
    }

    /**
     * @param start   window start, defaults to now
     * @param end     window end (inclusive), defaults to {@code start} plus one year
     * @param maxRuns cap applied to each schedule separately, defaults to {@value #DEFAULT_MAX_RUNS}
     */
    public List<CandidateRun> generate(UUID deploymentId, Instant start, Instant end, Integer maxRuns) throws Exception {
        int perSchedule = maxRuns == null ? DEFAULT_MAX_RUNS : maxRuns;
        if (perSchedule < 0) throw new IllegalArgumentException("maxRuns must be >= 0: " + maxRuns);
        Instant from = start == null ? clock.now() : start;
        Instant to = end == null ? from.atOffset(ZoneOffset.UTC).plus(DEFAULT_HORIZON).toInstant() : end;

        Deployment deployment = tx.required(() -> deployments.findById(deploymentId))
                .orElseThrow(() -> new DeploymentNotFoundException(deploymentId));

        List<CandidateRun> out = new ArrayList<>();
        for (Schedule schedule : deployment.schedules()) {
            if (!schedule.active()) continue;
            List<Instant> dates = clocks.forSpec(schedule.clock()).getDates(perSchedule, from, to);
            for (Instant date : dates) {
                out.add(CandidateRun.of(deployment.flowId(), deployment.id(), schedule, date));
            }
        }
        return out;
    }
}
