package net.orrery.core.service;

import net.orrery.core.model.FlowRun;
import net.orrery.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Entry point for scheduling a deployment: generate candidates, then materialize them.
 * <p>
 * Safe to call again with the same or an overlapping window at any time. That is
 * also how a failed call is recovered: there is no internal retry.
 */
public final class DeploymentScheduler {
    private static final Logger log = LoggerFactory.getLogger(DeploymentScheduler.class);

    private final OccurrenceGenerator generator;
    private final RunMaterializer materializer;
    private final TxRunner tx;

    public DeploymentScheduler(OccurrenceGenerator generator, RunMaterializer materializer, TxRunner tx) {
        this.generator = generator;
        this.materializer = materializer;
        this.tx = tx;
    }

    public List<FlowRun> scheduleRuns(UUID deploymentId) throws Exception {
        return scheduleRuns(deploymentId, null, null, null);
    }

    /** Any of start, end and maxRuns may be null; see {@link OccurrenceGenerator#generate}. */
    public List<FlowRun> scheduleRuns(UUID deploymentId, Instant start, Instant end, Integer maxRuns) throws Exception {
        List<FlowRun> created = tx.required(() ->
                materializer.materialize(generator.generate(deploymentId, start, end, maxRuns)));
        if (!created.isEmpty()) {
            log.info("Scheduled {} new run(s) for deployment {}", created.size(), deploymentId);
        }
        return created;
    }
}
