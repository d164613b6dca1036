package net.orrery.core.maintenance;

import net.orrery.core.model.FlowRun;
import net.orrery.core.model.FlowRunState;
import net.orrery.core.spi.Clock;
import net.orrery.core.spi.FlowRunRepository;
import net.orrery.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Gives a SCHEDULED state to runs that were inserted but never got one.
 * <p>
 * Re-running the scheduler repairs such runs only while their occurrence still
 * falls inside a generated window; this catches the ones the window has moved past.
 * {@code minAge} keeps it away from rows a concurrent materialization is still working on.
 */
public final class OrphanRepairService {
    private static final Logger log = LoggerFactory.getLogger(OrphanRepairService.class);

    private final FlowRunRepository runs;
    private final TxRunner tx;
    private final Clock clock;

    public OrphanRepairService(FlowRunRepository runs, TxRunner tx, Clock clock) {
        this.runs = runs;
        this.tx = tx;
        this.clock = clock;
    }

    public RepairReport runOnce(Duration minAge, int limit) throws Exception {
        Instant now = clock.now();
        Instant threshold = now.minus(minAge);

        int repaired = tx.required(() -> {
            List<FlowRun> orphans = runs.findStatelessCreatedBefore(threshold, limit);
            if (orphans.isEmpty()) return 0;

            List<FlowRunState> states = orphans.stream()
                    .map(r -> FlowRunState.scheduled(r.id(), r.expectedStartTime(), r.scheduleId(), now))
                    .toList();
            runs.insertStates(states);
            runs.linkStates(states);
            return states.size();
        });

        if (repaired > 0) log.warn("Attached initial state to {} orphaned run(s)", repaired);
        return new RepairReport(now, repaired);
    }

    public record RepairReport(Instant timestamp, int repaired) {}
}
