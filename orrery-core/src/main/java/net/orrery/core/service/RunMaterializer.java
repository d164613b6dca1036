package net.orrery.core.service;

import net.orrery.core.model.CandidateRun;
import net.orrery.core.model.FlowRun;
import net.orrery.core.model.FlowRunState;
import net.orrery.core.spi.Clock;
import net.orrery.core.spi.FlowRunRepository;
import net.orrery.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Persists candidate runs exactly once and gives each newly created run its
 * initial SCHEDULED state.
 * <p>
 * The insert does not tell us which rows were new, so "new" is defined as
 * "submitted id that exists but has no state row yet". Every run that went
 * through here before already has one. The same rule picks up runs left
 * stateless by an earlier attempt that failed between insert and link.
 */
public final class RunMaterializer {
    private static final Logger log = LoggerFactory.getLogger(RunMaterializer.class);

    private final FlowRunRepository runs;
    private final TxRunner tx;
    private final Clock clock;

    public RunMaterializer(FlowRunRepository runs, TxRunner tx, Clock clock) {
        this.runs = runs;
        this.tx = tx;
        this.clock = clock;
    }

    /** @return only the runs this call created (or completed), with their state ids set */
    public List<FlowRun> materialize(List<CandidateRun> candidates) throws Exception {
        if (candidates.isEmpty()) return List.of();

        Map<UUID, CandidateRun> byId = new LinkedHashMap<>();
        for (CandidateRun c : candidates) byId.putIfAbsent(c.id(), c);

        Instant now = clock.now();
        return tx.required(() -> {
            // 1) insert, conflicts on (flow_id, idempotency_key) silently skipped
            List<FlowRun> rows = byId.values().stream().map(c -> c.toFlowRun(now)).toList();
            runs.insertIgnoringConflicts(rows);

            // 2) which of the submitted ids have no state yet
            Set<UUID> fresh = runs.findStateless(byId.keySet());
            log.debug("materialize: submitted={} fresh={}", rows.size(), fresh.size());
            if (fresh.isEmpty()) return List.<FlowRun>of();

            // 3) one initial state per fresh run
            List<FlowRunState> states = new ArrayList<>(fresh.size());
            for (CandidateRun c : byId.values()) {
                if (fresh.contains(c.id())) states.add(c.initialState(now));
            }
            runs.insertStates(states);

            // 4) state_id := the state just created for that run
            runs.linkStates(states);

            List<FlowRun> created = new ArrayList<>(states.size());
            for (FlowRunState s : states) {
                created.add(byId.get(s.flowRunId()).toFlowRun(now).withStateId(s.id()));
            }
            return created;
        });
    }
}
