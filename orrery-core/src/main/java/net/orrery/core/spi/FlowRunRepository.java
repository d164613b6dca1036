package net.orrery.core.spi;

import net.orrery.core.model.FlowRun;
import net.orrery.core.model.FlowRunState;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Storage capabilities the materializer is built on. None of the write methods
 * reports per-row outcomes; callers find out what happened by querying.
 */
public interface FlowRunRepository {

    /** Bulk insert; rows whose (flow_id, idempotency_key) already exists are skipped without error. */
    void insertIgnoringConflicts(List<FlowRun> runs) throws Exception;

    /** Subset of {@code runIds} that exist and have no state row at all. */
    Set<UUID> findStateless(Collection<UUID> runIds) throws Exception;

    /** Plain bulk insert. */
    void insertStates(List<FlowRunState> states) throws Exception;

    /** Points each state's run at that state. Runs not referenced by {@code states} are untouched. */
    void linkStates(List<FlowRunState> states) throws Exception;

    Optional<FlowRun> findById(UUID id) throws Exception;
    List<FlowRun> findByDeployment(UUID deploymentId) throws Exception;
    List<FlowRunState> findStates(UUID flowRunId) throws Exception;

    /** Runs with no state row created strictly before {@code threshold}, oldest first. */
    List<FlowRun> findStatelessCreatedBefore(Instant threshold, int limit) throws Exception;
}
