package net.orrery.adapter.jdbc.repo;

import net.orrery.adapter.jdbc.JdbcUtil;
import net.orrery.adapter.jdbc.JsonCodec;
import net.orrery.adapter.jdbc.SqlDialect;
import net.orrery.adapter.jdbc.TxContext;
import net.orrery.adapter.jdbc.link.LinkStrategy;
import net.orrery.adapter.jdbc.link.StateLinker;
import net.orrery.adapter.jdbc.mapper.RowMappers;
import net.orrery.core.model.FlowRun;
import net.orrery.core.model.FlowRunState;
import net.orrery.core.spi.FlowRunRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Instant;
import java.util.*;

import static net.orrery.adapter.jdbc.JdbcUtil.ts;

public final class JdbcFlowRunRepository implements FlowRunRepository {
    private final SqlDialect dialect;
    private final StateLinker linker;

    public JdbcFlowRunRepository(SqlDialect dialect) {
        this(dialect, LinkStrategy.AUTO.linkerFor(dialect));
    }

    public JdbcFlowRunRepository(SqlDialect dialect, StateLinker linker) {
        this.dialect = dialect;
        this.linker = linker;
    }

    public StateLinker linker() {
        return linker;
    }

    /**
     * Batched {@code INSERT ... ON CONFLICT (flow_id, idempotency_key) DO NOTHING}.
     * Batch update counts differ between drivers for ignored rows and are not inspected.
     */
    @Override
    public void insertIgnoringConflicts(List<FlowRun> runs) throws Exception {
        if (runs.isEmpty()) return;
        String sql = """
            INSERT INTO flow_run (id, flow_id, deployment_id, parameters, idempotency_key, tags,
                                  schedule_id, auto_scheduled, expected_start_time, state_id, created, updated)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, NULL, ?, ?)
            """ + dialect.onConflictDoNothing("flow_id", "idempotency_key");
        try (PreparedStatement ps = TxContext.require().prepareStatement(sql)) {
            for (FlowRun r : runs) {
                int i = 1;
                dialect.bindUuid(ps, i++, r.id());
                dialect.bindUuid(ps, i++, r.flowId());
                dialect.bindUuid(ps, i++, r.deploymentId());
                dialect.bindJson(ps, i++, JsonCodec.toJson(r.parameters()));
                ps.setString(i++, r.idempotencyKey());
                dialect.bindJson(ps, i++, JsonCodec.toJson(r.tags()));
                dialect.bindUuid(ps, i++, r.scheduleId());
                ps.setString(i++, JdbcUtil.yn(r.autoScheduled()));
                ps.setTimestamp(i++, ts(r.expectedStartTime()));
                ps.setTimestamp(i++, ts(r.createdAt()));
                ps.setTimestamp(i, ts(r.updatedAt()));
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    /** Anti-join: submitted ids whose run row has no state row. */
    @Override
    public Set<UUID> findStateless(Collection<UUID> runIds) throws Exception {
        Set<UUID> out = new HashSet<>();
        Connection c = TxContext.require();
        for (List<UUID> chunk : JdbcUtil.chunks(runIds, JdbcUtil.IN_CHUNK)) {
            String sql = """
                SELECT r.id
                  FROM flow_run r
                  LEFT JOIN flow_run_state s ON s.flow_run_id = r.id
                 WHERE r.id IN (%s)
                   AND s.id IS NULL
                """.formatted(JdbcUtil.placeholders(chunk.size()));
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                int i = 1;
                for (UUID id : chunk) dialect.bindUuid(ps, i++, id);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) out.add(UUID.fromString(rs.getString(1)));
                }
            }
        }
        return out;
    }

    @Override
    public void insertStates(List<FlowRunState> states) throws Exception {
        if (states.isEmpty()) return;
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                INSERT INTO flow_run_state (id, flow_run_id, type, name, message, state_details, "timestamp", created)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """)) {
            for (FlowRunState s : states) {
                int i = 1;
                dialect.bindUuid(ps, i++, s.id());
                dialect.bindUuid(ps, i++, s.flowRunId());
                ps.setString(i++, s.type().code());
                ps.setString(i++, s.name());
                ps.setString(i++, s.message());
                dialect.bindJson(ps, i++, JsonCodec.detailsToJson(s.details()));
                ps.setTimestamp(i++, ts(s.timestamp()));
                ps.setTimestamp(i, ts(s.createdAt()));
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    @Override
    public void linkStates(List<FlowRunState> states) throws Exception {
        if (states.isEmpty()) return;
        linker.link(TxContext.require(), states);
    }

    @Override
    public Optional<FlowRun> findById(UUID id) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("SELECT * FROM flow_run WHERE id = ?")) {
            dialect.bindUuid(ps, 1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toFlowRun(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public List<FlowRun> findByDeployment(UUID deploymentId) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement(
                "SELECT * FROM flow_run WHERE deployment_id = ? ORDER BY expected_start_time, id")) {
            dialect.bindUuid(ps, 1, deploymentId);
            try (ResultSet rs = ps.executeQuery()) {
                List<FlowRun> out = new ArrayList<>();
                while (rs.next()) out.add(RowMappers.toFlowRun(rs));
                return out;
            }
        }
    }

    @Override
    public List<FlowRunState> findStates(UUID flowRunId) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement(
                "SELECT * FROM flow_run_state WHERE flow_run_id = ? ORDER BY \"timestamp\", id")) {
            dialect.bindUuid(ps, 1, flowRunId);
            try (ResultSet rs = ps.executeQuery()) {
                List<FlowRunState> out = new ArrayList<>();
                while (rs.next()) out.add(RowMappers.toFlowRunState(rs));
                return out;
            }
        }
    }

    @Override
    public List<FlowRun> findStatelessCreatedBefore(Instant threshold, int limit) throws Exception {
        String sql = """
            SELECT r.*
              FROM flow_run r
              LEFT JOIN flow_run_state s ON s.flow_run_id = r.id
             WHERE s.id IS NULL
               AND r.created < ?
             ORDER BY r.created, r.id
            """ + dialect.limitOffset(limit, 0);
        try (PreparedStatement ps = TxContext.require().prepareStatement(sql)) {
            ps.setTimestamp(1, ts(threshold));
            try (ResultSet rs = ps.executeQuery()) {
                List<FlowRun> out = new ArrayList<>();
                while (rs.next()) out.add(RowMappers.toFlowRun(rs));
                return out;
            }
        }
    }
}
