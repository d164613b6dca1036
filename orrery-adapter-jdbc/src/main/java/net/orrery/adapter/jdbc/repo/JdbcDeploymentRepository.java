package net.orrery.adapter.jdbc.repo;

import net.orrery.adapter.jdbc.JdbcUtil;
import net.orrery.adapter.jdbc.JsonCodec;
import net.orrery.adapter.jdbc.SqlDialect;
import net.orrery.adapter.jdbc.TxContext;
import net.orrery.adapter.jdbc.mapper.RowMappers;
import net.orrery.core.model.ClockSpec;
import net.orrery.core.model.Deployment;
import net.orrery.core.model.Schedule;
import net.orrery.core.spi.Clock;
import net.orrery.core.spi.DeploymentRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Types;
import java.time.Instant;
import java.util.*;

import static net.orrery.adapter.jdbc.JdbcUtil.ts;

public final class JdbcDeploymentRepository implements DeploymentRepository {
    private final SqlDialect dialect;
    private final Clock clock;

    public JdbcDeploymentRepository(SqlDialect dialect) {
        this(dialect, Instant::now);
    }

    public JdbcDeploymentRepository(SqlDialect dialect, Clock clock) {
        this.dialect = dialect;
        this.clock = clock;
    }

    @Override
    public Deployment create(Deployment d) throws Exception {
        Connection c = TxContext.require();
        Instant now = clock.now();
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO deployment (id, name, flow_id, created, updated)
                VALUES (?, ?, ?, ?, ?)
            """)) {
            dialect.bindUuid(ps, 1, d.id());
            ps.setString(2, d.name());
            dialect.bindUuid(ps, 3, d.flowId());
            ps.setTimestamp(4, ts(now));
            ps.setTimestamp(5, ts(now));
            ps.executeUpdate();
        }
        for (Schedule s : d.schedules()) {
            insertSchedule(c, s.withDeployment(d.id()), now);
        }
        return findById(d.id()).orElseThrow(() -> new IllegalStateException("create failed to load deployment: " + d.id()));
    }

    @Override
    public Optional<Deployment> findById(UUID id) throws Exception {
        Connection c = TxContext.require();
        try (PreparedStatement ps = c.prepareStatement("SELECT * FROM deployment WHERE id = ?")) {
            dialect.bindUuid(ps, 1, id);
            return loadOne(c, ps);
        }
    }

    @Override
    public Optional<Deployment> findByName(String name) throws Exception {
        Connection c = TxContext.require();
        try (PreparedStatement ps = c.prepareStatement("SELECT * FROM deployment WHERE name = ?")) {
            ps.setString(1, name);
            return loadOne(c, ps);
        }
    }

    @Override
    public List<Deployment> findAll(Integer offset, Integer limit) throws Exception {
        Connection c = TxContext.require();
        // rows first, schedules in one pass afterwards
        Map<UUID, Deployment> rows = new LinkedHashMap<>();
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT * FROM deployment ORDER BY id" + dialect.limitOffset(limit, offset));
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                Deployment d = RowMappers.toDeployment(rs, List.of());
                rows.put(d.id(), d);
            }
        }
        if (rows.isEmpty()) return List.of();

        Map<UUID, List<Schedule>> byDeployment = loadSchedules(c, rows.keySet());
        List<Deployment> out = new ArrayList<>(rows.size());
        for (Deployment d : rows.values()) {
            out.add(new Deployment(d.id(), d.name(), d.flowId(),
                    byDeployment.getOrDefault(d.id(), List.of()), d.createdAt(), d.updatedAt()));
        }
        return out;
    }

    @Override
    public boolean delete(UUID id) throws Exception {
        Connection c = TxContext.require();
        try (PreparedStatement ps = c.prepareStatement("DELETE FROM deployment_schedule WHERE deployment_id = ?")) {
            dialect.bindUuid(ps, 1, id);
            ps.executeUpdate();
        }
        try (PreparedStatement ps = c.prepareStatement("DELETE FROM deployment WHERE id = ?")) {
            dialect.bindUuid(ps, 1, id);
            return ps.executeUpdate() > 0;
        }
    }

    @Override
    public Schedule addSchedule(UUID deploymentId, Schedule schedule) throws Exception {
        Connection c = TxContext.require();
        Instant now = clock.now();
        Schedule s = schedule.withDeployment(deploymentId);
        insertSchedule(c, s, now);
        touch(c, deploymentId, now);
        return new Schedule(s.id(), deploymentId, s.clock(), s.parameters(), s.active(), now);
    }

    @Override
    public boolean removeSchedule(UUID scheduleId) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement(
                "DELETE FROM deployment_schedule WHERE id = ?")) {
            dialect.bindUuid(ps, 1, scheduleId);
            return ps.executeUpdate() > 0;
        }
    }

    // ===== helpers =====

    private Optional<Deployment> loadOne(Connection c, PreparedStatement ps) throws Exception {
        UUID id;
        Deployment bare;
        try (ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) return Optional.empty();
            bare = RowMappers.toDeployment(rs, List.of());
            id = bare.id();
        }
        List<Schedule> schedules = loadSchedules(c, List.of(id)).getOrDefault(id, List.of());
        return Optional.of(new Deployment(id, bare.name(), bare.flowId(), schedules, bare.createdAt(), bare.updatedAt()));
    }

    private Map<UUID, List<Schedule>> loadSchedules(Connection c, Collection<UUID> deploymentIds) throws Exception {
        Map<UUID, List<Schedule>> out = new HashMap<>();
        for (List<UUID> chunk : JdbcUtil.chunks(deploymentIds, JdbcUtil.IN_CHUNK)) {
            String sql = """
                SELECT *
                  FROM deployment_schedule
                 WHERE deployment_id IN (%s)
                 ORDER BY created, id
                """.formatted(JdbcUtil.placeholders(chunk.size()));
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                int i = 1;
                for (UUID id : chunk) dialect.bindUuid(ps, i++, id);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        Schedule s = RowMappers.toSchedule(rs);
                        out.computeIfAbsent(s.deploymentId(), k -> new ArrayList<>()).add(s);
                    }
                }
            }
        }
        return out;
    }

    private void insertSchedule(Connection c, Schedule s, Instant now) throws Exception {
        ClockSpec clock = s.clock();
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO deployment_schedule
                       (id, deployment_id, clock_kind, interval_ms, anchor, cron, timezone, parameters, active, created)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """)) {
            int i = 1;
            dialect.bindUuid(ps, i++, s.id());
            dialect.bindUuid(ps, i++, s.deploymentId());
            ps.setString(i++, clock.kind().code());
            if (clock.interval() == null) ps.setNull(i++, Types.BIGINT); else ps.setLong(i++, clock.interval().toMillis());
            ps.setTimestamp(i++, ts(clock.anchor()));
            ps.setString(i++, clock.cron());
            ps.setString(i++, clock.timezone());
            dialect.bindJson(ps, i++, JsonCodec.toJson(s.parameters()));
            ps.setString(i++, JdbcUtil.yn(s.active()));
            ps.setTimestamp(i, ts(now));
            ps.executeUpdate();
        }
    }

    private void touch(Connection c, UUID deploymentId, Instant now) throws Exception {
        try (PreparedStatement ps = c.prepareStatement("UPDATE deployment SET updated = ? WHERE id = ?")) {
            ps.setTimestamp(1, ts(now));
            dialect.bindUuid(ps, 2, deploymentId);
            ps.executeUpdate();
        }
    }
}
