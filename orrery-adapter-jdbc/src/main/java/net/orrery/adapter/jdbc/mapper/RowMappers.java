package net.orrery.adapter.jdbc.mapper;

import net.orrery.adapter.jdbc.JsonCodec;
import net.orrery.core.model.*;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

import static net.orrery.adapter.jdbc.JdbcUtil.isY;
import static net.orrery.adapter.jdbc.JdbcUtil.toInstant;
import static net.orrery.adapter.jdbc.JdbcUtil.uuid;

public final class RowMappers {
    private RowMappers() {}

    // --- Deployment (schedules loaded separately) ---
    public static Deployment toDeployment(ResultSet rs, List<Schedule> schedules) throws SQLException {
        return new Deployment(
                uuid(rs.getString("id")),
                rs.getString("name"),
                uuid(rs.getString("flow_id")),
                schedules,
                toInstant(rs.getTimestamp("created")),
                toInstant(rs.getTimestamp("updated"))
        );
    }

    // --- Schedule ---
    public static Schedule toSchedule(ResultSet rs) throws SQLException {
        ClockSpec.Kind kind = ClockSpec.Kind.from(rs.getString("clock_kind"));
        long intervalMs = rs.getLong("interval_ms");
        Duration interval = rs.wasNull() ? null : Duration.ofMillis(intervalMs);
        ClockSpec clock = new ClockSpec(
                kind,
                interval,
                toInstant(rs.getTimestamp("anchor")),
                rs.getString("cron"),
                rs.getString("timezone")
        );
        return new Schedule(
                uuid(rs.getString("id")),
                uuid(rs.getString("deployment_id")),
                clock,
                JsonCodec.toMap(rs.getString("parameters")),
                isY(rs.getString("active")),
                toInstant(rs.getTimestamp("created"))
        );
    }

    // --- FlowRun ---
    public static FlowRun toFlowRun(ResultSet rs) throws SQLException {
        return new FlowRun(
                uuid(rs.getString("id")),
                uuid(rs.getString("flow_id")),
                uuid(rs.getString("deployment_id")),
                JsonCodec.toMap(rs.getString("parameters")),
                rs.getString("idempotency_key"),
                JsonCodec.toStrings(rs.getString("tags")),
                uuid(rs.getString("schedule_id")),
                isY(rs.getString("auto_scheduled")),
                toInstant(rs.getTimestamp("expected_start_time")),
                uuid(rs.getString("state_id")),
                toInstant(rs.getTimestamp("created")),
                toInstant(rs.getTimestamp("updated"))
        );
    }

    // --- FlowRunState ---
    public static FlowRunState toFlowRunState(ResultSet rs) throws SQLException {
        return new FlowRunState(
                uuid(rs.getString("id")),
                uuid(rs.getString("flow_run_id")),
                StateType.from(rs.getString("type")),
                rs.getString("name"),
                rs.getString("message"),
                JsonCodec.detailsFromJson(rs.getString("state_details")),
                toInstant(rs.getTimestamp("timestamp")),
                toInstant(rs.getTimestamp("created"))
        );
    }
}
