package net.orrery.core.model;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A run that a schedule wants to exist. Not persisted until materialized.
 * <p>
 * Both {@link #idempotencyKey()} and {@link #id()} are pure functions of
 * (flow, schedule, scheduled time), so regenerating the same occurrence always
 * yields the same identity.
 */
public record CandidateRun(
        UUID id,
        UUID flowId,
        UUID deploymentId,
        Map<String, Object> parameters,
        String idempotencyKey,
        List<String> tags,
        Instant scheduledTime,
        UUID scheduleId
) {
    public static final String AUTO_SCHEDULED_TAG = "auto-scheduled";

    public static CandidateRun of(UUID flowId, UUID deploymentId, Schedule schedule, Instant scheduledTime) {
        String key = idempotencyKey(schedule.id(), scheduledTime);
        return new CandidateRun(
                runId(flowId, key),
                flowId,
                deploymentId,
                schedule.parameters(),
                key,
                List.of(AUTO_SCHEDULED_TAG),
                scheduledTime,
                schedule.id()
        );
    }

    /** e.g. {@code scheduled 5f0c...e1 2024-03-01T09:00:00Z} */
    public static String idempotencyKey(UUID scheduleId, Instant scheduledTime) {
        return "scheduled " + scheduleId + " "
                + DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(scheduledTime.atOffset(ZoneOffset.UTC));
    }

    public static UUID runId(UUID flowId, String idempotencyKey) {
        return UUID.nameUUIDFromBytes((flowId + "|" + idempotencyKey).getBytes(StandardCharsets.UTF_8));
    }

    public FlowRun toFlowRun(Instant now) {
        return new FlowRun(id, flowId, deploymentId, parameters, idempotencyKey, tags,
                scheduleId, true, scheduledTime, null, now, now);
    }

    public FlowRunState initialState(Instant now) {
        return FlowRunState.scheduled(id, scheduledTime, scheduleId, now);
    }
}
