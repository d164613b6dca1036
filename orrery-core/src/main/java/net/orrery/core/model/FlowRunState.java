package net.orrery.core.model;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.UUID;

public record FlowRunState(
        UUID id,
        UUID flowRunId,
        StateType type,
        String name,
        String message,
        StateDetails details,
        Instant timestamp,
        Instant createdAt
) {
    public static final String SCHEDULED_NAME = "Scheduled";
    public static final String SCHEDULED_MESSAGE = "Flow run scheduled";

    /**
     * Initial state of an auto-scheduled run. The id is derived from the run id, so a
     * second attempt to attach an initial state to the same run collides on the primary key.
     */
    public static FlowRunState scheduled(UUID flowRunId, Instant scheduledTime, UUID scheduleId, Instant now) {
        return new FlowRunState(
                initialStateId(flowRunId),
                flowRunId,
                StateType.SCHEDULED,
                SCHEDULED_NAME,
                SCHEDULED_MESSAGE,
                new StateDetails(scheduledTime, scheduleId, true),
                now,
                now
        );
    }

    public static UUID initialStateId(UUID flowRunId) {
        return UUID.nameUUIDFromBytes((flowRunId + "|scheduled").getBytes(StandardCharsets.UTF_8));
    }
}
