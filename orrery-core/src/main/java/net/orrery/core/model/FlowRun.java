package net.orrery.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record FlowRun(
        UUID id,
        UUID flowId,
        UUID deploymentId,
        Map<String, Object> parameters,
        String idempotencyKey,      // unique together with flowId
        List<String> tags,
        UUID scheduleId,
        boolean autoScheduled,
        Instant expectedStartTime,
        UUID stateId,               // null until the run is fully initialized
        Instant createdAt,
        Instant updatedAt
) {
    public FlowRun {
        parameters = parameters == null ? Map.of() : parameters;
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public boolean initialized() {
        return stateId != null;
    }

    public FlowRun withStateId(UUID stateId) {
        return new FlowRun(id, flowId, deploymentId, parameters, idempotencyKey, tags,
                scheduleId, autoScheduled, expectedStartTime, stateId, createdAt, updatedAt);
    }
}
