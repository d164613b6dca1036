package net.orrery.core.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record Deployment(
        UUID id,
        String name,
        UUID flowId,
        List<Schedule> schedules,
        Instant createdAt,
        Instant updatedAt
) {
    public Deployment {
        schedules = schedules == null ? List.of() : List.copyOf(schedules);
    }

    public static Deployment ofNew(String name, UUID flowId, List<Schedule> schedules) {
        return new Deployment(UUID.randomUUID(), name, flowId, schedules, null, null);
    }
}
