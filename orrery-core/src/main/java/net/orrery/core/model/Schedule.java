package net.orrery.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

public record Schedule(
        UUID id,
        UUID deploymentId,
        ClockSpec clock,
        Map<String, Object> parameters,   // copied into every run this schedule produces
        boolean active,
        Instant createdAt
) {
    public Schedule {
        // parameter values may be null
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static Schedule ofNew(ClockSpec clock, Map<String, Object> parameters) {
        return new Schedule(UUID.randomUUID(), null, clock, parameters, true, null);
    }

    public Schedule withDeployment(UUID deploymentId) {
        return new Schedule(id, deploymentId, clock, parameters, active, createdAt);
    }
}
