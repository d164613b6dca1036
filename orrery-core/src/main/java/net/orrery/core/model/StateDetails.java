package net.orrery.core.model;

import java.time.Instant;
import java.util.UUID;

/** Provenance carried by a state: when the run was meant to start and which schedule produced it. */
public record StateDetails(
        Instant scheduledTime,
        UUID scheduleId,
        boolean autoScheduled
) {
    public static StateDetails empty() {
        return new StateDetails(null, null, false);
    }
}
