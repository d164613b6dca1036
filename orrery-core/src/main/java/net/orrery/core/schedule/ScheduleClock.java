package net.orrery.core.schedule;

import java.time.Instant;
import java.util.List;

/**
 * Expands a schedule into concrete fire times.
 * <p>
 * Implementations must be deterministic: the same arguments always produce the
 * same strictly increasing list, at most {@code n} long, every element inside
 * {@code [start, end]}.
 */
public interface ScheduleClock {
    List<Instant> getDates(int n, Instant start, Instant end);
}
