package net.orrery.core.schedule;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Fires at {@code anchor + k * interval} for every integer k, including k < 0. */
public final class IntervalClock implements ScheduleClock {
    private final Duration interval;
    private final Instant anchor;

    public IntervalClock(Duration interval, Instant anchor) {
        this.interval = Objects.requireNonNull(interval, "interval");
        this.anchor = Objects.requireNonNull(anchor, "anchor");
        if (interval.toMillis() <= 0) {
            throw new IllegalArgumentException("interval must be at least 1ms: " + interval);
        }
    }

    @Override
    public List<Instant> getDates(int n, Instant start, Instant end) {
        if (n <= 0 || end.isBefore(start)) return List.of();

        long stepMs = interval.toMillis();
        long offsetMs = start.toEpochMilli() - anchor.toEpochMilli();
        long k = -Math.floorDiv(-offsetMs, stepMs); // ceil(offset / step)
        Instant t = anchor.plusMillis(k * stepMs);
        while (t.isBefore(start)) t = t.plus(interval); // sub-millisecond start

        List<Instant> out = new ArrayList<>(Math.min(n, 64));
        while (out.size() < n && !t.isAfter(end)) {
            out.add(t);
            t = t.plus(interval);
        }
        return out;
    }

    @Override
    public String toString() {
        return "IntervalClock{interval=" + interval + ", anchor=" + anchor + '}';
    }
}
