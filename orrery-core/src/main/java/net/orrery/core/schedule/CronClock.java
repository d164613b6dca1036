package net.orrery.core.schedule;

import net.orrery.core.spi.CronCalculator;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Walks a cron expression forward one fire time at a time through the {@link CronCalculator}. */
public final class CronClock implements ScheduleClock {
    private final String cronExpr;
    private final ZoneId zone;
    private final CronCalculator calculator;

    public CronClock(String cronExpr, ZoneId zone, CronCalculator calculator) {
        this.cronExpr = Objects.requireNonNull(cronExpr, "cronExpr");
        this.zone = Objects.requireNonNull(zone, "zone");
        this.calculator = Objects.requireNonNull(calculator, "calculator");
    }

    @Override
    public List<Instant> getDates(int n, Instant start, Instant end) {
        if (n <= 0 || end.isBefore(start)) return List.of();

        List<Instant> out = new ArrayList<>(Math.min(n, 64));
        // a fire time exactly at start belongs to the window
        Instant cursor = start.minusNanos(1);
        while (out.size() < n) {
            Instant next = calculator.next(cursor, cronExpr, zone);
            if (next == null || next.isAfter(end)) break;
            if (!next.isAfter(cursor)) {
                throw new IllegalStateException("cron calculator did not advance past " + cursor + " for [" + cronExpr + "]");
            }
            if (!next.isBefore(start)) out.add(next);
            cursor = next;
        }
        return out;
    }

    @Override
    public String toString() {
        return "CronClock{cron='" + cronExpr + "', zone=" + zone + '}';
    }
}
