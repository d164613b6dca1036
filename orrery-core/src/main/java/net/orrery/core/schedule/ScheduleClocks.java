package net.orrery.core.schedule;

import net.orrery.core.model.ClockSpec;
import net.orrery.core.spi.CronCalculator;

import java.time.ZoneId;

/** Builds the runtime clock for a persisted {@link ClockSpec}. */
public final class ScheduleClocks {
    private final CronCalculator cron;

    public ScheduleClocks(CronCalculator cron) {
        this.cron = cron;
    }

    public ScheduleClock forSpec(ClockSpec spec) {
        return switch (spec.kind()) {
            case INTERVAL -> new IntervalClock(spec.interval(), spec.anchor());
            case CRON -> new CronClock(spec.cron(), ZoneId.of(spec.timezone()), cron);
        };
    }
}
