package net.orrery.integration.spring.cron;

import net.orrery.core.spi.CronCalculator;

import java.time.Instant;
import java.time.ZoneId;

public final class CronUtilsCalculator implements CronCalculator {
    @Override
    public Instant next(Instant from, String cronExpr, ZoneId zone) {
        return CronSlotPlanner.next(cronExpr, zone, from).orElse(null);
    }
}
