package net.orrery.core.spi;

import java.time.Instant;
import java.time.ZoneId;

public interface CronCalculator {
    /** First fire time strictly after {@code from}, or null when the expression never fires again. */
    Instant next(Instant from, String cronExpr, ZoneId zone);
}
