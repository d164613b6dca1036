package net.orrery.integration.spring.cron;

import net.orrery.core.model.ClockSpec;
import net.orrery.core.schedule.ScheduleClock;
import net.orrery.core.schedule.ScheduleClocks;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CronUtilsCalculatorTest {
    final CronUtilsCalculator calc = new CronUtilsCalculator();

    @Test
    void nextIsStrictlyAfter() {
        Instant onTheHour = Instant.parse("2024-01-01T10:00:00Z");
        assertThat(calc.next(onTheHour, "0 * * * *", ZoneOffset.UTC)).isEqualTo(Instant.parse("2024-01-01T11:00:00Z"));
        assertThat(calc.next(onTheHour.minusNanos(1), "0 * * * *", ZoneOffset.UTC)).isEqualTo(onTheHour);
    }

    @Test
    void evaluatedInScheduleTimezone() {
        // 09:00 Berlin is 08:00Z in winter, 07:00Z in summer
        ZoneId berlin = ZoneId.of("Europe/Berlin");
        assertThat(calc.next(Instant.parse("2024-01-05T12:00:00Z"), "0 9 * * MON-FRI", berlin))
                .isEqualTo(Instant.parse("2024-01-08T08:00:00Z"));
        assertThat(calc.next(Instant.parse("2024-07-01T00:00:00Z"), "0 9 * * MON-FRI", berlin))
                .isEqualTo(Instant.parse("2024-07-01T07:00:00Z"));
    }

    @Test
    void cronClockOverCronUtilsIncludesWindowStart() {
        ScheduleClock clock = new ScheduleClocks(calc).forSpec(ClockSpec.cron("*/15 * * * *"));
        Instant start = Instant.parse("2024-03-01T09:00:00Z");

        assertThat(clock.getDates(10, start, Instant.parse("2024-03-01T10:00:00Z")))
                .containsExactly(
                        start,
                        Instant.parse("2024-03-01T09:15:00Z"),
                        Instant.parse("2024-03-01T09:30:00Z"),
                        Instant.parse("2024-03-01T09:45:00Z"),
                        Instant.parse("2024-03-01T10:00:00Z"));
    }

    @Test
    void rejectsMalformedExpression() {
        assertThatThrownBy(() -> CronSlotPlanner.validate("every tuesday"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CronSlotPlanner.validate("0 0 * * * ?"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
