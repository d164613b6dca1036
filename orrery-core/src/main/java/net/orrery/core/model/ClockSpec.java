package net.orrery.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Persisted definition of a schedule's clock.
 * <p>
 * INTERVAL: every {@code interval}, aligned on {@code anchor}.
 * CRON: a 5-field unix cron expression evaluated in {@code timezone}.
 */
public record ClockSpec(
        Kind kind,
        Duration interval,
        Instant anchor,
        String cron,
        String timezone
) {
    public static final Instant DEFAULT_ANCHOR = Instant.parse("2020-01-01T00:00:00Z");
    public static final String DEFAULT_TIMEZONE = "UTC";

    public ClockSpec {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.INTERVAL) {
            if (interval == null || interval.isZero() || interval.isNegative()) {
                throw new IllegalArgumentException("interval must be positive: " + interval);
            }
            if (interval.getNano() % 1_000_000 != 0) {
                throw new IllegalArgumentException("interval must be a whole number of milliseconds: " + interval);
            }
            if (anchor == null) anchor = DEFAULT_ANCHOR;
        } else {
            if (cron == null || cron.isBlank()) {
                throw new IllegalArgumentException("cron expression is required");
            }
            if (timezone == null || timezone.isBlank()) timezone = DEFAULT_TIMEZONE;
        }
    }

    public static ClockSpec interval(Duration interval) {
        return new ClockSpec(Kind.INTERVAL, interval, DEFAULT_ANCHOR, null, null);
    }

    public static ClockSpec interval(Duration interval, Instant anchor) {
        return new ClockSpec(Kind.INTERVAL, interval, anchor, null, null);
    }

    public static ClockSpec cron(String expr) {
        return new ClockSpec(Kind.CRON, null, null, expr, DEFAULT_TIMEZONE);
    }

    public static ClockSpec cron(String expr, String timezone) {
        return new ClockSpec(Kind.CRON, null, null, expr, timezone);
    }

    public enum Kind {
        INTERVAL, CRON;

        public static Kind from(String s) {
            if (s == null) throw new IllegalArgumentException("clock kind is null");
            return Kind.valueOf(s.toUpperCase(Locale.ROOT));
        }
        public String code() { return name(); }
    }
}
