package net.orrery.integration.spring.cron;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** cron-utils over 5-field unix expressions, with a small LRU of parsed expressions. */
public final class CronSlotPlanner {
    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    private static final Map<String, ExecutionTime> CACHE = new LruMap<>(256);

    private CronSlotPlanner() {}

    /**
     * First fire time strictly after {@code from}, evaluated in {@code zone}.
     * Empty when the expression has no further fire time.
     */
    public static Optional<Instant> next(String cronExpr, ZoneId zone, Instant from) {
        Objects.requireNonNull(cronExpr); Objects.requireNonNull(zone); Objects.requireNonNull(from);

        // fire times are whole seconds, so dropping the fraction cannot skip one
        ZonedDateTime base = from.truncatedTo(ChronoUnit.SECONDS).atZone(zone);
        return executionTime(cronExpr).nextExecution(base).map(ZonedDateTime::toInstant);
    }

    /** @throws IllegalArgumentException when the expression does not parse */
    public static void validate(String cronExpr) {
        executionTime(cronExpr);
    }

    public static void invalidateAll() { synchronized (CACHE) { CACHE.clear(); } }

    private static ExecutionTime executionTime(String cronExpr) {
        synchronized (CACHE) {
            return CACHE.computeIfAbsent(cronExpr.trim(), expr -> ExecutionTime.forCron(PARSER.parse(expr)));
        }
    }

    // --- LRU ---
    private static final class LruMap<K, V> extends LinkedHashMap<K, V> {
        private final int max;
        LruMap(int max) { super(16, 0.75f, true); this.max = max; }
        @Override protected boolean removeEldestEntry(Map.Entry<K, V> eldest) { return size() > max; }
    }
}
