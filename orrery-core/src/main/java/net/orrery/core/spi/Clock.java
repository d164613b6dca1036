package net.orrery.core.spi;

import java.time.Instant;

/** Wall clock used for window defaults and row timestamps. */
@FunctionalInterface
public interface Clock {
    Instant now();
}
