package org.carball.pginsight.collector;

import java.time.Duration;
import java.time.Instant;

/**
 * Period covered by pg_stat_statements: the last reset, how long ago it was, and
 * whether collection should be skipped because the data predates the requested window.
 */
public record StatsWindow(Instant resetTime, Duration age, String skippedReason) {

    public StatsWindow {
        age = age == null ? Duration.ZERO : age;
    }

    public static StatsWindow unknown() {
        return new StatsWindow(null, Duration.ZERO, null);
    }

    public boolean isSkipped() {
        return skippedReason != null;
    }

    public double hours() {
        return age.toMillis() / 3_600_000.0;
    }
}
