package org.carball.pginsight.db;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Overall deadline of a run. Per-call timeouts are capped by what remains of it,
 * and once it has passed every further call is refused.
 */
public final class RunDeadline {

    private final Clock clock;
    private final Instant expiresAt;

    private RunDeadline(Clock clock, Instant expiresAt) {
        this.clock = clock;
        this.expiresAt = expiresAt;
    }

    public static RunDeadline after(Duration timeout) {
        return after(timeout, Clock.systemUTC());
    }

    public static RunDeadline after(Duration timeout, Clock clock) {
        return new RunDeadline(clock, clock.instant().plus(timeout));
    }

    public static RunDeadline none() {
        return new RunDeadline(Clock.systemUTC(), Instant.MAX);
    }

    public Duration remaining() {
        if (expiresAt.equals(Instant.MAX)) {
            return Duration.ofSeconds(Long.MAX_VALUE);
        }
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean isExpired() {
        return remaining().isZero();
    }

    /**
     * Shorter of the requested per-call timeout and the time left before the deadline.
     */
    public Duration bound(Duration callTimeout) {
        Duration left = remaining();
        return callTimeout.compareTo(left) <= 0 ? callTimeout : left;
    }
}
