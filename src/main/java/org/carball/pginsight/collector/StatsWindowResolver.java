package org.carball.pginsight.collector;

import lombok.extern.slf4j.Slf4j;
import org.carball.pginsight.config.Durations;
import org.carball.pginsight.db.DatabaseSession;
import org.carball.pginsight.db.Row;
import org.carball.pginsight.db.SqlQuoting;
import org.carball.pginsight.exception.QueryFailedException;
import org.carball.pginsight.model.capability.StatsCapability;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Slf4j
public class StatsWindowResolver {

    static final Duration QUERY_TIMEOUT = Duration.ofSeconds(5);
    static final String DATABASE_RESET =
            "select stats_reset from pg_stat_database where datname = current_database()";

    private final Clock clock;

    public StatsWindowResolver() {
        this(Clock.systemUTC());
    }

    public StatsWindowResolver(Clock clock) {
        this.clock = clock;
    }

    /**
     * Resolves the statistics window. A configured {@code statsSince} that starts after the
     * last reset marks the window as skipped. The info view is read from the schema the
     * extension was found in.
     */
    public StatsWindow resolve(DatabaseSession session, StatsCapability capability, Duration statsSince) {
        Instant now = clock.instant();
        Instant reset = readReset(session, statementsInfoReset(capability));
        if (reset == null) {
            reset = readReset(session, DATABASE_RESET);
        }
        if (reset == null) {
            log.debug("Statistics reset time unknown");
            return StatsWindow.unknown();
        }

        Duration age = Duration.between(reset, now);
        if (statsSince != null) {
            Instant windowStart = now.minus(statsSince);
            if (windowStart.isAfter(reset)) {
                String reason = String.format("pg_stat_statements data is older than the requested window (%s).",
                        Durations.format(statsSince));
                log.info("Skipping statement collection: {}", reason);
                return new StatsWindow(reset, age, reason);
            }
        }
        return new StatsWindow(reset, age, null);
    }

    static String statementsInfoReset(StatsCapability capability) {
        String view = capability != null && capability.hasSchema()
                ? SqlQuoting.quoteIdent(capability.schema()) + ".pg_stat_statements_info"
                : "pg_stat_statements_info";
        return "select stats_reset from " + view;
    }

    private Instant readReset(DatabaseSession session, String sql) {
        try {
            List<Row> rows = session.query(sql, QUERY_TIMEOUT);
            if (rows.isEmpty()) {
                return null;
            }
            return rows.get(0).getInstant("stats_reset");
        } catch (QueryFailedException e) {
            log.debug("Could not read stats reset time: {}", e.getMessage());
            return null;
        }
    }
}
