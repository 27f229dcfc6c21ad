package org.carball.pginsight.collector;

import lombok.extern.slf4j.Slf4j;
import org.carball.pginsight.db.DatabaseSession;
import org.carball.pginsight.db.Row;
import org.carball.pginsight.exception.QueryFailedException;
import org.carball.pginsight.model.capability.StatsCapability;
import org.carball.pginsight.model.capability.TimeColumns;
import org.carball.pginsight.model.collection.CollectionResult;
import org.carball.pginsight.model.statement.RankedStatements;
import org.carball.pginsight.model.statement.RankingOrder;
import org.carball.pginsight.model.statement.Statement;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Fetches the ranked statement lists from pg_stat_statements. A list that cannot be read
 * under either time-column variant is left empty.
 */
@Slf4j
public class StatementRanker {

    public static final int DEFAULT_ROW_LIMIT = 20;

    static final Duration QUERY_TIMEOUT = Duration.ofSeconds(10);
    private static final List<String> UTILITY_PREFIXES = List.of("BEGIN", "COMMIT", "DISCARD ALL");

    private final RankingQueryBuilder queryBuilder;
    private final int rowLimit;

    public StatementRanker() {
        this(new RankingQueryBuilder(), DEFAULT_ROW_LIMIT);
    }

    public StatementRanker(RankingQueryBuilder queryBuilder, int rowLimit) {
        this.queryBuilder = queryBuilder;
        this.rowLimit = rowLimit > 0 ? rowLimit : DEFAULT_ROW_LIMIT;
    }

    public RankedStatements rank(DatabaseSession session, StatsCapability capability, StatsWindow window) {
        RankedStatements ranked = RankedStatements.empty();
        ranked.setStatsResetTime(window.resetTime());
        ranked.setStatsWindowAge(window.age());
        if (!capability.available()) {
            return ranked;
        }

        VariantLock variant = new VariantLock(capability.preferredTimeColumns());
        ranked.put(RankingOrder.TOTAL_TIME, fetch(session, capability, RankingOrder.TOTAL_TIME, variant));
        if (capability.ioTimeColumns()) {
            ranked.put(RankingOrder.CPU_APPROX, fetch(session, capability, RankingOrder.CPU_APPROX, variant));
            ranked.put(RankingOrder.IO_TIME, fetch(session, capability, RankingOrder.IO_TIME, variant));
        } else if (capability.blockColumns()) {
            ranked.put(RankingOrder.IO_BLOCKS, fetch(session, capability, RankingOrder.IO_BLOCKS, variant));
        }
        ranked.put(RankingOrder.CALLS, fetch(session, capability, RankingOrder.CALLS, variant));

        double hours = window.hours();
        if (hours > 0) {
            ranked.all().forEach(s -> s.setCallsPerHour(s.getCalls() / hours));
        }

        log.debug("Ranked statements: {} by total time, {} by calls",
                ranked.getTopByTotalTime().size(), ranked.getTopByCalls().size());
        return ranked;
    }

    private List<Statement> fetch(DatabaseSession session, StatsCapability capability,
                                  RankingOrder order, VariantLock variant) {
        CollectionResult<List<Statement>> result = fetchVariant(session, capability, order, variant.current);
        if (!result.isCollected() && !variant.locked) {
            TimeColumns fallback = variant.current.other();
            log.debug("{} failed with {} columns, retrying with {}", order.getDisplayName(), variant.current, fallback);
            result = fetchVariant(session, capability, order, fallback);
            if (result.isCollected()) {
                variant.current = fallback;
            }
        }
        if (result.isCollected()) {
            variant.locked = true;
            return result.orElse(new ArrayList<>());
        }
        log.debug("{} unavailable: {}", order.getDisplayName(), result.reason());
        return new ArrayList<>();
    }

    private CollectionResult<List<Statement>> fetchVariant(DatabaseSession session, StatsCapability capability,
                                                           RankingOrder order, TimeColumns columns) {
        String sql = queryBuilder.build(capability, order, columns, rowLimit);
        try {
            List<Statement> statements = new ArrayList<>();
            for (Row row : session.query(sql, QUERY_TIMEOUT)) {
                Statement statement = toStatement(row, capability);
                if (!isUtility(statement.getQuery())) {
                    statements.add(statement);
                }
            }
            return CollectionResult.collected(statements);
        } catch (QueryFailedException e) {
            return CollectionResult.failed(e);
        }
    }

    static Statement toStatement(Row row, StatsCapability capability) {
        Statement statement = new Statement(
                row.getString("query"),
                row.getDouble("calls"),
                row.getDouble("total_time"),
                row.getDouble("mean_time"),
                row.getDouble("rows"));

        if (capability.ioTimeColumns()) {
            statement.setBlkReadTime(row.getDouble("blk_read_time"));
            statement.setBlkWriteTime(row.getDouble("blk_write_time"));
            statement.setIoTime(statement.getBlkReadTime() + statement.getBlkWriteTime());
            statement.setCpuTime(statement.getTotalTime() - statement.getIoTime());
        } else {
            statement.setIoTime(0);
            statement.setCpuTime(statement.getTotalTime());
        }

        if (capability.blockColumns()) {
            statement.setSharedBlksRead(row.getDouble("shared_blks_read"));
            statement.setSharedBlksWritten(row.getDouble("shared_blks_written"));
            statement.setLocalBlksRead(row.getDouble("local_blks_read"));
            statement.setLocalBlksWritten(row.getDouble("local_blks_written"));
            statement.setTempBlksRead(row.getDouble("temp_blks_read"));
            statement.setTempBlksWritten(row.getDouble("temp_blks_written"));
        }
        return statement;
    }

    static boolean isUtility(String query) {
        if (query == null) {
            return false;
        }
        String upper = query.trim().toUpperCase(Locale.ROOT);
        return UTILITY_PREFIXES.stream().anyMatch(upper::startsWith);
    }

    // Time-column variant in use for the run; fixed once any list has been read
    private static final class VariantLock {
        private TimeColumns current;
        private boolean locked;

        private VariantLock(TimeColumns preferred) {
            this.current = preferred;
        }
    }
}
