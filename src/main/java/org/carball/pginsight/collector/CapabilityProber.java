package org.carball.pginsight.collector;

import lombok.extern.slf4j.Slf4j;
import org.carball.pginsight.db.DatabaseSession;
import org.carball.pginsight.db.Row;
import org.carball.pginsight.db.SqlQuoting;
import org.carball.pginsight.exception.QueryFailedException;
import org.carball.pginsight.model.capability.StatsCapability;

import java.time.Duration;
import java.util.List;

/**
 * Detects pg_stat_statements and which of its column families the server exposes.
 * Every probe is best-effort: a failed probe counts as "not present".
 */
@Slf4j
public class CapabilityProber {

    static final Duration PROBE_TIMEOUT = Duration.ofSeconds(5);

    static final String EXTENSION_PROBE =
            "select exists(select 1 from pg_extension where extname = 'pg_stat_statements')";

    static final String RELATION_PROBE = """
            select exists(
                select 1 from pg_class c join pg_namespace n on n.oid = c.relnamespace
                where c.relname = 'pg_stat_statements')""";

    static final String FUNCTION_PROBE = """
            select exists(
                select 1 from pg_proc p join pg_namespace n on n.oid = p.pronamespace
                where p.proname in ('pg_stat_statements_reset', 'pg_stat_statements'))""";

    static final String SELECT_PROBE = "select 1 from pg_stat_statements limit 1";

    static final String SCHEMA_LOOKUP = """
            select n.nspname from pg_class c join pg_namespace n on n.oid = c.relnamespace
            where c.relname = 'pg_stat_statements' limit 1""";

    static final List<String> MODERN_TIME_COLUMNS = List.of("total_exec_time", "mean_exec_time");
    static final List<String> IO_TIME_COLUMNS = List.of("blk_read_time", "blk_write_time");
    static final List<String> BLOCK_COLUMNS = List.of(
            "shared_blks_read", "shared_blks_written",
            "local_blks_read", "local_blks_written",
            "temp_blks_read", "temp_blks_written");

    public StatsCapability probe(DatabaseSession session) {
        if (!detectRelation(session)) {
            log.warn("pg_stat_statements not found in database '{}'; query-level analysis will be skipped",
                    session.databaseName());
            return StatsCapability.unavailable();
        }

        String schema = resolveSchema(session);
        boolean modern = hasColumns(session, schema, MODERN_TIME_COLUMNS);
        boolean io = hasColumns(session, schema, IO_TIME_COLUMNS);
        boolean blocks = hasColumns(session, schema, BLOCK_COLUMNS);

        StatsCapability capability = new StatsCapability(true, schema, modern, io, blocks);
        log.info("pg_stat_statements detected (schema: {}, exec time columns: {}, I/O timing: {}, block counters: {})",
                schema.isEmpty() ? "search_path" : schema, modern, io, blocks);
        return capability;
    }

    private boolean detectRelation(DatabaseSession session) {
        if (exists(session, EXTENSION_PROBE)) {
            log.debug("pg_stat_statements found via pg_extension");
            return true;
        }
        if (exists(session, RELATION_PROBE)) {
            log.debug("pg_stat_statements found via pg_class");
            return true;
        }
        if (exists(session, FUNCTION_PROBE)) {
            log.debug("pg_stat_statements found via pg_proc");
            return true;
        }
        try {
            session.query(SELECT_PROBE, PROBE_TIMEOUT);
            log.debug("pg_stat_statements found via direct select");
            return true;
        } catch (QueryFailedException e) {
            log.debug("Direct pg_stat_statements probe failed: {}", e.getMessage());
            return false;
        }
    }

    private String resolveSchema(DatabaseSession session) {
        try {
            List<Row> rows = session.query(SCHEMA_LOOKUP, PROBE_TIMEOUT);
            if (!rows.isEmpty() && rows.get(0).first() != null) {
                return rows.get(0).first().toString();
            }
        } catch (QueryFailedException e) {
            log.debug("Could not resolve pg_stat_statements schema: {}", e.getMessage());
        }
        return "";
    }

    private boolean hasColumns(DatabaseSession session, String schema, List<String> columns) {
        return exists(session, columnProbe(schema, columns));
    }

    static String columnProbe(String schema, List<String> columns) {
        StringBuilder names = new StringBuilder();
        for (String column : columns) {
            if (names.length() > 0) {
                names.append(", ");
            }
            names.append(SqlQuoting.quoteLiteral(column));
        }
        String schemaFilter = schema == null || schema.isEmpty()
                ? ""
                : "table_schema = " + SqlQuoting.quoteLiteral(schema) + " and ";
        return "select exists(select 1 from information_schema.columns where " + schemaFilter
                + "table_name = 'pg_stat_statements' and column_name in (" + names + ")"
                + " group by table_schema, table_name having count(distinct column_name) = " + columns.size() + ")";
    }

    private boolean exists(DatabaseSession session, String sql) {
        try {
            List<Row> rows = session.query(sql, PROBE_TIMEOUT);
            if (rows.isEmpty()) {
                return false;
            }
            Object value = rows.get(0).first();
            return Boolean.TRUE.equals(value) || "t".equals(String.valueOf(value)) || "true".equals(String.valueOf(value));
        } catch (QueryFailedException e) {
            log.debug("Capability probe failed: {}", e.getMessage());
            return false;
        }
    }
}
