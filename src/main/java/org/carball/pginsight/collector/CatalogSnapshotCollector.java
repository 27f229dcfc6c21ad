package org.carball.pginsight.collector;

import lombok.extern.slf4j.Slf4j;
import org.carball.pginsight.db.DatabaseSession;
import org.carball.pginsight.db.Row;
import org.carball.pginsight.exception.QueryFailedException;
import org.carball.pginsight.model.snapshot.CatalogSnapshot;
import org.carball.pginsight.model.snapshot.IndexStat;
import org.carball.pginsight.model.snapshot.TableStat;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads table sizes and the index inventory of one database into a {@link CatalogSnapshot}.
 */
@Slf4j
public class CatalogSnapshotCollector {

    static final Duration QUERY_TIMEOUT = Duration.ofSeconds(10);

    private static final String USER_SCHEMAS = """
            not in ('pg_catalog', 'information_schema')
              and %1$s not like 'pg_toast%%'
              and %1$s not like 'pg_temp_%%'""";

    static final String TABLE_STATS = """
            select schemaname, relname, seq_scan, idx_scan, n_live_tup, n_dead_tup,
                   pg_total_relation_size(format('%%I.%%I', schemaname, relname)) as size_bytes
            from pg_stat_all_tables
            where schemaname %s""".formatted(USER_SCHEMAS.formatted("schemaname"));

    static final String CLASS_TABLES = """
            select n.nspname as schemaname, c.relname,
                   0::bigint as seq_scan, 0::bigint as idx_scan,
                   coalesce(c.reltuples::bigint, 0) as n_live_tup, 0::bigint as n_dead_tup,
                   pg_total_relation_size(c.oid) as size_bytes
            from pg_class c
            join pg_namespace n on n.oid = c.relnamespace
            where c.relkind in ('r', 'm', 'p')
              and n.nspname %s
            order by size_bytes desc
            limit 1000""".formatted(USER_SCHEMAS.formatted("n.nspname"));

    static final String INDEX_STATS = """
            select s.schemaname, s.relname, s.indexrelname, s.idx_scan,
                   pg_relation_size(ci.oid) as size_bytes,
                   pg_get_indexdef(ci.oid) as definition
            from pg_stat_all_indexes s
            join pg_class ci on ci.oid = s.indexrelid
            where s.schemaname %s""".formatted(USER_SCHEMAS.formatted("s.schemaname"));

    /**
     * Collects tables and indexes of the session's database. On the primary database, tables
     * missing from the statistics view are backfilled from pg_class.
     *
     * @return messages for the parts that could not be read
     */
    public List<String> collect(DatabaseSession session, CatalogSnapshot catalog, boolean backfill) {
        String database = session.databaseName();
        List<String> errors = new ArrayList<>();

        List<TableStat> tables = new ArrayList<>();
        try {
            tables.addAll(readTables(session, TABLE_STATS, database));
        } catch (QueryFailedException e) {
            log.debug("Table statistics unavailable for '{}': {}", database, e.getMessage());
            errors.add(String.format("db '%s' tables: %s", database, e.getMessage()));
        }

        if (backfill) {
            try {
                List<TableStat> fromClass = readTables(session, CLASS_TABLES, database);
                Set<String> present = new HashSet<>();
                tables.forEach(t -> present.add(t.qualifiedName()));
                for (TableStat table : fromClass) {
                    if (present.add(table.qualifiedName())) {
                        tables.add(table);
                    }
                }
            } catch (QueryFailedException e) {
                log.debug("pg_class table listing unavailable for '{}': {}", database, e.getMessage());
            }
        }
        tables.forEach(catalog::addTable);

        try {
            for (Row row : session.query(INDEX_STATS, QUERY_TIMEOUT)) {
                catalog.addIndex(IndexStat.builder()
                        .database(database)
                        .schema(row.getString("schemaname"))
                        .table(row.getString("relname"))
                        .name(row.getString("indexrelname"))
                        .scans(row.getLong("idx_scan"))
                        .sizeBytes(row.getLong("size_bytes"))
                        .definition(row.getString("definition"))
                        .build());
            }
        } catch (QueryFailedException e) {
            log.debug("Index statistics unavailable for '{}': {}", database, e.getMessage());
            errors.add(String.format("db '%s' indexes: %s", database, e.getMessage()));
        }

        log.debug("Catalog snapshot of '{}': {} tables, {} indexes", database,
                catalog.getTables().stream().filter(t -> database.equals(t.getDatabase())).count(),
                catalog.getIndexes().stream().filter(i -> database.equals(i.getDatabase())).count());
        return errors;
    }

    private static List<TableStat> readTables(DatabaseSession session, String sql, String database)
            throws QueryFailedException {
        List<TableStat> tables = new ArrayList<>();
        for (Row row : session.query(sql, QUERY_TIMEOUT)) {
            tables.add(TableStat.builder()
                    .database(database)
                    .schema(row.getString("schemaname"))
                    .name(row.getString("relname"))
                    .seqScans(row.getLong("seq_scan"))
                    .idxScans(row.getLong("idx_scan"))
                    .liveRows(row.getLong("n_live_tup"))
                    .deadRows(row.getLong("n_dead_tup"))
                    .sizeBytes(row.getLong("size_bytes"))
                    .build());
        }
        return tables;
    }
}
