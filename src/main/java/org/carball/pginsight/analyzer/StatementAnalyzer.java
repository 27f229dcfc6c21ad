package org.carball.pginsight.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.pginsight.config.Durations;
import org.carball.pginsight.config.InsightThresholds;
import org.carball.pginsight.model.collection.CollectionSnapshot;
import org.carball.pginsight.model.finding.Analysis;
import org.carball.pginsight.model.finding.Finding;
import org.carball.pginsight.model.finding.Severity;
import org.carball.pginsight.model.statement.PlanAdvice;
import org.carball.pginsight.model.statement.RankedStatements;
import org.carball.pginsight.model.statement.Statement;

import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Turns collected statement statistics and plan advice into findings. Advice is only read.
 */
@Slf4j
public class StatementAnalyzer {

    private static final String SEQ_SCAN_PREFIX = "Seq Scan on ";
    private static final DateTimeFormatter RESET_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'").withZone(ZoneOffset.UTC);

    private final InsightThresholds thresholds;

    public StatementAnalyzer() {
        this(InsightThresholds.defaults());
    }

    public StatementAnalyzer(InsightThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public Analysis analyze(CollectionSnapshot snapshot) {
        Analysis analysis = new Analysis();
        RankedStatements statements = snapshot.getStatements();

        if (statements.isAvailable()) {
            addWindowInfo(analysis, statements);
            addTopQueryInfo(analysis, statements);
            addPlanRecommendations(analysis, statements.getTopByTotalTime());
        } else if (statements.getSkippedReason() != null) {
            analysis.add(Finding.builder()
                    .title("Query statistics skipped")
                    .severity(Severity.INFO)
                    .description(statements.getSkippedReason())
                    .action("Widen --stats-since or reset pg_stat_statements to start a fresh window.")
                    .build());
        } else if (snapshot.getCapability().available()) {
            analysis.add(Finding.builder()
                    .title("pg_stat_statements installed")
                    .severity(Severity.INFO)
                    .description("Extension is present but returned no rows for top queries (possibly recently reset or limited visibility).")
                    .action("Run workload, ensure pg_stat_statements is preloaded and tracking settings are appropriate; verify role has access.")
                    .build());
        } else {
            analysis.add(Finding.builder()
                    .title("Query-level analysis limited")
                    .severity(Severity.INFO)
                    .description("pg_stat_statements not available; only coarse-grained insights reported.")
                    .action("Install and configure pg_stat_statements for detailed top queries.")
                    .build());
            analysis.add(Finding.builder()
                    .title("Install pg_stat_statements")
                    .severity(Severity.RECOMMENDATION)
                    .code("install-pgss")
                    .description("pg_stat_statements is not installed. Without it, detailed query performance analysis is limited.")
                    .action("CREATE EXTENSION IF NOT EXISTS pg_stat_statements; and set shared_preload_libraries='pg_stat_statements' then restart.")
                    .build());
        }

        if (!snapshot.getErrors().isEmpty()) {
            analysis.add(Finding.builder()
                    .title("Some statistics could not be collected")
                    .severity(Severity.WARNING)
                    .code("statement-collection-errors")
                    .description(String.format("%d collection step(s) failed: %s",
                            snapshot.getErrors().size(), String.join("; ", snapshot.getErrors())))
                    .action("Check the role's privileges (pg_read_all_stats / pg_monitor) and connectivity to the listed databases.")
                    .build());
        }

        log.debug("Statement analysis produced {} findings", analysis.size());
        return analysis;
    }

    /**
     * Drops recommendations whose code, or slugified title when no code is set, is listed.
     */
    public static Analysis suppress(Analysis analysis, Collection<String> codes) {
        if (codes == null || codes.isEmpty()) {
            return analysis;
        }
        Set<String> suppressed = codes.stream()
                .map(c -> c.trim().toLowerCase(Locale.ROOT))
                .filter(c -> !c.isEmpty())
                .collect(Collectors.toSet());

        List<Finding> kept = analysis.getRecommendations().stream()
                .filter(f -> !suppressed.contains(codeOf(f)))
                .collect(Collectors.toList());
        int dropped = analysis.getRecommendations().size() - kept.size();
        if (dropped > 0) {
            log.info("Suppressed {} recommendation(s)", dropped);
        }
        analysis.setRecommendations(kept);
        return analysis;
    }

    static String codeOf(Finding finding) {
        String code = finding.getCode();
        return code == null || code.isEmpty() ? slugify(finding.getTitle()) : code.toLowerCase(Locale.ROOT);
    }

    static String slugify(String text) {
        if (text == null) {
            return "";
        }
        String slug = text.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
        return slug.replaceAll("^-+|-+$", "");
    }

    private void addWindowInfo(Analysis analysis, RankedStatements statements) {
        if (statements.getStatsResetTime() == null) {
            return;
        }
        analysis.add(Finding.builder()
                .title("Query stats window")
                .severity(Severity.INFO)
                .description(String.format("pg_stat_statements data covers the last %s (since %s)",
                        Durations.format(roundToSeconds(statements.getStatsWindowAge())),
                        RESET_FORMAT.format(statements.getStatsResetTime())))
                .action("Run `SELECT pg_stat_statements_reset()` to clear stats if needed.")
                .build());
    }

    private void addTopQueryInfo(Analysis analysis, RankedStatements statements) {
        if (statements.getTopByTotalTime().isEmpty()) {
            return;
        }
        Statement top = statements.getTopByTotalTime().get(0);
        StringBuilder description = new StringBuilder(String.format("Calls: %,.0f, Total: %s",
                top.getCalls(), Durations.format(roundToSeconds(Duration.ofMillis((long) top.getTotalTime())))));
        if (top.getCallsPerHour() > 0) {
            description.append(String.format(", Calls/hr: %.1f", top.getCallsPerHour()));
        }
        analysis.add(Finding.builder()
                .title("Top query by total time")
                .severity(Severity.INFO)
                .description(description.toString())
                .action("Review execution plan and caching. Consider increasing work_mem for heavy sorts/aggregations.")
                .build());
    }

    private void addPlanRecommendations(Analysis analysis, List<Statement> slowest) {
        Set<String> seqScanTables = new TreeSet<>();
        int indexable = 0;
        int refactorable = 0;
        boolean sorts = false;
        boolean joins = false;

        for (Statement statement : slowest) {
            PlanAdvice advice = statement.getAdvice();
            if (advice == null) {
                continue;
            }
            if (advice.isCanBeIndexed()) {
                indexable++;
            }
            if (advice.isCanBeRefactored()) {
                refactorable++;
            }
            for (String highlight : advice.getHighlights()) {
                String upper = highlight.toUpperCase(Locale.ROOT);
                if (upper.startsWith(SEQ_SCAN_PREFIX.toUpperCase(Locale.ROOT))) {
                    String table = highlight.substring(SEQ_SCAN_PREFIX.length()).trim();
                    if (!table.isEmpty()) {
                        seqScanTables.add(table);
                    }
                }
                sorts |= upper.contains("SORT");
                joins |= upper.contains("JOIN") || upper.contains("NESTED LOOP");
            }
        }

        if (!seqScanTables.isEmpty()) {
            List<String> shown = seqScanTables.stream()
                    .limit(Math.max(1, thresholds.getSeqScanTablesShown()))
                    .collect(Collectors.toList());
            analysis.add(Finding.builder()
                    .title("Slow queries use sequential scans")
                    .severity(Severity.RECOMMENDATION)
                    .code("slow-seq-scans")
                    .description("Sequential scans detected on: " + String.join(", ", shown))
                    .action("Create or refine indexes on selective WHERE and JOIN columns; analyze tables; ensure statistics are up to date.")
                    .build());
        }
        if (indexable > 0) {
            analysis.add(Finding.builder()
                    .title("Index improvements possible for slow queries")
                    .severity(Severity.RECOMMENDATION)
                    .code("slow-index-improve")
                    .description(String.format("%d slow queries could be improved with new or better indexes.", indexable))
                    .action("Run EXPLAIN on slow queries to identify missing indexes on columns used in WHERE clauses, JOINs, or ORDER BY.")
                    .build());
        }
        if (refactorable > 0) {
            analysis.add(Finding.builder()
                    .title("Query refactoring needed for slow queries")
                    .severity(Severity.RECOMMENDATION)
                    .code("slow-refactor")
                    .description(String.format("%d slow queries may need refactoring as indexes alone may not solve the performance issue.", refactorable))
                    .action("Analyze the execution plan to understand the cause. Consider rewriting the query or breaking it into smaller parts.")
                    .build());
        }
        if (sorts) {
            analysis.add(Finding.builder()
                    .title("Sorting in slow queries may lack index support")
                    .severity(Severity.RECOMMENDATION)
                    .code("slow-sorts")
                    .description("Plans include Sort nodes for top slow queries.")
                    .action("Add or adjust indexes matching ORDER BY leading columns to enable sorted index scans where appropriate.")
                    .build());
        }
        if (joins) {
            analysis.add(Finding.builder()
                    .title("Joins in slow queries may be missing indexes")
                    .severity(Severity.RECOMMENDATION)
                    .code("slow-joins")
                    .description("Join operations detected; missing or suboptimal indexes can cause hash/merge joins to spill or nested loops to scan many rows.")
                    .action("Ensure join key columns are indexed on both sides; consider composite indexes matching join + filter predicates.")
                    .build());
        }
    }

    private static Duration roundToSeconds(Duration duration) {
        return duration.toMillis() < 1000 ? duration : Duration.ofSeconds(Math.round(duration.toMillis() / 1000.0));
    }
}
