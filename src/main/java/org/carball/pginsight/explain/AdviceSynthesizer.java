package org.carball.pginsight.explain;

import org.carball.pginsight.model.snapshot.CatalogSnapshot;
import org.carball.pginsight.model.snapshot.TableStat;
import org.carball.pginsight.model.statement.PlanAdvice;

import java.util.List;
import java.util.Optional;

/**
 * Cross-references plan signals with the catalog snapshot to produce highlights and suggestions.
 */
public class AdviceSynthesizer {

    static final long LARGE_TABLE_ROWS = 100_000;

    public PlanAdvice synthesize(List<String> planLines, PlanSignals signals, CatalogSnapshot catalog) {
        PlanAdvice advice = new PlanAdvice();
        advice.setPlan(String.join("\n", planLines));

        addHighlights(advice, signals);

        for (String table : signals.seqScanTables()) {
            Optional<TableStat> stat = catalog.findTable(table);
            if (stat.isEmpty()) {
                continue;
            }
            if (stat.get().getLiveRows() > LARGE_TABLE_ROWS) {
                advice.addSuggestion(String.format(
                        "Large table %s scanned sequentially: consider adding or using an index on predicate/join columns.",
                        table));
            } else {
                advice.addSuggestion(String.format(
                        "Sequential scan on %s: verify it is intentional (small table) or add an index.", table));
            }
            advice.setCanBeIndexed(true);

            if (!catalog.hasAnyIndex(table)) {
                advice.addSuggestion(String.format(
                        "No indexes found on %s: create indexes on frequently filtered or joined columns.", table));
            }
        }
        if (signals.bitmap()) {
            advice.addSuggestion("Consider composite/covering indexes to reduce Bitmap Heap rechecks when appropriate.");
            advice.setCanBeIndexed(true);
        }
        if (signals.sort()) {
            advice.addSuggestion("Add or adjust an index matching ORDER BY to avoid the Sort when appropriate; review work_mem as needed.");
            advice.setCanBeIndexed(true);
        }
        if (signals.hasJoin()) {
            advice.addSuggestion("Ensure join keys are indexed on both sides (consider composite indexes for multi-column joins).");
            advice.setCanBeIndexed(true);
        }
        if (signals.cte()) {
            advice.addSuggestion("If the CTE is not reused, consider inlining it (PostgreSQL may materialize it depending on version/settings).");
            advice.setCanBeRefactored(true);
        }
        if (signals.hasSeqScans() && !advice.isCanBeIndexed()) {
            advice.setCanBeRefactored(true);
            advice.addSuggestion("Query uses sequential scans but no clear index path was found. Consider refactoring the query for better performance.");
        }
        return advice;
    }

    private static void addHighlights(PlanAdvice advice, PlanSignals signals) {
        for (String table : signals.seqScanTables()) {
            advice.addHighlight("Seq Scan on " + table);
        }
        if (signals.bitmap()) {
            advice.addHighlight("Bitmap scan present");
        }
        if (signals.sort()) {
            advice.addHighlight("Explicit Sort in plan");
        }
        if (signals.hasJoin()) {
            advice.addHighlight(signals.join().getLabel());
        }
        if (signals.parallel()) {
            advice.addHighlight("Parallel operation(s)");
        }
        if (signals.cte()) {
            advice.addHighlight("CTE in plan");
        }
    }
}
