package org.carball.pginsight.explain;

import lombok.extern.slf4j.Slf4j;
import org.carball.pginsight.collector.StatementRanker;
import org.carball.pginsight.collector.StatsWindow;
import org.carball.pginsight.db.DatabaseSession;
import org.carball.pginsight.model.capability.StatsCapability;
import org.carball.pginsight.model.snapshot.CatalogSnapshot;
import org.carball.pginsight.model.statement.PlanAdvice;
import org.carball.pginsight.model.statement.RankedStatements;
import org.carball.pginsight.model.statement.Statement;

import java.util.List;
import java.util.Optional;

/**
 * Ranks statements, then explains a budgeted subset and attaches the resulting advice.
 * Runs sequentially over the one session it is given.
 */
@Slf4j
public class StatementInsightPipeline {

    private final StatementRanker ranker;
    private final ExplainBudgeter budgeter;
    private final PlanSignalExtractor extractor;
    private final AdviceSynthesizer synthesizer;

    public StatementInsightPipeline() {
        this(new StatementRanker(), new ExplainBudgeter(), new TextPlanSignalExtractor(), new AdviceSynthesizer());
    }

    public StatementInsightPipeline(StatementRanker ranker, ExplainBudgeter budgeter,
                                    PlanSignalExtractor extractor, AdviceSynthesizer synthesizer) {
        this.ranker = ranker;
        this.budgeter = budgeter;
        this.extractor = extractor;
        this.synthesizer = synthesizer;
    }

    public RankedStatements run(DatabaseSession session, StatsCapability capability,
                                CatalogSnapshot catalog, StatsWindow window) {
        if (!capability.available()) {
            log.debug("Statement statistics unavailable; skipping ranking and plan collection");
            return withWindow(RankedStatements.empty(), window);
        }
        if (window.isSkipped()) {
            RankedStatements skipped = withWindow(RankedStatements.empty(), window);
            skipped.setSkippedReason(window.skippedReason());
            return skipped;
        }

        RankedStatements ranked = ranker.rank(session, capability, window);
        if (!ranked.isAvailable()) {
            return ranked;
        }

        SafePlanExecutor executor = new SafePlanExecutor(session);
        List<Statement> explained = budgeter.explainRanked(ranked,
                (statement, ordinal) -> plan(executor, statement, ordinal, catalog));
        log.info("Collected plans for {} statements", explained.size());
        return ranked;
    }

    private Optional<PlanAdvice> plan(SafePlanExecutor executor, Statement statement, int ordinal,
                                      CatalogSnapshot catalog) {
        return executor.collect(statement.getQuery(), ordinal)
                .value()
                .filter(lines -> !lines.isEmpty())
                .map(lines -> synthesizer.synthesize(lines, extractor.extract(lines), catalog));
    }

    private static RankedStatements withWindow(RankedStatements ranked, StatsWindow window) {
        ranked.setStatsResetTime(window.resetTime());
        ranked.setStatsWindowAge(window.age());
        return ranked;
    }
}
