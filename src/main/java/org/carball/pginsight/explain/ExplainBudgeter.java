package org.carball.pginsight.explain;

import lombok.extern.slf4j.Slf4j;
import org.carball.pginsight.model.statement.PlanAdvice;
import org.carball.pginsight.model.statement.RankedStatements;
import org.carball.pginsight.model.statement.Statement;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Decides which ranked statements get an estimated plan. Each list gets its own
 * {@link ExplainBudget}; only read-only shapes are ever explained.
 */
@Slf4j
public class ExplainBudgeter {

    static final double SUSPECT_MEAN_MS = 20.0;
    static final double BUSY_MEAN_MS = 5.0;
    static final double BUSY_CALLS = 1000.0;

    private final int primaryLimit;

    public ExplainBudgeter() {
        this(ExplainBudget.DEFAULT_PRIMARY_LIMIT);
    }

    public ExplainBudgeter(int primaryLimit) {
        this.primaryLimit = primaryLimit <= 0 ? ExplainBudget.DEFAULT_PRIMARY_LIMIT : primaryLimit;
    }

    /**
     * Explains candidates from the total-time list, then from the calls list.
     */
    public List<Statement> explainRanked(RankedStatements ranked, PlanCollector collector) {
        List<Statement> explained = new ArrayList<>(select(ranked.getTopByTotalTime(), collector));
        explained.addAll(select(ranked.getTopByCalls(), collector));
        return explained;
    }

    /**
     * @return the statements whose advice was attached, in list order
     */
    public List<Statement> select(List<Statement> statements, PlanCollector collector) {
        ExplainBudget budget = new ExplainBudget(primaryLimit);
        List<Statement> selected = new ArrayList<>();

        for (int i = 0; i < statements.size(); i++) {
            if (!budget.hasRoom()) {
                break;
            }
            Statement statement = statements.get(i);
            String text = statement.getQuery() == null ? "" : statement.getQuery().trim();
            if (text.isEmpty() || !budget.markSeen(text)) {
                continue;
            }
            if (!isSafeShape(text)) {
                continue;
            }
            boolean suspect = isSuspect(statement);
            if (budget.primaryExhausted() && !suspect) {
                continue;
            }

            Optional<PlanAdvice> advice = collector.collect(statement, i);
            if (advice.isPresent() && !advice.get().isEmpty()) {
                statement.attachAdvice(advice.get());
                budget.consume();
                selected.add(statement);
            }
        }

        log.debug("Explained {} of {} statements (primary {}/{}, outliers {}/{})",
                selected.size(), statements.size(), budget.getPrimaryUsed(), budget.getPrimaryLimit(),
                budget.getOutliersUsed(), ExplainBudget.OUTLIER_CAP);
        return selected;
    }

    static boolean isSafeShape(String trimmedQuery) {
        String upper = trimmedQuery.toUpperCase(Locale.ROOT);
        return upper.startsWith("SELECT") || upper.startsWith("WITH");
    }

    static boolean isSuspect(Statement statement) {
        return statement.getMeanTime() >= SUSPECT_MEAN_MS
                || (statement.getMeanTime() >= BUSY_MEAN_MS && statement.getCalls() >= BUSY_CALLS);
    }
}
