package org.carball.pginsight.explain;

import org.carball.pginsight.model.statement.PlanAdvice;
import org.carball.pginsight.model.statement.RankedStatements;
import org.carball.pginsight.model.statement.Statement;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

public class ExplainBudgeterTest {

    private final List<String> requested = new ArrayList<>();

    private final PlanCollector alwaysAdvises = (statement, ordinal) -> {
        requested.add(statement.getQuery());
        return Optional.of(advice());
    };

    @Test
    void shouldExplainOnlyReadOnlyShapesAndDeduplicate() {
        // Given
        List<Statement> statements = List.of(
                statement("select * from a", 1, 1),
                statement("UPDATE a SET x = 1", 1, 1),
                statement("select * from a", 1, 1),
                statement("  with t as (select 1) select * from t", 1, 1),
                statement("insert into a values (1)", 1, 1),
                statement("", 1, 1));

        // When
        List<Statement> explained = new ExplainBudgeter(10).select(statements, alwaysAdvises);

        // Then
        assertThat(requested).containsExactly("select * from a", "  with t as (select 1) select * from t");
        assertThat(explained).hasSize(2);
        assertThat(statements.get(1).hasAdvice()).isFalse();
        assertThat(statements.get(2).hasAdvice()).isFalse();
    }

    @Test
    void shouldStopAtPrimaryLimitWhenNothingIsSuspect() {
        // Given - twelve quick statements, primary limit ten
        List<Statement> statements = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            statements.add(statement("select " + i, 10, 1.0));
        }

        // When
        List<Statement> explained = new ExplainBudgeter(10).select(statements, alwaysAdvises);

        // Then
        assertThat(explained).hasSize(10);
        assertThat(requested).hasSize(10);
        assertThat(statements.get(10).isNeedsAttention()).isFalse();
    }

    @Test
    void shouldAllowAtMostFiveSuspectOutliersBeyondPrimaryLimit() {
        // Given - ten quick statements followed by seven slow ones
        List<Statement> statements = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            statements.add(statement("select fast_" + i, 10, 1.0));
        }
        for (int i = 0; i < 7; i++) {
            statements.add(statement("select slow_" + i, 10, 25.0));
        }

        // When
        List<Statement> explained = new ExplainBudgeter(10).select(statements, alwaysAdvises);

        // Then
        assertThat(explained).hasSize(15);
        assertThat(requested).contains("select slow_4").doesNotContain("select slow_5", "select slow_6");
    }

    @Test
    void shouldSkipNonSuspectsOnceThePrimaryCounterIsSpent() {
        // Given
        List<Statement> statements = List.of(
                statement("select a", 10, 1.0),
                statement("select b", 10, 1.0),
                statement("select c", 500, 6.0),
                statement("select d", 1500, 6.0));

        // When
        new ExplainBudgeter(2).select(statements, alwaysAdvises);

        // Then
        assertThat(requested).containsExactly("select a", "select b", "select d");
    }

    @Test
    void shouldNotChargeBudgetWhenNoAdviceIsCollected() {
        // Given - collector fails for the first statement
        List<Statement> statements = List.of(
                statement("select broken", 1, 1),
                statement("select a", 1, 1),
                statement("select b", 1, 1));
        PlanCollector failsFirst = (statement, ordinal) -> {
            requested.add(statement.getQuery());
            return ordinal == 0 ? Optional.empty() : Optional.of(advice());
        };

        // When
        List<Statement> explained = new ExplainBudgeter(2).select(statements, failsFirst);

        // Then
        assertThat(explained).extracting(Statement::getQuery).containsExactly("select a", "select b");
        assertThat(statements.get(0).isNeedsAttention()).isFalse();
    }

    @Test
    void shouldIgnoreEmptyAdvice() {
        // Given
        List<Statement> statements = List.of(statement("select a", 1, 1));

        // When
        List<Statement> explained = new ExplainBudgeter(2)
                .select(statements, (statement, ordinal) -> Optional.of(new PlanAdvice()));

        // Then
        assertThat(explained).isEmpty();
        assertThat(statements.get(0).hasAdvice()).isFalse();
    }

    @Test
    void shouldBudgetEachListSeparately() {
        // Given - the same text tops both lists
        RankedStatements ranked = RankedStatements.empty();
        ranked.setTopByTotalTime(new ArrayList<>(List.of(statement("select * from a", 10, 50))));
        ranked.setTopByCalls(new ArrayList<>(List.of(statement("select * from a", 10, 50))));

        // When
        List<Statement> explained = new ExplainBudgeter(1).explainRanked(ranked, alwaysAdvises);

        // Then
        assertThat(explained).hasSize(2);
        assertThat(requested).containsExactly("select * from a", "select * from a");
    }

    @Test
    void shouldClassifySuspectStatements() {
        assertThat(ExplainBudgeter.isSuspect(statement("q", 1, 20.0))).isTrue();
        assertThat(ExplainBudgeter.isSuspect(statement("q", 1000, 5.0))).isTrue();
        assertThat(ExplainBudgeter.isSuspect(statement("q", 999, 5.0))).isFalse();
        assertThat(ExplainBudgeter.isSuspect(statement("q", 100_000, 4.9))).isFalse();
    }

    private static Statement statement(String query, double calls, double meanTime) {
        return new Statement(query, calls, calls * meanTime, meanTime, calls);
    }

    private static PlanAdvice advice() {
        PlanAdvice advice = new PlanAdvice();
        advice.setPlan("Result  (cost=0.00..0.01 rows=1 width=4)");
        return advice;
    }
}
