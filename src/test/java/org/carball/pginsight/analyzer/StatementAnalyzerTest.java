package org.carball.pginsight.analyzer;

import org.carball.pginsight.config.InsightThresholds;
import org.carball.pginsight.model.capability.StatsCapability;
import org.carball.pginsight.model.collection.CollectionSnapshot;
import org.carball.pginsight.model.finding.Analysis;
import org.carball.pginsight.model.finding.Finding;
import org.carball.pginsight.model.finding.Severity;
import org.carball.pginsight.model.statement.PlanAdvice;
import org.carball.pginsight.model.statement.RankedStatements;
import org.carball.pginsight.model.statement.Statement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class StatementAnalyzerTest {

    private StatementAnalyzer analyzer;
    private CollectionSnapshot snapshot;

    @BeforeEach
    void setUp() {
        analyzer = new StatementAnalyzer();
        snapshot = new CollectionSnapshot();
        snapshot.setCapability(new StatsCapability(true, "public", true, true, true));
    }

    @Test
    void shouldReportLimitedAnalysisWithoutExtension() {
        // Given
        snapshot.setCapability(StatsCapability.unavailable());

        // When
        Analysis analysis = analyzer.analyze(snapshot);

        // Then
        assertThat(analysis.getInfos()).extracting(Finding::getTitle).containsExactly("Query-level analysis limited");
        assertThat(analysis.getRecommendations()).extracting(Finding::getCode).containsExactly("install-pgss");
        assertThat(analysis.getRecommendations().get(0).getAction())
                .contains("CREATE EXTENSION IF NOT EXISTS pg_stat_statements")
                .contains("shared_preload_libraries");
    }

    @Test
    void shouldDropInstallRecommendationWhenSuppressed() {
        // Given
        snapshot.setCapability(StatsCapability.unavailable());

        // When
        Analysis analysis = StatementAnalyzer.suppress(analyzer.analyze(snapshot), List.of("install-pgss"));

        // Then
        assertThat(analysis.getRecommendations()).isEmpty();
        assertThat(analysis.getInfos()).extracting(Finding::getTitle).containsExactly("Query-level analysis limited");
    }

    @Test
    void shouldNotRecommendInstallWhenExtensionPresent() {
        // When
        Analysis analysis = analyzer.analyze(snapshot);

        // Then
        assertThat(analysis.getRecommendations()).extracting(Finding::getCode).doesNotContain("install-pgss");
    }

    @Test
    void shouldReportInstalledButEmptyStatistics() {
        // When
        Analysis analysis = analyzer.analyze(snapshot);

        // Then
        assertThat(analysis.getInfos()).extracting(Finding::getTitle).containsExactly("pg_stat_statements installed");
    }

    @Test
    void shouldReportSkippedWindow() {
        // Given
        RankedStatements skipped = RankedStatements.empty();
        skipped.setSkippedReason("pg_stat_statements data is older than the requested window (1d).");
        snapshot.setStatements(skipped);

        // When
        Analysis analysis = analyzer.analyze(snapshot);

        // Then
        assertThat(analysis.getInfos()).hasSize(1);
        assertThat(analysis.getInfos().get(0).getTitle()).isEqualTo("Query statistics skipped");
        assertThat(analysis.getInfos().get(0).getDescription()).contains("older than the requested window");
    }

    @Test
    void shouldDescribeWindowAndTopQuery() {
        // Given
        Statement top = new Statement("select * from orders", 12_000, 90_000, 7.5, 12_000);
        top.setCallsPerHour(500);
        snapshot.setStatements(ranked(top));
        snapshot.getStatements().setStatsResetTime(Instant.parse("2026-10-17T12:00:00Z"));
        snapshot.getStatements().setStatsWindowAge(Duration.ofHours(24));

        // When
        Analysis analysis = analyzer.analyze(snapshot);

        // Then
        assertThat(analysis.getInfos()).extracting(Finding::getTitle)
                .containsExactly("Query stats window", "Top query by total time");
        assertThat(analysis.getInfos().get(0).getDescription())
                .isEqualTo("pg_stat_statements data covers the last 1d (since 2026-10-17 12:00 UTC)");
        assertThat(analysis.getInfos().get(1).getDescription()).startsWith("Calls: ").contains("Total: 1m30s")
                .endsWith("Calls/hr: 500.0");
    }

    @Test
    void shouldAggregatePlanAdviceIntoRecommendations() {
        // Given
        Statement first = withAdvice("select 1", true, false, "Seq Scan on orders", "Explicit Sort in plan");
        Statement second = withAdvice("select 2", true, true, "Seq Scan on events", "Hash Join", "Seq Scan on orders");
        Statement plain = new Statement("select 3", 1, 1, 1, 1);
        snapshot.setStatements(ranked(first, second, plain));

        // When
        Analysis analysis = analyzer.analyze(snapshot);

        // Then
        assertThat(analysis.getRecommendations()).extracting(Finding::getCode)
                .containsExactly("slow-seq-scans", "slow-index-improve", "slow-refactor", "slow-sorts", "slow-joins");
        assertThat(analysis.getRecommendations().get(0).getDescription())
                .isEqualTo("Sequential scans detected on: events, orders");
        assertThat(analysis.getRecommendations().get(1).getDescription()).startsWith("2 slow queries");
        assertThat(analysis.getRecommendations().get(2).getDescription()).startsWith("1 slow queries");
    }

    @Test
    void shouldLimitListedSeqScanTables() {
        // Given
        analyzer = new StatementAnalyzer(InsightThresholds.builder().explainListCap(10).seqScanTablesShown(2)
                .rankedListLimit(20).build());
        snapshot.setStatements(ranked(withAdvice("select 1", true, false,
                "Seq Scan on c", "Seq Scan on a", "Seq Scan on b")));

        // When
        Analysis analysis = analyzer.analyze(snapshot);

        // Then
        assertThat(analysis.getRecommendations().get(0).getDescription()).isEqualTo("Sequential scans detected on: a, b");
    }

    @Test
    void shouldRecognizeNestedLoopAsJoin() {
        // Given
        snapshot.setStatements(ranked(withAdvice("select 1", false, false, "Nested Loop")));

        // When
        Analysis analysis = analyzer.analyze(snapshot);

        // Then
        assertThat(analysis.getRecommendations()).extracting(Finding::getCode).containsExactly("slow-joins");
    }

    @Test
    void shouldWarnAboutCollectionErrors() {
        // Given
        snapshot.addError("db 'billing': connection refused");

        // When
        Analysis analysis = analyzer.analyze(snapshot);

        // Then
        assertThat(analysis.getWarnings()).hasSize(1);
        assertThat(analysis.getWarnings().get(0).getCode()).isEqualTo("statement-collection-errors");
        assertThat(analysis.getWarnings().get(0).getDescription()).contains("db 'billing': connection refused");
    }

    @Test
    void shouldSuppressByCodeOrTitleSlug() {
        // Given
        Analysis analysis = new Analysis();
        analysis.add(recommendation("Slow queries use sequential scans", "slow-seq-scans"));
        analysis.add(recommendation("Sorting in slow queries may lack index support", "slow-sorts"));
        analysis.add(recommendation("Vacuum: Dead Tuples!", null));
        analysis.add(Finding.builder().title("Info").severity(Severity.INFO).code("slow-sorts").build());

        // When
        Analysis result = StatementAnalyzer.suppress(analysis, List.of(" SLOW-SORTS ", "vacuum-dead-tuples", ""));

        // Then
        assertThat(result.getRecommendations()).extracting(Finding::getCode).containsExactly("slow-seq-scans");
        assertThat(result.getInfos()).hasSize(1);
    }

    @Test
    void shouldSlugifyTitles() {
        assertThat(StatementAnalyzer.slugify("  Vacuum: Dead Tuples!  ")).isEqualTo("vacuum-dead-tuples");
        assertThat(StatementAnalyzer.slugify(null)).isEmpty();
    }

    private static RankedStatements ranked(Statement... byTotalTime) {
        RankedStatements ranked = RankedStatements.empty();
        ranked.setTopByTotalTime(new ArrayList<>(List.of(byTotalTime)));
        return ranked;
    }

    private static Statement withAdvice(String query, boolean indexable, boolean refactorable, String... highlights) {
        PlanAdvice advice = new PlanAdvice();
        advice.setPlan("...");
        advice.setCanBeIndexed(indexable);
        advice.setCanBeRefactored(refactorable);
        for (String highlight : highlights) {
            advice.addHighlight(highlight);
        }
        Statement statement = new Statement(query, 100, 5000, 50, 100);
        statement.attachAdvice(advice);
        return statement;
    }

    private static Finding recommendation(String title, String code) {
        return Finding.builder().title(title).severity(Severity.RECOMMENDATION).code(code).build();
    }
}
