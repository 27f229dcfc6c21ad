package org.carball.pginsight.collector;

import org.carball.pginsight.db.Row;
import org.carball.pginsight.db.ScriptedSession;
import org.carball.pginsight.model.capability.StatsCapability;
import org.carball.pginsight.model.statement.RankedStatements;
import org.carball.pginsight.model.statement.Statement;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class StatementRankerTest {

    private static final StatsCapability MODERN_ONLY = new StatsCapability(true, "", true, false, false);

    private final StatementRanker ranker = new StatementRanker();

    @Test
    void shouldFallBackToLegacyColumnsAndKeepThemForTheRun() {
        // Given - server reports modern columns but rejects them
        ScriptedSession session = new ScriptedSession()
                .failOn("total_exec_time")
                .onQuery("order by total_time desc", statementRow("select * from orders", 10, 500, 50))
                .onQuery("order by calls desc", statementRow("select 1", 9000, 90, 0.01));

        // When
        RankedStatements ranked = ranker.rank(session, MODERN_ONLY, StatsWindow.unknown());

        // Then
        assertThat(ranked.getTopByTotalTime()).extracting(Statement::getQuery).containsExactly("select * from orders");
        assertThat(ranked.getTopByCalls()).extracting(Statement::getQuery).containsExactly("select 1");
        assertThat(session.countIssued("total_exec_time")).isEqualTo(1);
        assertThat(ranked.isAvailable()).isTrue();
    }

    @Test
    void shouldNotSwitchVariantOnceAListSucceeded() {
        // Given
        ScriptedSession session = new ScriptedSession()
                .failOn("order by calls desc")
                .onQuery("order by total_exec_time desc", statementRow("select * from orders", 10, 500, 50));

        // When
        RankedStatements ranked = ranker.rank(session, MODERN_ONLY, StatsWindow.unknown());

        // Then
        assertThat(ranked.getTopByTotalTime()).hasSize(1);
        assertThat(ranked.getTopByCalls()).isEmpty();
        assertThat(session.countIssued("mean_time as mean_time")).isZero();
        assertThat(session.countIssued("order by calls desc")).isEqualTo(1);
    }

    @Test
    void shouldLeaveListsEmptyWhenBothVariantsFail() {
        // Given
        ScriptedSession session = new ScriptedSession().failOn("pg_stat_statements");

        // When
        RankedStatements ranked = ranker.rank(session, MODERN_ONLY, StatsWindow.unknown());

        // Then
        assertThat(ranked.isAvailable()).isFalse();
        assertThat(session.issued()).hasSize(4);
    }

    @Test
    void shouldDropTransactionControlStatements() {
        // Given
        ScriptedSession session = new ScriptedSession()
                .onQuery("order by total_exec_time desc",
                        statementRow("BEGIN", 100, 1, 0.01),
                        statementRow("commit", 100, 1, 0.01),
                        statementRow("DISCARD ALL", 100, 1, 0.01),
                        statementRow("select * from orders where id = $1", 100, 300, 3));

        // When
        RankedStatements ranked = ranker.rank(session, MODERN_ONLY, StatsWindow.unknown());

        // Then
        assertThat(ranked.getTopByTotalTime()).extracting(Statement::getQuery)
                .containsExactly("select * from orders where id = $1");
    }

    @Test
    void shouldComputeCallsPerHourFromWindowAge() {
        // Given
        ScriptedSession session = new ScriptedSession()
                .onQuery("order by total_exec_time desc", statementRow("select * from orders", 120, 500, 4));
        StatsWindow window = new StatsWindow(Instant.parse("2026-10-17T00:00:00Z"), Duration.ofHours(4), null);

        // When
        RankedStatements ranked = ranker.rank(session, MODERN_ONLY, window);

        // Then
        assertThat(ranked.getTopByTotalTime().get(0).getCallsPerHour()).isCloseTo(30.0, within(0.001));
        assertThat(ranked.getStatsWindowAge()).isEqualTo(Duration.ofHours(4));
    }

    @Test
    void shouldComputeCallsPerHourOnEveryList() {
        // Given
        StatsCapability withIo = new StatsCapability(true, "", true, true, false);
        ScriptedSession session = new ScriptedSession()
                .onQuery("order by total_exec_time desc", ioRow("select * from orders", 40))
                .onQuery("order by (total_exec_time - blk_read_time", ioRow("select * from customers", 80))
                .onQuery("order by (blk_read_time + blk_write_time)", ioRow("select * from invoices", 120))
                .onQuery("order by calls desc", ioRow("select 1", 400));
        StatsWindow window = new StatsWindow(Instant.parse("2026-10-18T08:00:00Z"), Duration.ofHours(4), null);

        // When
        RankedStatements ranked = ranker.rank(session, withIo, window);

        // Then
        assertThat(ranked.getTopByTotalTime().get(0).getCallsPerHour()).isCloseTo(10.0, within(0.001));
        assertThat(ranked.getTopByCpu().get(0).getCallsPerHour()).isCloseTo(20.0, within(0.001));
        assertThat(ranked.getTopByIo().get(0).getCallsPerHour()).isCloseTo(30.0, within(0.001));
        assertThat(ranked.getTopByCalls().get(0).getCallsPerHour()).isCloseTo(100.0, within(0.001));
    }

    @Test
    void shouldLeaveCallsPerHourZeroWhenWindowAgeIsNegative() {
        // Given - reset time reported ahead of the local clock
        ScriptedSession session = new ScriptedSession()
                .onQuery("order by total_exec_time desc", statementRow("select * from orders", 120, 500, 4));
        StatsWindow window = new StatsWindow(Instant.parse("2026-10-18T14:00:00Z"), Duration.ofHours(-2), null);

        // When
        RankedStatements ranked = ranker.rank(session, MODERN_ONLY, window);

        // Then
        assertThat(ranked.getTopByTotalTime().get(0).getCallsPerHour()).isZero();
    }

    @Test
    void shouldLeaveCallsPerHourZeroWhenWindowUnknown() {
        // Given
        ScriptedSession session = new ScriptedSession()
                .onQuery("order by total_exec_time desc", statementRow("select * from orders", 120, 500, 4));

        // When
        RankedStatements ranked = ranker.rank(session, MODERN_ONLY, StatsWindow.unknown());

        // Then
        assertThat(ranked.getTopByTotalTime().get(0).getCallsPerHour()).isZero();
    }

    @Test
    void shouldQueryIoListsOnlyWhenColumnsExist() {
        // Given
        StatsCapability withIo = new StatsCapability(true, "", true, true, true);
        ScriptedSession ioSession = new ScriptedSession();
        ScriptedSession blockSession = new ScriptedSession();

        // When
        ranker.rank(ioSession, withIo, StatsWindow.unknown());
        ranker.rank(blockSession, new StatsCapability(true, "", true, false, true), StatsWindow.unknown());

        // Then
        assertThat(ioSession.countIssued("order by (blk_read_time + blk_write_time)")).isEqualTo(1);
        assertThat(ioSession.countIssued("order by (total_exec_time - blk_read_time")).isEqualTo(1);
        assertThat(ioSession.countIssued("coalesce(shared_blks_read,0)")).isZero();
        assertThat(blockSession.countIssued("order by (coalesce(shared_blks_read,0)")).isEqualTo(1);
        assertThat(blockSession.countIssued("blk_read_time")).isZero();
    }

    @Test
    void shouldSplitCpuAndIoTimeFromBlockTimings() {
        // Given
        StatsCapability withIo = new StatsCapability(true, "", true, true, false);
        Row row = Row.of("query", "select * from orders", "calls", 10L, "total_time", 500.0,
                "mean_time", 50.0, "rows", 10L, "blk_read_time", 120.0, "blk_write_time", 30.0);

        // When
        Statement statement = StatementRanker.toStatement(row, withIo);

        // Then
        assertThat(statement.getIoTime()).isEqualTo(150.0);
        assertThat(statement.getCpuTime()).isEqualTo(350.0);
    }

    @Test
    void shouldRecognizeUtilityStatementsCaseInsensitively() {
        assertThat(StatementRanker.isUtility("  begin")).isTrue();
        assertThat(StatementRanker.isUtility("Commit")).isTrue();
        assertThat(StatementRanker.isUtility("discard all")).isTrue();
        assertThat(StatementRanker.isUtility("select 1")).isFalse();
        assertThat(StatementRanker.isUtility(null)).isFalse();
    }

    private static Row ioRow(String query, long calls) {
        return Row.of("query", query, "calls", calls, "total_time", 500.0, "mean_time", 5.0, "rows", calls,
                "blk_read_time", 100.0, "blk_write_time", 20.0);
    }

    static Row statementRow(String query, long calls, double totalTime, double meanTime) {
        return Row.of("query", query, "calls", calls, "total_time", totalTime, "mean_time", meanTime, "rows", calls);
    }
}
