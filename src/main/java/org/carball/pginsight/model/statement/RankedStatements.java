package org.carball.pginsight.model.statement;

import lombok.Data;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * The ranked statement lists produced in one run, plus the statistics window they cover.
 */
@Data
public class RankedStatements {
    private List<Statement> topByTotalTime = new ArrayList<>();
    private List<Statement> topByCpu = new ArrayList<>();
    private List<Statement> topByIo = new ArrayList<>();
    private List<Statement> topByCalls = new ArrayList<>();
    private List<Statement> topByIoBlocks = new ArrayList<>();
    private Instant statsResetTime;
    private Duration statsWindowAge = Duration.ZERO;
    private String skippedReason;

    public static RankedStatements empty() {
        return new RankedStatements();
    }

    /**
     * Statistics count as available when either of the two explained lists has rows.
     */
    public boolean isAvailable() {
        return !topByTotalTime.isEmpty() || !topByCalls.isEmpty();
    }

    public List<Statement> list(RankingOrder order) {
        return switch (order) {
            case TOTAL_TIME -> topByTotalTime;
            case CPU_APPROX -> topByCpu;
            case IO_TIME -> topByIo;
            case CALLS -> topByCalls;
            case IO_BLOCKS -> topByIoBlocks;
        };
    }

    public void put(RankingOrder order, List<Statement> statements) {
        switch (order) {
            case TOTAL_TIME -> topByTotalTime = statements;
            case CPU_APPROX -> topByCpu = statements;
            case IO_TIME -> topByIo = statements;
            case CALLS -> topByCalls = statements;
            case IO_BLOCKS -> topByIoBlocks = statements;
        }
    }

    public Stream<Statement> all() {
        return Stream.of(topByTotalTime, topByCpu, topByIo, topByCalls, topByIoBlocks)
                .flatMap(List::stream);
    }
}
