package org.carball.pginsight.model.statement;

import lombok.Getter;

@Getter
public enum RankingOrder {
    TOTAL_TIME("Top by total time"),
    CPU_APPROX("Top by CPU time (approx.)"),
    IO_TIME("Top by I/O time"),
    CALLS("Top by calls"),
    IO_BLOCKS("Top by I/O blocks");

    private final String displayName;

    RankingOrder(String displayName) {
        this.displayName = displayName;
    }
}
