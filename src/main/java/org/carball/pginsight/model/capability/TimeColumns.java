package org.carball.pginsight.model.capability;

import lombok.Getter;

/**
 * Timing column names of pg_stat_statements; renamed in PostgreSQL 13.
 */
@Getter
public enum TimeColumns {
    MODERN("total_exec_time", "mean_exec_time"),
    LEGACY("total_time", "mean_time");

    private final String totalColumn;
    private final String meanColumn;

    TimeColumns(String totalColumn, String meanColumn) {
        this.totalColumn = totalColumn;
        this.meanColumn = meanColumn;
    }

    public TimeColumns other() {
        return this == MODERN ? LEGACY : MODERN;
    }
}
