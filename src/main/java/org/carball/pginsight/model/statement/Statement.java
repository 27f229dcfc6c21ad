package org.carball.pginsight.model.statement;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One aggregated entry from pg_stat_statements with its timing, row and call metrics.
 * Times are in milliseconds.
 */
@Data
@NoArgsConstructor
public class Statement {
    private String query;
    private double calls;
    private double callsPerHour;
    private double totalTime;
    private double meanTime;
    private double rows;
    private double blkReadTime;
    private double blkWriteTime;
    private double cpuTime;
    private double ioTime;
    private double sharedBlksRead;
    private double sharedBlksWritten;
    private double localBlksRead;
    private double localBlksWritten;
    private double tempBlksRead;
    private double tempBlksWritten;
    private PlanAdvice advice;
    private boolean needsAttention;

    public Statement(String query, double calls, double totalTime, double meanTime, double rows) {
        this.query = query;
        this.calls = calls;
        this.totalTime = totalTime;
        this.meanTime = meanTime;
        this.rows = rows;
    }

    /**
     * Attaches plan advice and raises the attention flag when the advice carries anything.
     */
    public void attachAdvice(PlanAdvice planAdvice) {
        this.advice = planAdvice;
        if (planAdvice != null && !planAdvice.isEmpty()) {
            this.needsAttention = true;
        }
    }

    @JsonIgnore
    public boolean hasAdvice() {
        return advice != null;
    }

    public double getBlocksTotal() {
        return sharedBlksRead + sharedBlksWritten + localBlksRead + localBlksWritten
                + tempBlksRead + tempBlksWritten;
    }
}
