package org.carball.pginsight.collector;

import org.carball.pginsight.db.SqlQuoting;
import org.carball.pginsight.model.capability.StatsCapability;
import org.carball.pginsight.model.capability.TimeColumns;
import org.carball.pginsight.model.statement.RankingOrder;

/**
 * Builds the pg_stat_statements ranking query for one list. Only columns the capability
 * reports as present are ever referenced.
 */
public class RankingQueryBuilder {

    static final String IO_COLUMNS = ", blk_read_time, blk_write_time";
    static final String BLOCK_COLUMNS = ", shared_blks_read, shared_blks_written, local_blks_read,"
            + " local_blks_written, temp_blks_read, temp_blks_written";
    static final String BLOCK_SUM = "(coalesce(shared_blks_read,0)+coalesce(shared_blks_written,0)"
            + "+coalesce(local_blks_read,0)+coalesce(local_blks_written,0)"
            + "+coalesce(temp_blks_read,0)+coalesce(temp_blks_written,0))";

    public String build(StatsCapability capability, RankingOrder order, TimeColumns timeColumns, int rowLimit) {
        String total = timeColumns.getTotalColumn();
        String mean = timeColumns.getMeanColumn();

        return "select query, calls, " + total + " as total_time, " + mean + " as mean_time, rows"
                + (capability.ioTimeColumns() ? IO_COLUMNS : "")
                + (capability.blockColumns() ? BLOCK_COLUMNS : "")
                + " from " + relationName(capability)
                + " order by " + orderExpression(capability, order, total) + " desc nulls last"
                + " limit " + rowLimit;
    }

    String orderExpression(StatsCapability capability, RankingOrder order, String totalColumn) {
        return switch (order) {
            case CPU_APPROX -> capability.ioTimeColumns()
                    ? "(" + totalColumn + " - blk_read_time - blk_write_time)"
                    : totalColumn;
            case IO_TIME -> capability.ioTimeColumns() ? "(blk_read_time + blk_write_time)" : totalColumn;
            case CALLS -> "calls";
            case IO_BLOCKS -> capability.blockColumns() ? BLOCK_SUM : totalColumn;
            case TOTAL_TIME -> totalColumn;
        };
    }

    static String relationName(StatsCapability capability) {
        if (!capability.hasSchema()) {
            return "pg_stat_statements";
        }
        return SqlQuoting.quoteIdent(capability.schema()) + ".pg_stat_statements";
    }
}
