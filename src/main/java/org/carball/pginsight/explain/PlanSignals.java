package org.carball.pginsight.explain;

import java.util.List;

/**
 * Structural markers found in one plan. {@code join} is null when the plan has no join.
 */
public record PlanSignals(
        List<String> seqScanTables,
        boolean sort,
        boolean bitmap,
        JoinKind join,
        boolean parallel,
        boolean cte
) {

    public PlanSignals {
        seqScanTables = List.copyOf(seqScanTables);
    }

    public static PlanSignals none() {
        return new PlanSignals(List.of(), false, false, null, false, false);
    }

    public boolean hasSeqScans() {
        return !seqScanTables.isEmpty();
    }

    public boolean hasJoin() {
        return join != null;
    }
}
