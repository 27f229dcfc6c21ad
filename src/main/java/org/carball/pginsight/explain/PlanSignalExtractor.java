package org.carball.pginsight.explain;

import java.util.List;

/**
 * Turns EXPLAIN output into {@link PlanSignals}. Implementations must be pure.
 */
public interface PlanSignalExtractor {

    PlanSignals extract(List<String> planLines);
}
