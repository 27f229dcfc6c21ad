package org.carball.pginsight.explain;

import org.carball.pginsight.model.statement.PlanAdvice;
import org.carball.pginsight.model.statement.Statement;

import java.util.Optional;

/**
 * Obtains advice for one candidate statement; empty when no plan could be collected.
 */
@FunctionalInterface
public interface PlanCollector {

    Optional<PlanAdvice> collect(Statement statement, int ordinal);
}
