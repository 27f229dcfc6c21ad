package org.carball.pginsight.explain;

import java.util.HashSet;
import java.util.Set;

/**
 * Budget state for one pass over one ranked list: a primary counter bounded by the configured
 * limit, an outlier counter bounded by {@link #OUTLIER_CAP}, and the query texts already seen.
 */
public class ExplainBudget {

    public static final int DEFAULT_PRIMARY_LIMIT = 10;
    public static final int OUTLIER_CAP = 5;

    private final int primaryLimit;
    private final Set<String> seen = new HashSet<>();
    private int primaryUsed;
    private int outliersUsed;

    public ExplainBudget(int primaryLimit) {
        this.primaryLimit = primaryLimit <= 0 ? DEFAULT_PRIMARY_LIMIT : primaryLimit;
    }

    /**
     * @return false when the text was already seen in this pass
     */
    public boolean markSeen(String queryText) {
        return seen.add(queryText);
    }

    public boolean hasRoom() {
        return !primaryExhausted() || outliersUsed < OUTLIER_CAP;
    }

    public boolean primaryExhausted() {
        return primaryUsed >= primaryLimit;
    }

    /**
     * Charges one explained statement, to the primary counter while it has room.
     */
    public void consume() {
        if (!primaryExhausted()) {
            primaryUsed++;
        } else if (outliersUsed < OUTLIER_CAP) {
            outliersUsed++;
        } else {
            throw new IllegalStateException("Explain budget exhausted");
        }
    }

    public int getPrimaryLimit() {
        return primaryLimit;
    }

    public int getPrimaryUsed() {
        return primaryUsed;
    }

    public int getOutliersUsed() {
        return outliersUsed;
    }
}
