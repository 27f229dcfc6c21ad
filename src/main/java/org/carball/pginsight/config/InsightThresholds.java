package org.carball.pginsight.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Tunable limits for statement collection and reporting. Bound from a YAML file with
 * {@code --thresholds}, then overridden by environment and CLI arguments.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@Slf4j
public class InsightThresholds {

    public static final int DEFAULT_EXPLAIN_LIST_CAP = 10;

    // Statements explained per ranked list before only outliers may use the budget
    @Builder.Default
    @JsonProperty("explain_list_cap")
    private int explainListCap = DEFAULT_EXPLAIN_LIST_CAP;

    @Builder.Default
    @JsonProperty("seq_scan_tables_shown")
    private int seqScanTablesShown = 8;

    @Builder.Default
    @JsonProperty("ranked_list_limit")
    private int rankedListLimit = 20;

    public static InsightThresholds defaults() {
        return InsightThresholds.builder().build();
    }

    /**
     * Explain cap with non-positive values normalized to the default.
     */
    public int effectiveExplainCap() {
        return explainListCap <= 0 ? DEFAULT_EXPLAIN_LIST_CAP : explainListCap;
    }

    /**
     * Logs warnings for values that are accepted but probably not intended.
     */
    public void validate() {
        if (explainListCap <= 0) {
            log.warn("Explain list cap ({}) is not positive, using {}", explainListCap, DEFAULT_EXPLAIN_LIST_CAP);
        }
        if (explainListCap > rankedListLimit) {
            log.warn("Explain list cap ({}) exceeds ranked list limit ({}); at most {} statements per list can be explained",
                    explainListCap, rankedListLimit, rankedListLimit);
        }
        if (seqScanTablesShown <= 0) {
            log.warn("Seq scan tables shown ({}) should be positive", seqScanTablesShown);
        }
        if (rankedListLimit <= 0) {
            log.warn("Ranked list limit ({}) should be positive", rankedListLimit);
        }

        log.debug("Using thresholds - Explain cap: {}, Seq scan tables: {}, List limit: {}",
                explainListCap, seqScanTablesShown, rankedListLimit);
    }

    public String getConfigurationSummary() {
        return String.format("Explain cap: %d | Seq scan tables shown: %d | Ranked list limit: %d",
                effectiveExplainCap(), seqScanTablesShown, rankedListLimit);
    }
}
