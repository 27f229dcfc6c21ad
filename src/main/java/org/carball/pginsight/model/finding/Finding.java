package org.carball.pginsight.model.finding;

import lombok.Builder;
import lombok.Data;

/**
 * A single analysis finding. The code is a stable slug that can be suppressed from the CLI.
 */
@Data
@Builder
public class Finding {
    private String title;
    private Severity severity;
    private String code;
    private String description;
    private String action;
}
