package org.carball.pginsight.config;

import lombok.Data;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
public class InsightConfig {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration MIN_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration MAX_TIMEOUT = Duration.ofMinutes(10);

    private String url;
    private Duration timeout = DEFAULT_TIMEOUT;
    private Duration statsSince;
    private List<String> databases = new ArrayList<>();
    private String outputFile = "pg-insight-report.json";
    private OutputFormat outputFormat = OutputFormat.JSON;
    private List<String> suppress = new ArrayList<>();
    private boolean verbose;
    private InsightThresholds thresholds = InsightThresholds.defaults();
}
