package org.carball.pginsight.config;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH
}
