package org.carball.pginsight.model.finding;

import lombok.Getter;

@Getter
public enum Severity {
    INFO("info", "ℹ️"),
    WARNING("warn", "⚠️"),
    RECOMMENDATION("rec", "💡");

    private final String code;
    private final String icon;

    Severity(String code, String icon) {
        this.code = code;
        this.icon = icon;
    }
}
