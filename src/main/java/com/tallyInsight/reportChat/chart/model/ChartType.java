package com.tallyInsight.reportChat.chart.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ChartType {
    BAR,
    PIE,
    LINE,
    AREA;

    /**
     * Vega-Lite mark name
     */
    @JsonValue
    public String getMark() {
        return name().toLowerCase(Locale.ROOT);
    }
}
