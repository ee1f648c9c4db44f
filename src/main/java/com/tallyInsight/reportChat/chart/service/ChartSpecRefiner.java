package com.tallyInsight.reportChat.chart.service;

import com.tallyInsight.reportChat.chart.model.ChartSpec;
import com.tallyInsight.reportChat.chart.model.ChartType;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Optional styling pass over the deterministic chart.
 */
public interface ChartSpecRefiner {

    /**
     * @param question Question text
     * @param chartType Requested chart type
     * @param numericFields Plottable fields
     * @param values Data records the chart will carry
     * @return Refined spec without data, or empty to keep the deterministic one
     */
    Optional<ChartSpec> refine(String question, ChartType chartType, List<String> numericFields,
                               List<Map<String, Object>> values);
}
