package com.tallyInsight.reportChat.chart.service;

import java.util.List;

/**
 * Picks the labels an "only ..." question asks for.
 */
public interface LabelSelector {

    /**
     * @param question Question text
     * @param allowedLabels Labels present in the report
     * @return Subset of {@code allowedLabels}; empty when unsure
     * @throws RuntimeException when the selector is unavailable
     */
    List<String> select(String question, List<String> allowedLabels);
}
