package com.tallyInsight.reportChat.chart.service;

import com.tallyInsight.reportChat.normalizer.model.NormalizedRow;
import com.tallyInsight.reportChat.normalizer.model.ReportSection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Frequency view of a bills register for charts: one row per party, value = number of bills.
 * Tables never use it; they keep one row per bill.
 */
@Slf4j
@Component
public class BillsFrequencyCollapser {

    private final int maxRows;

    public BillsFrequencyCollapser(@Value("${report-chat.chart.bills-max-rows:20}") int maxRows) {
        this.maxRows = maxRows;
    }

    /**
     * @param rows Per-bill rows
     * @return Per-party counts, most frequent first (ties keep first-seen order), at most {@code maxRows}
     */
    public List<NormalizedRow> collapse(List<NormalizedRow> rows) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (NormalizedRow row : rows) {
            String label = row.getLabel();
            if (label == null || label.isBlank()) {
                continue;
            }
            counts.merge(label, 1, Integer::sum);
        }

        List<NormalizedRow> collapsed = counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
                .limit(maxRows)
                .map(entry -> NormalizedRow.builder()
                        .section(ReportSection.BILLS)
                        .label(entry.getKey())
                        .value(entry.getValue().doubleValue())
                        .build())
                .toList();

        log.debug("Bills collapsed - bills: {}, parties: {}, kept: {}", rows.size(), counts.size(), collapsed.size());
        return collapsed;
    }
}
