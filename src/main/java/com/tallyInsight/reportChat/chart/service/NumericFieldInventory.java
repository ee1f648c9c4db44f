package com.tallyInsight.reportChat.chart.service;

import com.tallyInsight.reportChat.normalizer.model.NormalizedRow;
import com.tallyInsight.reportChat.normalizer.model.ReportField;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Lists the numeric columns a chart can plot, read off the first row.
 * The ledger and flow columns come first in a fixed order, then any other numeric facet.
 */
@Component
public class NumericFieldInventory {

    static final List<String> PREFERRED_FIELDS = List.of(
            ReportField.CREDIT,
            ReportField.DEBIT,
            ReportField.CLOSING_BALANCE,
            ReportField.INFLOW,
            ReportField.OUTFLOW,
            ReportField.NET_FLOW,
            ReportField.VALUE);

    public List<String> inventory(List<NormalizedRow> rows) {
        List<String> fields = new ArrayList<>();
        if (rows == null || rows.isEmpty()) {
            return fields;
        }

        NormalizedRow sample = rows.get(0);
        for (String field : PREFERRED_FIELDS) {
            if (sample.getNumeric(field) != null) {
                fields.add(field);
            }
        }
        for (String field : ReportField.NUMERIC_FIELDS) {
            if (!fields.contains(field) && sample.getNumeric(field) != null) {
                fields.add(field);
            }
        }

        if (fields.isEmpty()) {
            fields.add(ReportField.VALUE);
        }
        return fields;
    }
}
