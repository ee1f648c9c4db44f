package com.tallyInsight.reportChat.normalizer.shape;

import com.tallyInsight.reportChat.normalizer.model.NormalizedRow;
import com.tallyInsight.reportChat.normalizer.model.NormalizedTable;
import com.tallyInsight.reportChat.normalizer.model.ReportField;
import com.tallyInsight.reportChat.normalizer.model.ReportSection;
import com.tallyInsight.reportChat.normalizer.util.ExportTree;
import com.tallyInsight.reportChat.normalizer.util.ScalarParser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Columnar period report (Cash Flow Projection): a {@code PARTICULARS} array plus sibling arrays
 * of the same length, one per period column.
 *
 * Only balance lines are emitted, one row per period with the period column name as label.
 * Other line items are ignored on purpose: spreading them per period would invent figures.
 */
public class ColumnarPeriodShapeRecognizer implements ShapeRecognizer {

    static final String PARTICULARS = "PARTICULARS";
    static final List<String> BALANCE_LINE_MARKERS = List.of("net balance", "closing balance");

    @Override
    public String getShapeName() {
        return "columnar-period";
    }

    @Override
    public boolean supports(Map<String, Object> envelope) {
        return ExportTree.isList(envelope.get(PARTICULARS));
    }

    @Override
    public NormalizedTable extract(Map<String, Object> envelope) {
        List<Object> particulars = ExportTree.asList(envelope.get(PARTICULARS));

        Map<String, List<Object>> periodColumns = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : envelope.entrySet()) {
            if (PARTICULARS.equalsIgnoreCase(entry.getKey()) || !ExportTree.isList(entry.getValue())) {
                continue;
            }
            List<Object> column = ExportTree.asList(entry.getValue());
            if (column.size() == particulars.size()) {
                periodColumns.put(entry.getKey(), column);
            }
        }

        List<NormalizedRow> rows = new ArrayList<>();
        for (int i = 0; i < particulars.size(); i++) {
            String line = ExportTree.extractLabel(particulars.get(i));
            if (!isBalanceLine(line)) {
                continue;
            }
            for (Map.Entry<String, List<Object>> column : periodColumns.entrySet()) {
                Double value = ScalarParser.parse(column.getValue().get(i));
                if (value == null) {
                    continue;
                }
                rows.add(NormalizedRow.builder()
                        .section(ReportSection.CASH_FLOW_PROJECTION)
                        .label(column.getKey())
                        .value(value)
                        .build());
            }
        }
        return NormalizedTable.of(ReportField.DEFAULT_COLUMNS, rows);
    }

    private boolean isBalanceLine(String line) {
        if (line == null) {
            return false;
        }
        String lower = line.toLowerCase(Locale.ROOT);
        return BALANCE_LINE_MARKERS.stream().anyMatch(lower::contains);
    }
}
