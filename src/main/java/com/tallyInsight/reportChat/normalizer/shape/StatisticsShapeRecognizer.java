package com.tallyInsight.reportChat.normalizer.shape;

import com.tallyInsight.reportChat.normalizer.model.NormalizedRow;
import com.tallyInsight.reportChat.normalizer.model.NormalizedTable;
import com.tallyInsight.reportChat.normalizer.model.ReportField;
import com.tallyInsight.reportChat.normalizer.model.ReportSection;
import com.tallyInsight.reportChat.normalizer.util.ExportTree;
import com.tallyInsight.reportChat.normalizer.util.ScalarParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Statistics report: parallel {@code STATNAME} and {@code STATVALUE} arrays,
 * the number sitting in {@code STATVALUE[i].STATDIRECT}.
 */
public class StatisticsShapeRecognizer implements ShapeRecognizer {

    static final String NAMES = "STATNAME";
    static final String VALUES = "STATVALUE";
    static final String DIRECT = "STATDIRECT";

    @Override
    public String getShapeName() {
        return "statistics";
    }

    @Override
    public boolean supports(Map<String, Object> envelope) {
        return ExportTree.isList(envelope.get(NAMES)) && ExportTree.isList(envelope.get(VALUES));
    }

    @Override
    public NormalizedTable extract(Map<String, Object> envelope) {
        List<Object> names = ExportTree.asList(envelope.get(NAMES));
        List<Object> values = ExportTree.asList(envelope.get(VALUES));

        List<NormalizedRow> rows = new ArrayList<>();
        int count = Math.min(names.size(), values.size());
        for (int i = 0; i < count; i++) {
            String label = ExportTree.extractLabel(names.get(i));
            Object valueNode = values.get(i);
            Object raw = ExportTree.asMap(valueNode) != null ? ExportTree.path(valueNode, DIRECT) : valueNode;

            rows.add(NormalizedRow.builder()
                    .section(ReportSection.STATISTICS)
                    .label(label != null ? label : "row_" + i)
                    .value(ScalarParser.parse(raw))
                    .build());
        }
        return NormalizedTable.of(ReportField.DEFAULT_COLUMNS, rows);
    }
}
