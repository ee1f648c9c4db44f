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
 * Stock Summary: parallel {@code DSPACCNAME} / {@code DSPSTKINFO} arrays. Each row carries
 * closing quantity, rate and value instead of a single amount.
 */
public class StockSummaryShapeRecognizer implements ShapeRecognizer {

    static final String NAMES = "DSPACCNAME";
    static final String INFOS = "DSPSTKINFO";
    static final String CLOSING = "DSPSTKCL";
    static final String QUANTITY = "DSPCLQTY";
    static final String RATE = "DSPCLRATE";
    static final String AMOUNT = "DSPCLAMTA";

    @Override
    public String getShapeName() {
        return "stock-summary";
    }

    @Override
    public boolean supports(Map<String, Object> envelope) {
        return ExportTree.isList(envelope.get(NAMES)) && ExportTree.isList(envelope.get(INFOS));
    }

    @Override
    public NormalizedTable extract(Map<String, Object> envelope) {
        List<Object> names = ExportTree.asList(envelope.get(NAMES));
        List<Object> infos = ExportTree.asList(envelope.get(INFOS));

        List<NormalizedRow> rows = new ArrayList<>();
        int count = Math.min(names.size(), infos.size());
        for (int i = 0; i < count; i++) {
            String label = ExportTree.extractLabel(names.get(i));
            Object closing = ExportTree.path(infos.get(i), CLOSING);

            rows.add(NormalizedRow.builder()
                    .section(ReportSection.STOCK_SUMMARY)
                    .label(label != null ? label : "Item_" + i)
                    // "120 Nos" - keep the leading number, drop the unit
                    .quantity(ScalarParser.parseRatio(ExportTree.path(closing, QUANTITY)))
                    .rate(ScalarParser.parse(ExportTree.path(closing, RATE)))
                    .value(ScalarParser.parse(ExportTree.path(closing, AMOUNT)))
                    .build());
        }
        return NormalizedTable.of(ReportField.STOCK_COLUMNS, rows);
    }
}
