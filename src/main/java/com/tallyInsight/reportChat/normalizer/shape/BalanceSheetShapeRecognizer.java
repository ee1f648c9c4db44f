package com.tallyInsight.reportChat.normalizer.shape;

import com.tallyInsight.reportChat.normalizer.model.NormalizedRow;
import com.tallyInsight.reportChat.normalizer.model.NormalizedTable;
import com.tallyInsight.reportChat.normalizer.model.ReportField;
import com.tallyInsight.reportChat.normalizer.model.ReportSection;
import com.tallyInsight.reportChat.normalizer.service.ParentAggregator;
import com.tallyInsight.reportChat.normalizer.util.ExportTree;
import com.tallyInsight.reportChat.normalizer.util.ScalarParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Two-level balance sheet: parallel {@code BSNAME} / {@code BSAMT} arrays.
 *
 * Group lines carry {@code BSMAINAMT}, ledger lines {@code BSSUBAMT}; anything else falls back
 * to the first numeric field of the amount object. Group lines left blank are rolled up from
 * their children right after extraction.
 */
public class BalanceSheetShapeRecognizer implements ShapeRecognizer {

    static final String NAMES = "BSNAME";
    static final String AMOUNTS = "BSAMT";
    static final String MAIN_AMOUNT = "BSMAINAMT";
    static final String SUB_AMOUNT = "BSSUBAMT";

    private final ParentAggregator parentAggregator;

    public BalanceSheetShapeRecognizer(ParentAggregator parentAggregator) {
        this.parentAggregator = parentAggregator;
    }

    @Override
    public String getShapeName() {
        return "balance-sheet";
    }

    @Override
    public boolean supports(Map<String, Object> envelope) {
        return ExportTree.isList(envelope.get(NAMES)) && ExportTree.isList(envelope.get(AMOUNTS));
    }

    @Override
    public NormalizedTable extract(Map<String, Object> envelope) {
        List<Object> names = ExportTree.asList(envelope.get(NAMES));
        List<Object> amounts = ExportTree.asList(envelope.get(AMOUNTS));

        List<NormalizedRow> rows = new ArrayList<>();
        int count = Math.min(names.size(), amounts.size());
        for (int i = 0; i < count; i++) {
            String label = ExportTree.extractLabel(names.get(i));
            rows.add(NormalizedRow.builder()
                    .section(ReportSection.BALANCE_SHEET)
                    .label(label != null ? label : "row_" + i)
                    .value(amountOf(amounts.get(i)))
                    .build());
        }

        if (!rows.isEmpty()) {
            parentAggregator.aggregate(rows);
        }
        return NormalizedTable.of(ReportField.DEFAULT_COLUMNS, rows);
    }

    private Double amountOf(Object amountNode) {
        Map<String, Object> amount = ExportTree.asMap(amountNode);
        if (amount == null) {
            return ScalarParser.parse(amountNode);
        }
        if (ExportTree.nonBlankText(amount.get(MAIN_AMOUNT)) != null) {
            return ScalarParser.parse(amount.get(MAIN_AMOUNT));
        }
        if (ExportTree.nonBlankText(amount.get(SUB_AMOUNT)) != null) {
            return ScalarParser.parse(amount.get(SUB_AMOUNT));
        }
        for (Object field : amount.values()) {
            Double value = ScalarParser.parse(field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
