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
 * Grouped-accounts layout (Profit &amp; Loss, Group Summary).
 *
 * The {@code DSPACCNAME} array may sit anywhere in the tree, so the block holding it is located
 * with a bounded search. Amounts come from whichever parallel amount arrays the block carries;
 * for each index the amount keys are probed in a fixed priority and the first non-null wins.
 * Rows without a label are skipped. A block whose amounts are all unknown is not this shape
 * (Stock Summary shares the name array but carries no amount arrays).
 */
public class GroupedAccountsShapeRecognizer implements ShapeRecognizer {

    static final String NAMES = "DSPACCNAME";
    static final List<String> AMOUNT_ARRAYS = List.of("PLAMT", "DSPACCINFO", "BSAMT");
    static final List<String> AMOUNT_KEYS = List.of("PLSUBAMT", "BSMAINAMT", "BSSUBAMT", "DSPCLAMTA", "DSPOPAMTA");

    private final int maxSearchDepth;

    public GroupedAccountsShapeRecognizer(int maxSearchDepth) {
        this.maxSearchDepth = maxSearchDepth;
    }

    @Override
    public String getShapeName() {
        return "grouped-accounts";
    }

    @Override
    public boolean supports(Map<String, Object> envelope) {
        return ExportTree.findBlockWithKey(envelope, NAMES, maxSearchDepth) != null;
    }

    @Override
    public NormalizedTable extract(Map<String, Object> envelope) {
        Map<String, Object> block = ExportTree.findBlockWithKey(envelope, NAMES, maxSearchDepth);
        if (block == null) {
            return NormalizedTable.empty();
        }

        List<List<Object>> amountLists = new ArrayList<>();
        for (String key : AMOUNT_ARRAYS) {
            if (ExportTree.isList(block.get(key))) {
                amountLists.add(ExportTree.asList(block.get(key)));
            }
        }
        if (amountLists.isEmpty()) {
            return NormalizedTable.empty();
        }

        List<Object> names = ExportTree.asList(block.get(NAMES));
        List<NormalizedRow> rows = new ArrayList<>();
        boolean anyValue = false;
        for (int i = 0; i < names.size(); i++) {
            String label = ExportTree.extractLabel(names.get(i));
            if (label == null) {
                continue;
            }
            Double value = firstAmount(amountLists, i);
            anyValue |= value != null;
            rows.add(NormalizedRow.builder()
                    .section(ReportSection.PROFIT_AND_LOSS)
                    .label(label)
                    .value(value)
                    .build());
        }

        if (!anyValue) {
            return NormalizedTable.empty();
        }
        return NormalizedTable.of(ReportField.DEFAULT_COLUMNS, rows);
    }

    private Double firstAmount(List<List<Object>> amountLists, int index) {
        for (List<Object> amounts : amountLists) {
            if (index >= amounts.size()) {
                continue;
            }
            Map<String, Object> amount = ExportTree.asMap(amounts.get(index));
            if (amount == null) {
                continue;
            }
            for (String key : AMOUNT_KEYS) {
                if (amount.containsKey(key)) {
                    Double value = ScalarParser.parse(amount.get(key));
                    if (value != null) {
                        return value;
                    }
                }
            }
        }
        return null;
    }
}
