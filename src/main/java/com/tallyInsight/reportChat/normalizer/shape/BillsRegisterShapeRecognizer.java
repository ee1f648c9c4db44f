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
 * Bills Receivable / Payable register: a {@code BILLFIXED} array (party, reference, date) and up to
 * four parallel amount arrays, read in priority order.
 */
public class BillsRegisterShapeRecognizer implements ShapeRecognizer {

    static final String FIXED = "BILLFIXED";
    static final List<String> AMOUNT_ARRAYS = List.of("BILLFINAL", "BILLCL", "BILLGSTRBALANCE", "BILLOP");
    static final List<String> LABEL_KEYS = List.of("BILLPARTY", "BILLREF", "BILLDATE");

    @Override
    public String getShapeName() {
        return "bills-register";
    }

    @Override
    public boolean supports(Map<String, Object> envelope) {
        return ExportTree.isList(envelope.get(FIXED));
    }

    @Override
    public NormalizedTable extract(Map<String, Object> envelope) {
        List<Object> fixedEntries = ExportTree.asList(envelope.get(FIXED));

        List<NormalizedRow> rows = new ArrayList<>();
        for (int i = 0; i < fixedEntries.size(); i++) {
            Map<String, Object> fixed = ExportTree.asMap(fixedEntries.get(i));
            if (fixed == null) {
                continue;
            }

            rows.add(NormalizedRow.builder()
                    .section(ReportSection.BILLS)
                    .label(labelOf(fixed, i))
                    .value(amountAt(envelope, i))
                    .build());
        }
        return NormalizedTable.of(ReportField.DEFAULT_COLUMNS, rows);
    }

    private String labelOf(Map<String, Object> fixed, int index) {
        for (String key : LABEL_KEYS) {
            String text = ExportTree.nonBlankText(fixed.get(key));
            if (text != null) {
                return text;
            }
        }
        return "Bill_" + index;
    }

    private Double amountAt(Map<String, Object> envelope, int index) {
        for (String key : AMOUNT_ARRAYS) {
            Double value = ScalarParser.parse(ExportTree.elementAt(envelope.get(key), index));
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
