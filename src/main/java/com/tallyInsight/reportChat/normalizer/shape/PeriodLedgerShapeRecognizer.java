package com.tallyInsight.reportChat.normalizer.shape;

import com.tallyInsight.reportChat.normalizer.model.NormalizedRow;
import com.tallyInsight.reportChat.normalizer.model.NormalizedTable;
import com.tallyInsight.reportChat.normalizer.model.ReportField;
import com.tallyInsight.reportChat.normalizer.model.ReportSection;
import com.tallyInsight.reportChat.normalizer.util.ExportTree;
import com.tallyInsight.reportChat.normalizer.util.ScalarParser;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Period-wise ledger: parallel {@code DSPPERIOD} / {@code DSPACCINFO} arrays with debit, credit
 * and closing amounts per period.
 *
 * The same encoding serves Day Book, Sales Register and Cash Flow. Two or more periods with a
 * negative debit amount mark the report as a cash flow, which switches the columns to
 * inflow / outflow / net flow.
 */
@Slf4j
public class PeriodLedgerShapeRecognizer implements ShapeRecognizer {

    static final String PERIODS = "DSPPERIOD";
    static final String INFOS = "DSPACCINFO";
    static final int CASH_FLOW_NEGATIVE_DEBITS = 2;

    @Override
    public String getShapeName() {
        return "period-ledger";
    }

    @Override
    public boolean supports(Map<String, Object> envelope) {
        return ExportTree.isList(envelope.get(PERIODS)) && ExportTree.isList(envelope.get(INFOS));
    }

    @Override
    public NormalizedTable extract(Map<String, Object> envelope) {
        List<Object> periods = ExportTree.asList(envelope.get(PERIODS));
        List<Object> infos = ExportTree.asList(envelope.get(INFOS));

        int negativeDebits = 0;
        int positiveDebits = 0;
        for (Object info : infos) {
            Double debit = debitOf(info);
            if (debit == null) {
                continue;
            }
            if (debit < 0) {
                negativeDebits++;
            } else {
                positiveDebits++;
            }
        }

        boolean cashFlow = negativeDebits >= CASH_FLOW_NEGATIVE_DEBITS;
        String ledgerSection = positiveDebits > 0 ? ReportSection.DAY_BOOK : ReportSection.SALES_REGISTER;
        log.debug("Period ledger classified - negativeDebits: {}, positiveDebits: {}, cashFlow: {}",
                negativeDebits, positiveDebits, cashFlow);

        List<NormalizedRow> rows = new ArrayList<>();
        int count = Math.min(periods.size(), infos.size());
        for (int i = 0; i < count; i++) {
            Object info = infos.get(i);
            Double debit = debitOf(info);
            Double credit = ScalarParser.parse(ExportTree.path(info, "DSPCRAMT", "DSPCRAMTA"));
            Double closing = ScalarParser.parse(ExportTree.path(info, "DSPCLAMT", "DSPCLAMTA"));
            if (debit == null && credit == null && closing == null) {
                continue;
            }

            String label = ExportTree.extractLabel(periods.get(i));
            if (label == null) {
                label = "row_" + i;
            }

            if (cashFlow) {
                rows.add(NormalizedRow.builder()
                        .section(ReportSection.CASH_FLOW)
                        .label(label)
                        .inflow(credit)
                        .outflow(debit != null ? Math.abs(debit) : null)
                        .netFlow(closing)
                        .build());
            } else {
                rows.add(NormalizedRow.builder()
                        .section(ledgerSection)
                        .label(label)
                        .debit(debit)
                        .credit(credit)
                        .closingBalance(closing)
                        .value(credit != null ? credit : debit)
                        .build());
            }
        }

        return NormalizedTable.of(cashFlow ? ReportField.CASH_FLOW_COLUMNS : ReportField.LEDGER_COLUMNS, rows);
    }

    private Double debitOf(Object info) {
        return ScalarParser.parse(ExportTree.path(info, "DSPDRAMT", "DSPDRAMTA"));
    }
}
