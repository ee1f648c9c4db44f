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
 * Day Book as a voucher list: each {@code VOUCHER} holds ledger-entry sublists.
 * One row per nonzero ledger entry; {@code value} is the magnitude and the sign is split into
 * {@code debit} (positive amounts) or {@code credit} (negative amounts).
 */
public class VoucherDayBookShapeRecognizer implements ShapeRecognizer {

    static final String VOUCHER = "VOUCHER";
    static final List<String> ENTRY_LISTS = List.of("LEDGERENTRIES.LIST", "ALLLEDGERENTRIES.LIST");
    static final String PARTY = "PARTYLEDGERNAME";
    static final String LEDGER = "LEDGERNAME";
    static final List<String> AMOUNT_KEYS = List.of("AMOUNT", "DEBITAMOUNT");

    @Override
    public String getShapeName() {
        return "voucher-day-book";
    }

    @Override
    public boolean supports(Map<String, Object> envelope) {
        return envelope.containsKey(VOUCHER);
    }

    @Override
    public NormalizedTable extract(Map<String, Object> envelope) {
        List<NormalizedRow> rows = new ArrayList<>();

        for (Object voucherNode : ExportTree.asList(envelope.get(VOUCHER))) {
            Map<String, Object> voucher = ExportTree.asMap(voucherNode);
            if (voucher == null) {
                continue;
            }

            String party = ExportTree.nonBlankText(voucher.get(PARTY));
            if (party == null) {
                party = ExportTree.nonBlankText(voucher.get(LEDGER));
            }

            for (String entryKey : ENTRY_LISTS) {
                for (Object entryNode : ExportTree.asList(voucher.get(entryKey))) {
                    NormalizedRow row = toRow(ExportTree.asMap(entryNode), party);
                    if (row != null) {
                        rows.add(row);
                    }
                }
            }
        }
        return NormalizedTable.of(ReportField.VOUCHER_COLUMNS, rows);
    }

    private NormalizedRow toRow(Map<String, Object> entry, String party) {
        if (entry == null) {
            return null;
        }

        Double amount = null;
        for (String key : AMOUNT_KEYS) {
            amount = ScalarParser.parse(entry.get(key));
            if (amount != null) {
                break;
            }
        }
        if (amount == null || amount == 0) {
            return null;
        }

        String label = ExportTree.nonBlankText(entry.get(LEDGER));
        if (label == null) {
            label = party != null ? party : "Unknown";
        }

        double magnitude = Math.abs(amount);
        return NormalizedRow.builder()
                .section(ReportSection.DAY_BOOK)
                .label(label)
                .value(magnitude)
                .debit(amount > 0 ? magnitude : null)
                .credit(amount < 0 ? magnitude : null)
                .build();
    }
}
