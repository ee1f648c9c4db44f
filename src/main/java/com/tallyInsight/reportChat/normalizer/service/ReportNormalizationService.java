package com.tallyInsight.reportChat.normalizer.service;

import com.tallyInsight.reportChat.normalizer.model.NormalizedTable;
import com.tallyInsight.reportChat.normalizer.shape.BalanceSheetShapeRecognizer;
import com.tallyInsight.reportChat.normalizer.shape.BillsRegisterShapeRecognizer;
import com.tallyInsight.reportChat.normalizer.shape.ColumnarPeriodShapeRecognizer;
import com.tallyInsight.reportChat.normalizer.shape.GenericFallbackShapeRecognizer;
import com.tallyInsight.reportChat.normalizer.shape.GroupedAccountsShapeRecognizer;
import com.tallyInsight.reportChat.normalizer.shape.PeriodLedgerShapeRecognizer;
import com.tallyInsight.reportChat.normalizer.shape.ShapeRecognizer;
import com.tallyInsight.reportChat.normalizer.shape.StatisticsShapeRecognizer;
import com.tallyInsight.reportChat.normalizer.shape.StockSummaryShapeRecognizer;
import com.tallyInsight.reportChat.normalizer.shape.VoucherDayBookShapeRecognizer;
import com.tallyInsight.reportChat.normalizer.util.ExportTree;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Normalization service - turns a raw report export into a flat table.
 *
 * Responsibilities:
 * - Unwrap the {@code ENVELOPE} root
 * - Try every shape recognizer in fixed priority order; first non-empty result wins
 * - Treat a failing recognizer as a non-match and keep going
 *
 * Never throws: an export nobody recognizes yields {@link NormalizedTable#empty()}.
 */
@Slf4j
@Service
public class ReportNormalizationService {

    private final List<ShapeRecognizer> recognizers;

    @Autowired
    public ReportNormalizationService(ParentAggregator parentAggregator,
                                      @Value("${report-chat.normalizer.max-search-depth:64}") int maxSearchDepth) {
        this(List.of(
                new StatisticsShapeRecognizer(),
                new GroupedAccountsShapeRecognizer(maxSearchDepth),
                new ColumnarPeriodShapeRecognizer(),
                new BalanceSheetShapeRecognizer(parentAggregator),
                new BillsRegisterShapeRecognizer(),
                new StockSummaryShapeRecognizer(),
                new VoucherDayBookShapeRecognizer(),
                new PeriodLedgerShapeRecognizer(),
                new GenericFallbackShapeRecognizer(maxSearchDepth)
        ));
    }

    ReportNormalizationService(List<ShapeRecognizer> recognizers) {
        this.recognizers = List.copyOf(recognizers);
    }

    /**
     * Normalizes a raw export tree.
     *
     * @param rawExport Deserialized export (root map, usually with an {@code ENVELOPE} child)
     * @return Table from the first matching recognizer, or an empty table
     */
    public NormalizedTable normalize(Object rawExport) {
        Map<String, Object> envelope = ExportTree.envelope(rawExport);
        if (envelope == null) {
            log.info("Export has no map root, returning empty table");
            return NormalizedTable.empty();
        }

        for (ShapeRecognizer recognizer : recognizers) {
            NormalizedTable table;
            try {
                if (!recognizer.supports(envelope)) {
                    continue;
                }
                table = recognizer.extract(envelope);
            } catch (RuntimeException e) {
                log.warn("Shape recognizer failed, treating as no match - shape: {}, error: {}",
                        recognizer.getShapeName(), e.getMessage(), e);
                continue;
            }

            if (table != null && !table.isEmpty()) {
                table.setShape(recognizer.getShapeName());
                log.info("Export normalized - shape: {}, rows: {}", recognizer.getShapeName(), table.getRows().size());
                return table;
            }
            log.debug("Shape recognizer matched signature but produced no rows - shape: {}", recognizer.getShapeName());
        }

        log.info("No shape recognized, returning empty table");
        return NormalizedTable.empty();
    }

    List<ShapeRecognizer> getRecognizers() {
        return recognizers;
    }
}
