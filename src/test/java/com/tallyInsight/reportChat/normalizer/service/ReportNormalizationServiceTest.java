package com.tallyInsight.reportChat.normalizer.service;

import com.tallyInsight.reportChat.normalizer.model.NormalizedRow;
import com.tallyInsight.reportChat.normalizer.model.NormalizedTable;
import com.tallyInsight.reportChat.normalizer.model.ReportField;
import com.tallyInsight.reportChat.normalizer.model.ReportSection;
import com.tallyInsight.reportChat.normalizer.shape.ShapeRecognizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ReportNormalizationServiceTest {

    private final ReportNormalizationService service = new ReportNormalizationService(new ParentAggregator(), 64);

    @Nested
    @DisplayName("recognizer precedence")
    class Precedence {

        @Test
        void recognizers_shouldRunInFixedPriorityOrder() {
            assertThat(service.getRecognizers())
                    .extracting(ShapeRecognizer::getShapeName)
                    .containsExactly(
                            "statistics",
                            "grouped-accounts",
                            "columnar-period",
                            "balance-sheet",
                            "bills-register",
                            "stock-summary",
                            "voucher-day-book",
                            "period-ledger",
                            "generic");
        }

        @Test
        void normalize_shouldSkipGroupedAccountsForStockSummaryExport() {
            Map<String, Object> export = Map.of("ENVELOPE", Map.of(
                    "DSPACCNAME", List.of("Sugar"),
                    "DSPSTKINFO", List.of(Map.of("DSPSTKCL", Map.of("DSPCLAMTA", "100")))));

            NormalizedTable table = service.normalize(export);

            assertThat(table.getShape()).isEqualTo("stock-summary");
            assertThat(table.getRows().get(0).getSection()).isEqualTo(ReportSection.STOCK_SUMMARY);
        }

        @Test
        void normalize_shouldReturnOneRowPerStatistic() {
            Map<String, Object> export = Map.of("ENVELOPE", Map.of(
                    "STATNAME", List.of("Sales", "Purchase", "Journal"),
                    "STATVALUE", List.of(Map.of("STATDIRECT", "1"), Map.of("STATDIRECT", "2"), Map.of("STATDIRECT", "3"))));

            NormalizedTable table = service.normalize(export);

            assertThat(table.getRows()).hasSize(3);
            assertThat(table.getColumns()).isEqualTo(ReportField.DEFAULT_COLUMNS);
        }
    }

    @Nested
    @DisplayName("failure handling")
    class Failures {

        @Test
        void normalize_shouldTreatThrowingRecognizerAsNoMatch() {
            ShapeRecognizer broken = new StubRecognizer("broken", true, null);
            NormalizedRow row = NormalizedRow.builder().section("auto").label("A").value(1.0).build();
            ShapeRecognizer working = new StubRecognizer("working", false, NormalizedTable.of(ReportField.DEFAULT_COLUMNS, List.of(row)));

            NormalizedTable table = new ReportNormalizationService(List.of(broken, working)).normalize(Map.of("X", 1));

            assertThat(table.getShape()).isEqualTo("working");
            assertThat(table.getRows()).containsExactly(row);
        }

        @Test
        void normalize_shouldContinueWhenMatchingRecognizerYieldsNoRows() {
            ShapeRecognizer empty = new StubRecognizer("empty", false, NormalizedTable.empty());

            NormalizedTable table = new ReportNormalizationService(List.of(empty)).normalize(Map.of("X", 1));

            assertThat(table.isEmpty()).isTrue();
            assertThat(table.getShape()).isNull();
        }

        @Test
        void normalize_shouldReturnEmptyTableForNonMapRoot() {
            assertThat(service.normalize(List.of(1, 2)).isEmpty()).isTrue();
            assertThat(service.normalize(null).isEmpty()).isTrue();
        }

        @Test
        void normalize_shouldFallBackToGenericWalkForUnknownLayout() {
            Map<String, Object> export = Map.of("ENVELOPE", Map.of(
                    "STOCKITEMS", List.of(Map.of("NAME", "Sugar", "QTY", "40"))));

            NormalizedTable table = service.normalize(export);

            assertThat(table.getShape()).isEqualTo("generic");
            assertThat(table.getRows()).extracting(NormalizedRow::getLabel).containsExactly("Sugar");
        }
    }

    private record StubRecognizer(String name, boolean fail, NormalizedTable table) implements ShapeRecognizer {

        @Override
        public String getShapeName() {
            return name;
        }

        @Override
        public boolean supports(Map<String, Object> envelope) {
            return true;
        }

        @Override
        public NormalizedTable extract(Map<String, Object> envelope) {
            if (fail) {
                throw new IllegalStateException("malformed export");
            }
            return table;
        }
    }
}
