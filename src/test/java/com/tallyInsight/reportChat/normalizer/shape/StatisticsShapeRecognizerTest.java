package com.tallyInsight.reportChat.normalizer.shape;

import com.tallyInsight.reportChat.normalizer.model.NormalizedRow;
import com.tallyInsight.reportChat.normalizer.model.NormalizedTable;
import com.tallyInsight.reportChat.normalizer.model.ReportSection;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class StatisticsShapeRecognizerTest {

    private final StatisticsShapeRecognizer recognizer = new StatisticsShapeRecognizer();

    @Test
    void extract_shouldPairNamesWithDirectValues() {
        Map<String, Object> envelope = Map.of(
                "STATNAME", List.of(Map.of("DSPDISPNAME", "Sales"), Map.of("DSPDISPNAME", "Receipt")),
                "STATVALUE", List.of(Map.of("STATDIRECT", "412"), Map.of("STATDIRECT", "")));

        assertThat(recognizer.supports(envelope)).isTrue();
        NormalizedTable table = recognizer.extract(envelope);

        assertThat(table.getRows())
                .extracting(NormalizedRow::getSection, NormalizedRow::getLabel, NormalizedRow::getValue)
                .containsExactly(
                        tuple(ReportSection.STATISTICS, "Sales", 412.0),
                        tuple(ReportSection.STATISTICS, "Receipt", null));
    }

    @Test
    void extract_shouldStopAtShorterArray() {
        Map<String, Object> envelope = Map.of(
                "STATNAME", List.of("Sales", "Purchase", "Journal"),
                "STATVALUE", List.of(Map.of("STATDIRECT", "1"), Map.of("STATDIRECT", "2")));

        assertThat(recognizer.extract(envelope).getRows()).hasSize(2);
    }

    @Test
    void supports_shouldRequireBothArrays() {
        assertThat(recognizer.supports(Map.of("STATNAME", List.of("Sales")))).isFalse();
    }
}
