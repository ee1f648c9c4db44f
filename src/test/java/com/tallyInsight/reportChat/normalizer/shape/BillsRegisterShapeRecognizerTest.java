package com.tallyInsight.reportChat.normalizer.shape;

import com.tallyInsight.reportChat.normalizer.model.NormalizedRow;
import com.tallyInsight.reportChat.normalizer.model.ReportSection;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class BillsRegisterShapeRecognizerTest {

    private final BillsRegisterShapeRecognizer recognizer = new BillsRegisterShapeRecognizer();

    @Test
    void extract_shouldLabelByPartyAndReadFirstAvailableAmount() {
        Map<String, Object> envelope = Map.of(
                "BILLFIXED", List.of(
                        Map.of("BILLPARTY", "Agarwal Stores", "BILLREF", "SI/001"),
                        Map.of("BILLPARTY", "", "BILLREF", "SI/002"),
                        Map.of("BILLDATE", "3-Mar-24")),
                "BILLFINAL", List.of("48,000.00", "", ""),
                "BILLCL", List.of("1", "12,500.00", ""));

        assertThat(recognizer.extract(envelope).getRows())
                .extracting(NormalizedRow::getSection, NormalizedRow::getLabel, NormalizedRow::getValue)
                .containsExactly(
                        tuple(ReportSection.BILLS, "Agarwal Stores", 48000.0),
                        tuple(ReportSection.BILLS, "SI/002", 12500.0),
                        tuple(ReportSection.BILLS, "3-Mar-24", null));
    }

    @Test
    void extract_shouldFallBackToIndexedLabel() {
        Map<String, Object> envelope = Map.of("BILLFIXED", List.of(Map.of("BILLPARTY", " ")));

        assertThat(recognizer.extract(envelope).getRows().get(0).getLabel()).isEqualTo("Bill_0");
    }
}
