package com.tallyInsight.reportChat.normalizer.shape;

import com.tallyInsight.reportChat.normalizer.model.NormalizedRow;
import com.tallyInsight.reportChat.normalizer.model.ReportSection;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class GenericFallbackShapeRecognizerTest {

    private final GenericFallbackShapeRecognizer recognizer = new GenericFallbackShapeRecognizer(64);

    @Test
    void extract_shouldTagRowsBelowRatioKeyAsRatioAnalysis() {
        Map<String, Object> envelope = Map.of("RATIOANALYSIS", Map.of("RATIOS", List.of(
                Map.of("NAME", "Current Ratio", "VALUE", "3.13"),
                Map.of("NAME", "Quick Ratio", "VALUE", "1.92"))));

        assertThat(recognizer.extract(envelope).getRows())
                .extracting(NormalizedRow::getSection, NormalizedRow::getLabel, NormalizedRow::getValue)
                .containsExactly(
                        tuple(ReportSection.RATIO_ANALYSIS, "Current Ratio", 3.13),
                        tuple(ReportSection.RATIO_ANALYSIS, "Quick Ratio", 1.92));
    }

    @Test
    void extract_shouldKeepLeadingNumberOfRatioNotation() {
        Map<String, Object> envelope = Map.of("RATIOANALYSIS", Map.of("RATIOS", List.of(
                Map.of("NAME", "Current Ratio", "VALUE", "17.22 : 1"),
                Map.of("NAME", "Inventory Turnover", "VALUE", "0.00 days"))));

        assertThat(recognizer.extract(envelope).getRows())
                .extracting(NormalizedRow::getLabel, NormalizedRow::getValue)
                .containsExactly(
                        tuple("Current Ratio", 17.22),
                        tuple("Inventory Turnover", 0.0));
    }

    @Test
    void extract_shouldTagTopLevelListItemsAsAuto() {
        Map<String, Object> envelope = Map.of("RATIOS", List.of(Map.of("NAME", "Current Ratio", "VALUE", "3.13")));

        assertThat(recognizer.extract(envelope).getRows())
                .extracting(NormalizedRow::getSection)
                .containsExactly(ReportSection.AUTO);
    }

    @Test
    void extract_shouldSynthesizeLabelForUnnamedListItems() {
        Map<String, Object> envelope = Map.of("AMOUNTS", List.of(Map.of("X", 7)));

        assertThat(recognizer.extract(envelope).getRows())
                .extracting(NormalizedRow::getLabel, NormalizedRow::getValue)
                .containsExactly(tuple("AMOUNTS_0", 7.0));
    }

    @Test
    void extract_shouldRequireLabelAndValueForNestedMaps() {
        Map<String, Object> envelope = Map.of(
                "ONLYNAME", Map.of("NAME", "No figure"),
                "BOTH", Map.of("NAME", "Cash", "AMT", "250"));

        assertThat(recognizer.extract(envelope).getRows())
                .extracting(NormalizedRow::getLabel)
                .containsExactly("Cash");
    }

    @Test
    void supports_shouldAcceptAnything() {
        assertThat(recognizer.supports(Map.of())).isTrue();
        assertThat(recognizer.extract(Map.of()).isEmpty()).isTrue();
    }
}
