package com.tallyInsight.reportChat.chart.service;

import com.tallyInsight.reportChat.normalizer.model.NormalizedRow;
import com.tallyInsight.reportChat.normalizer.model.ReportSection;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class BillsFrequencyCollapserTest {

    private final BillsFrequencyCollapser collapser = new BillsFrequencyCollapser(20);

    private static NormalizedRow bill(String party) {
        return NormalizedRow.builder().section(ReportSection.BILLS).label(party).value(1000.0).build();
    }

    @Test
    void collapse_shouldCountBillsPerPartyMostFrequentFirst() {
        List<NormalizedRow> bills = List.of(bill("Bansal"), bill("Agarwal"), bill("Agarwal"), bill("Chopra"),
                bill("Agarwal"), bill("Chopra"));

        assertThat(collapser.collapse(bills))
                .extracting(NormalizedRow::getSection, NormalizedRow::getLabel, NormalizedRow::getValue)
                .containsExactly(
                        tuple(ReportSection.BILLS, "Agarwal", 3.0),
                        tuple(ReportSection.BILLS, "Chopra", 2.0),
                        tuple(ReportSection.BILLS, "Bansal", 1.0));
    }

    @Test
    void collapse_shouldCapPartiesAndKeepFirstSeenOrderOnTies() {
        List<NormalizedRow> bills = new ArrayList<>();
        IntStream.rangeClosed(1, 25).forEach(i -> bills.add(bill(String.format("Party %02d", i))));
        bills.add(bill("Party 25"));

        List<NormalizedRow> collapsed = collapser.collapse(bills);

        assertThat(collapsed).hasSize(20);
        assertThat(collapsed.get(0).getLabel()).isEqualTo("Party 25");
        assertThat(collapsed.get(1).getLabel()).isEqualTo("Party 01");
        assertThat(collapsed.get(19).getLabel()).isEqualTo("Party 19");
    }

    @Test
    void collapse_shouldSkipBlankLabels() {
        assertThat(collapser.collapse(List.of(bill(" "), bill("Agarwal")))).hasSize(1);
    }
}
