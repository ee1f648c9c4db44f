package com.tallyInsight.reportChat.chart.service;

import com.tallyInsight.reportChat.normalizer.model.NormalizedRow;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class NumericFieldInventoryTest {

    private final NumericFieldInventory inventory = new NumericFieldInventory();

    @Test
    void inventory_shouldListLedgerFieldsInFixedOrder() {
        NormalizedRow row = NormalizedRow.builder()
                .label("April").value(182000.0).credit(182000.0).closingBalance(182000.0)
                .build();

        assertThat(inventory.inventory(List.of(row))).containsExactly("credit", "closing_balance", "value");
    }

    @Test
    void inventory_shouldAppendOtherNumericFacets() {
        NormalizedRow row = NormalizedRow.builder()
                .label("Sugar").value(-172000.0).quantity(80.0).rate(2150.0)
                .build();

        assertThat(inventory.inventory(List.of(row))).containsExactly("value", "quantity", "rate");
    }

    @Test
    void inventory_shouldReadOnlyTheFirstRow() {
        NormalizedRow first = NormalizedRow.builder().label("A").inflow(1.0).build();
        NormalizedRow second = NormalizedRow.builder().label("B").debit(2.0).build();

        assertThat(inventory.inventory(List.of(first, second))).containsExactly("inflow");
    }

    @Test
    void inventory_shouldDefaultToValue() {
        assertThat(inventory.inventory(List.of(NormalizedRow.builder().label("A").build()))).containsExactly("value");
        assertThat(inventory.inventory(List.of())).isEmpty();
    }
}
