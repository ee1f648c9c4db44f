package com.tallyInsight.reportChat.chart.service;

import com.tallyInsight.reportChat.chart.model.ChartSpec;
import com.tallyInsight.reportChat.chart.model.ChartType;
import com.tallyInsight.reportChat.chart.model.GraphCommand;
import com.tallyInsight.reportChat.normalizer.model.NormalizedRow;
import com.tallyInsight.reportChat.normalizer.model.ReportSection;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChartServiceTest {

    private static final String COMPANY = "Sharma Traders Pvt Ltd";

    @Mock
    private LabelSelector labelSelector;

    @Mock
    private ChartSpecRefiner chartSpecRefiner;

    private ChartService service(boolean refinementEnabled) {
        return new ChartService(
                new RowFilterService(labelSelector, true),
                new BillsFrequencyCollapser(20),
                new NumericFieldInventory(),
                new ChartSpecBuilder(),
                chartSpecRefiner,
                refinementEnabled);
    }

    private static NormalizedRow row(String section, String label, double value) {
        return NormalizedRow.builder().section(section).label(label).value(value).build();
    }

    private final List<NormalizedRow> stock = List.of(
            row(ReportSection.STOCK_SUMMARY, "Sugar", 172000.0),
            row(ReportSection.STOCK_SUMMARY, "Rice", 96000.0));

    @Test
    void render_shouldPlotBillsAsCountsPerParty() {
        List<NormalizedRow> bills = new ArrayList<>(List.of(
                row(ReportSection.BILLS, "Agarwal Stores", 1000.0),
                row(ReportSection.BILLS, "Bansal & Sons", 2000.0),
                row(ReportSection.BILLS, "Agarwal Stores", 3000.0)));
        GraphCommand command = new GraphCommand(ChartType.BAR, "Bills Receivable", COMPANY);

        ChartSpec spec = service(false).render(bills, "graph bills receivable", command, "cid");

        assertThat(spec.getData().getValues())
                .extracting(v -> v.get("label"), v -> v.get("value"))
                .containsExactly(
                        tuple("Agarwal Stores", 2.0),
                        tuple("Bansal & Sons", 1.0));
    }

    @Test
    void render_shouldUseDeterministicSpecWhenRefinementIsOff() {
        GraphCommand command = new GraphCommand(ChartType.BAR, "Stock Summary", COMPANY);

        ChartSpec spec = service(false).render(stock, "graph stock summary", command, "cid");

        assertThat(spec.getData().getValues()).hasSize(2);
        assertThat(spec.getChartType()).isEqualTo(ChartType.BAR);
        verifyNoInteractions(chartSpecRefiner);
    }

    @Test
    void render_shouldRebindRefinedSpecToDeterministicData() {
        Map<String, Object> encoding = new LinkedHashMap<>();
        encoding.put("x", Map.of("field", "label", "type", "nominal"));
        encoding.put("y", Map.of("field", "value", "type", "quantitative"));
        ChartSpec refined = ChartSpec.builder()
                .mark(Map.of("type", "bar", "cornerRadiusEnd", 4))
                .encoding(encoding)
                .data(new ChartSpec.DataSet(List.of(Map.of("label", "Invented", "value", 1))))
                .build();
        when(chartSpecRefiner.refine(anyString(), any(), anyList(), anyList())).thenReturn(Optional.of(refined));
        GraphCommand command = new GraphCommand(ChartType.BAR, "Stock Summary", COMPANY);

        ChartSpec spec = service(true).render(stock, "graph stock summary", command, "cid");

        assertThat(spec).isSameAs(refined);
        assertThat(spec.getData().getValues()).extracting(v -> v.get("label")).containsExactly("Sugar", "Rice");
        assertThat(spec.hasColorEncoding()).isTrue();
    }

    @Test
    void render_shouldFallBackWhenRefinementFails() {
        when(chartSpecRefiner.refine(anyString(), any(), anyList(), anyList()))
                .thenThrow(new IllegalStateException("Groq API key not configured"));
        GraphCommand command = new GraphCommand(ChartType.PIE, "Stock Summary", COMPANY);

        ChartSpec spec = service(true).render(stock, "pie of stock summary", command, "cid");

        assertThat(spec.getMark()).isEqualTo(Map.of("type", "arc"));
        assertThat(spec.getData().getValues()).hasSize(2);
    }

    @Test
    void render_shouldFallBackWhenRefinerDeclines() {
        when(chartSpecRefiner.refine(anyString(), any(), anyList(), anyList())).thenReturn(Optional.empty());
        GraphCommand command = new GraphCommand(ChartType.LINE, "Stock Summary", COMPANY);

        ChartSpec spec = service(true).render(stock, "stock trend", command, "cid");

        assertThat(spec.getMark()).isEqualTo(Map.of("type", "line", "point", Map.of("filled", true, "size", 60)));
        assertThat(spec.getChartType()).isEqualTo(ChartType.LINE);
    }
}
