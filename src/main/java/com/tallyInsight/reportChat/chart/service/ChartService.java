package com.tallyInsight.reportChat.chart.service;

import com.tallyInsight.reportChat.chart.model.ChartSpec;
import com.tallyInsight.reportChat.chart.model.GraphCommand;
import com.tallyInsight.reportChat.normalizer.model.NormalizedRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Chart pipeline for graph questions: filter, bills frequency view, field inventory, spec.
 *
 * Refinement is optional; whatever it returns is re-bound to the deterministic data set and
 * gets a color channel if it lacks one.
 */
@Slf4j
@Service
public class ChartService {

    private final RowFilterService rowFilterService;
    private final BillsFrequencyCollapser billsFrequencyCollapser;
    private final NumericFieldInventory numericFieldInventory;
    private final ChartSpecBuilder chartSpecBuilder;
    private final ChartSpecRefiner chartSpecRefiner;
    private final boolean refinementEnabled;

    public ChartService(RowFilterService rowFilterService,
                        BillsFrequencyCollapser billsFrequencyCollapser,
                        NumericFieldInventory numericFieldInventory,
                        ChartSpecBuilder chartSpecBuilder,
                        ChartSpecRefiner chartSpecRefiner,
                        @Value("${report-chat.chart.refinement-enabled:false}") boolean refinementEnabled) {
        this.rowFilterService = rowFilterService;
        this.billsFrequencyCollapser = billsFrequencyCollapser;
        this.numericFieldInventory = numericFieldInventory;
        this.chartSpecBuilder = chartSpecBuilder;
        this.chartSpecRefiner = chartSpecRefiner;
        this.refinementEnabled = refinementEnabled;
    }

    /**
     * @param rows Normalized, non-empty report rows
     * @param question Question text
     * @param command Parsed graph command
     * @param correlationId Correlation ID for logging
     * @return Chart spec with inline data
     */
    public ChartSpec render(List<NormalizedRow> rows, String question, GraphCommand command, String correlationId) {
        log.debug("Step CHART_BUILD - correlationId: {}", correlationId);

        List<NormalizedRow> plotted = rowFilterService.filter(rows, question, correlationId);
        if (command.isBillsRegister()) {
            plotted = billsFrequencyCollapser.collapse(plotted);
        }

        List<String> numericFields = numericFieldInventory.inventory(plotted);
        ChartSpec deterministic = chartSpecBuilder.build(plotted, command.getChartType(), numericFields);

        ChartSpec spec = refinementEnabled
                ? refine(deterministic, question, command, numericFields, correlationId).orElse(deterministic)
                : deterministic;

        log.info("Chart built - correlationId: {}, chartType: {}, rows: {}, fields: {}, refined: {}",
                correlationId, command.getChartType(), plotted.size(), numericFields, spec != deterministic);
        return spec;
    }

    private Optional<ChartSpec> refine(ChartSpec deterministic, String question, GraphCommand command,
                                       List<String> numericFields, String correlationId) {
        List<Map<String, Object>> values = deterministic.getData().getValues();
        try {
            return chartSpecRefiner.refine(question, command.getChartType(), numericFields, values)
                    .map(refined -> {
                        refined.setData(new ChartSpec.DataSet(values));
                        return chartSpecBuilder.ensureColorEncoding(refined, "Category");
                    });
        } catch (RuntimeException e) {
            log.warn("Chart refinement failed, using deterministic spec - correlationId: {}, error: {}",
                    correlationId, e.getMessage());
            return Optional.empty();
        }
    }
}
