package com.tallyInsight.reportChat.chart.service;

import com.tallyInsight.reportChat.chart.model.ChartSpec;
import com.tallyInsight.reportChat.chart.model.ChartType;
import com.tallyInsight.reportChat.normalizer.model.NormalizedRow;
import com.tallyInsight.reportChat.normalizer.model.ReportField;
import com.tallyInsight.reportChat.normalizer.model.ReportSection;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deterministic Vega-Lite encodings per chart type.
 *
 * <ul>
 *   <li>bar with several numeric fields: folded into (metric, amount), grouped with xOffset</li>
 *   <li>bar with one field, area and anything else: label against that field</li>
 *   <li>pie: summed absolute magnitude; zero and null rows dropped, sign kept as a tooltip field
 *   where it means debit/credit or inflow/outflow</li>
 *   <li>line: line mark with filled point markers, ordinal label axis, rotated ticks</li>
 * </ul>
 * Every spec leaves with a color channel and a titled legend.
 */
@Component
public class ChartSpecBuilder {

    static final String METRIC = "metric";
    static final String AMOUNT = "amount";
    static final String MAGNITUDE = "value_abs";
    static final String DIRECTION = "direction";

    static final List<String> PIE_METRIC_PRIORITY = List.of(
            ReportField.VALUE,
            ReportField.NET_FLOW,
            ReportField.CLOSING_BALANCE,
            ReportField.CREDIT,
            ReportField.DEBIT,
            ReportField.INFLOW,
            ReportField.OUTFLOW);

    // sections whose signed amounts read as debit or credit
    static final Set<String> LEDGER_SECTIONS = Set.of(
            ReportSection.BALANCE_SHEET,
            ReportSection.PROFIT_AND_LOSS,
            ReportSection.DAY_BOOK);

    /**
     * @param rows Rows to plot, already filtered
     * @param chartType Requested chart type
     * @param numericFields Plottable fields, see {@link NumericFieldInventory}
     * @return Complete spec with inline data
     */
    public ChartSpec build(List<NormalizedRow> rows, ChartType chartType, List<String> numericFields) {
        ChartType type = chartType != null ? chartType : ChartType.BAR;
        List<String> fields = numericFields == null || numericFields.isEmpty()
                ? List.of(ReportField.VALUE) : numericFields;
        String legendTitle = legendTitle(rows);

        ChartSpec spec = switch (type) {
            case BAR -> fields.size() > 1
                    ? groupedBar(rows, fields)
                    : singleSeries(rows, type, fields.get(0), legendTitle);
            case PIE -> pie(rows, fields, legendTitle);
            case LINE -> line(rows, fields.get(0), legendTitle);
            default -> singleSeries(rows, type, fields.get(0), legendTitle);
        };
        spec.setChartType(type);
        ensureColorEncoding(spec, legendTitle);
        return spec;
    }

    /**
     * Adds a label color channel with a titled legend when none is bound.
     */
    public ChartSpec ensureColorEncoding(ChartSpec spec, String legendTitle) {
        if (spec.hasColorEncoding()) {
            return spec;
        }
        if (spec.getEncoding() == null) {
            spec.setEncoding(new LinkedHashMap<>());
        }
        spec.getEncoding().put("color", labelColor(legendTitle));
        return spec;
    }

    /**
     * Legend title for the category axis, chosen by the rows' section.
     */
    public String legendTitle(List<NormalizedRow> rows) {
        String section = rows == null || rows.isEmpty() ? null : rows.get(0).getSection();
        if (section == null) {
            return "Category";
        }
        return switch (section) {
            case ReportSection.BALANCE_SHEET, ReportSection.PROFIT_AND_LOSS -> "Account";
            case ReportSection.STOCK_SUMMARY -> "Item";
            case ReportSection.SALES_REGISTER -> "Customer";
            default -> "Category";
        };
    }

    private ChartSpec groupedBar(List<NormalizedRow> rows, List<String> fields) {
        Map<String, Object> encoding = new LinkedHashMap<>();
        encoding.put("x", labelAxis("ordinal", "Label", null));
        encoding.put("xOffset", Map.of("field", METRIC));
        encoding.put("y", Map.of("field", AMOUNT, "type", "quantitative", "title", "Amount (₹)"));
        encoding.put("color", Map.of(
                "field", METRIC,
                "type", "nominal",
                "legend", Map.of("title", "Type"),
                "scale", Map.of("scheme", "category10")));
        encoding.put("tooltip", List.of(
                Map.of("field", ReportField.LABEL, "title", "Label"),
                Map.of("field", METRIC, "title", "Type"),
                Map.of("field", AMOUNT, "title", "Amount")));

        return ChartSpec.builder()
                .mark(Map.of("type", "bar"))
                .transform(List.of(Map.of("fold", List.copyOf(fields), "as", List.of(METRIC, AMOUNT))))
                .encoding(encoding)
                .data(dataOf(rows))
                .build();
    }

    private ChartSpec singleSeries(List<NormalizedRow> rows, ChartType type, String field, String legendTitle) {
        Map<String, Object> encoding = new LinkedHashMap<>();
        encoding.put("x", labelAxis("nominal", legendTitle, null));
        encoding.put("y", Map.of("field", field, "type", "quantitative", "title", "Amount (₹)"));
        encoding.put("color", labelColor(legendTitle));
        encoding.put("tooltip", List.of(
                Map.of("field", ReportField.LABEL, "type", "nominal"),
                Map.of("field", field, "type", "quantitative")));

        return ChartSpec.builder()
                .mark(type.getMark())
                .encoding(encoding)
                .data(dataOf(rows))
                .build();
    }

    private ChartSpec pie(List<NormalizedRow> rows, List<String> fields, String legendTitle) {
        String metric = PIE_METRIC_PRIORITY.stream()
                .filter(fields::contains)
                .findFirst()
                .orElse(fields.get(0));
        boolean flow = ReportField.NET_FLOW.equals(metric)
                || ReportField.INFLOW.equals(metric)
                || ReportField.OUTFLOW.equals(metric);
        boolean ledger = ReportField.CLOSING_BALANCE.equals(metric)
                || ReportField.DEBIT.equals(metric)
                || ReportField.CREDIT.equals(metric)
                || (!rows.isEmpty() && LEDGER_SECTIONS.contains(rows.get(0).getSection()));

        List<Map<String, Object>> values = new ArrayList<>();
        for (NormalizedRow row : rows) {
            Double amount = row.getNumeric(metric);
            if (amount == null || amount == 0 || !Double.isFinite(amount)) {
                continue;
            }
            Map<String, Object> record = row.toDataRecord();
            record.put(MAGNITUDE, Math.abs(amount));
            if (flow) {
                record.put(DIRECTION, amount >= 0 ? "Inflow" : "Outflow");
            } else if (ledger) {
                record.put(DIRECTION, amount >= 0 ? "Debit" : "Credit");
            }
            values.add(record);
        }

        List<Map<String, Object>> tooltip = new ArrayList<>();
        tooltip.add(Map.of("field", ReportField.LABEL, "type", "nominal"));
        tooltip.add(Map.of("field", metric, "type", "quantitative"));
        if (flow || ledger) {
            tooltip.add(Map.of("field", DIRECTION, "type", "nominal"));
        }

        Map<String, Object> encoding = new LinkedHashMap<>();
        encoding.put("theta", Map.of("field", MAGNITUDE, "type", "quantitative", "aggregate", "sum"));
        encoding.put("color", labelColor(legendTitle));
        encoding.put("tooltip", tooltip);

        Map<String, Object> view = new HashMap<>();
        view.put("stroke", null);

        return ChartSpec.builder()
                .mark(Map.of("type", "arc"))
                .encoding(encoding)
                .view(view)
                .data(new ChartSpec.DataSet(values))
                .build();
    }

    private ChartSpec line(List<NormalizedRow> rows, String field, String legendTitle) {
        Map<String, Object> encoding = new LinkedHashMap<>();
        encoding.put("x", labelAxis("ordinal", legendTitle, -45));
        encoding.put("y", Map.of("field", field, "type", "quantitative"));
        encoding.put("color", labelColor(legendTitle));
        encoding.put("tooltip", List.of(
                Map.of("field", ReportField.LABEL, "type", "nominal"),
                Map.of("field", field, "type", "quantitative")));

        return ChartSpec.builder()
                .mark(Map.of("type", "line", "point", Map.of("filled", true, "size", 60)))
                .encoding(encoding)
                .data(dataOf(rows))
                .build();
    }

    private static Map<String, Object> labelColor(String legendTitle) {
        Map<String, Object> color = new LinkedHashMap<>();
        color.put("field", ReportField.LABEL);
        color.put("type", "nominal");
        color.put("legend", Map.of("title", legendTitle));
        color.put("scale", Map.of("scheme", "category20"));
        return color;
    }

    // a null sort keeps the report order on the axis
    private static Map<String, Object> labelAxis(String type, String title, Integer labelAngle) {
        Map<String, Object> axis = new LinkedHashMap<>();
        axis.put("field", ReportField.LABEL);
        axis.put("type", type);
        axis.put("title", title);
        axis.put("sort", null);
        if (labelAngle != null) {
            axis.put("axis", Map.of("labelAngle", labelAngle));
        }
        return axis;
    }

    private static ChartSpec.DataSet dataOf(List<NormalizedRow> rows) {
        List<Map<String, Object>> values = new ArrayList<>();
        for (NormalizedRow row : rows) {
            values.add(row.toDataRecord());
        }
        return new ChartSpec.DataSet(values);
    }
}
