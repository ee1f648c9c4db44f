package com.tallyInsight.reportChat.chart.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.Locale;

/**
 * What to draw: chart type, canonical report name and the company to fetch it for.
 */
@Value
public class GraphCommand {

    @JsonProperty("chart_type")
    ChartType chartType;

    @JsonProperty("report_name")
    String reportName;

    @JsonProperty("company_name")
    String companyName;

    @JsonIgnore
    public boolean isBillsRegister() {
        return reportName != null && reportName.toLowerCase(Locale.ROOT).startsWith("bills ");
    }
}
