package com.tallyInsight.reportChat.gateway.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tallyInsight.reportChat.chart.model.ChartSpec;
import com.tallyInsight.reportChat.chart.model.GraphCommand;
import com.tallyInsight.reportChat.intent.model.Intent;
import com.tallyInsight.reportChat.intent.model.IntentResult;
import com.tallyInsight.reportChat.normalizer.model.NormalizedRow;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for report questions.
 *
 * Which payload is filled depends on {@code outputType}: {@code table} for table and summary,
 * {@code valueRows} for value, {@code chartSpec} (plus the table) for graph. Upstream problems come
 * back with {@code status = "error"} and an {@code errorCode}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryResponse {

    public static final String STATUS_OK = "ok";
    public static final String STATUS_ERROR = "error";

    public static final String NO_COMPANY_SELECTED = "NO_COMPANY_SELECTED";
    public static final String REPORT_NOT_FOUND = "REPORT_NOT_FOUND";
    public static final String PROCESSING_ERROR = "PROCESSING_ERROR";

    private String status;

    @JsonProperty("error_code")
    private String errorCode;

    private String message;

    @JsonProperty("output_type")
    private Intent outputType;

    private IntentResult intent;

    private GraphCommand command;

    @JsonProperty("report_used")
    private String reportUsed;

    @JsonProperty("company_name")
    private String companyName;

    private TableView table;

    @JsonProperty("value_rows")
    private List<NormalizedRow> valueRows;

    @JsonProperty("vega_spec")
    private ChartSpec chartSpec;

    private String correlationId;

    public static QueryResponse error(String errorCode, String message, IntentResult intent, String correlationId) {
        return QueryResponse.builder()
                .status(STATUS_ERROR)
                .errorCode(errorCode)
                .message(message)
                .intent(intent)
                .correlationId(correlationId)
                .build();
    }

    /**
     * Rows projected onto the table's columns.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class TableView {
        private List<String> columns;
        private List<Map<String, Object>> rows;

        @JsonProperty("row_count")
        private int rowCount;
    }
}
