package com.tallyInsight.reportChat.orchestrator.service;

import com.tallyInsight.reportChat.gateway.dto.QueryResponse;
import com.tallyInsight.reportChat.intent.util.ReportTypePatterns;
import com.tallyInsight.reportChat.normalizer.model.NormalizedRow;
import com.tallyInsight.reportChat.normalizer.model.ReportField;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Projects rows onto table columns. A sales register shows only credit and closing balance.
 */
@Component
public class TableViewBuilder {

    static final List<String> SALES_REGISTER_COLUMNS = List.of(
            ReportField.SECTION, ReportField.LABEL, ReportField.CREDIT, ReportField.CLOSING_BALANCE);

    public QueryResponse.TableView build(List<String> columns, List<NormalizedRow> rows, String reportName) {
        List<String> projected = ReportTypePatterns.SALES_REGISTER.equalsIgnoreCase(reportName)
                ? SALES_REGISTER_COLUMNS
                : columns;

        List<Map<String, Object>> records = new ArrayList<>();
        for (NormalizedRow row : rows) {
            Map<String, Object> record = new LinkedHashMap<>();
            for (String column : projected) {
                record.put(column, cell(row, column));
            }
            records.add(record);
        }
        return QueryResponse.TableView.builder()
                .columns(projected)
                .rows(records)
                .rowCount(records.size())
                .build();
    }

    private static Object cell(NormalizedRow row, String column) {
        return switch (column) {
            case ReportField.SECTION -> row.getSection();
            case ReportField.LABEL -> row.getLabel();
            default -> row.getNumeric(column);
        };
    }
}
