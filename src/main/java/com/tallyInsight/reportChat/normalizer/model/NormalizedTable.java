package com.tallyInsight.reportChat.normalizer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalized report - column names plus uniform rows.
 *
 * The column set depends on the shape that produced the rows
 * (see {@link ReportField#DEFAULT_COLUMNS}, {@link ReportField#STOCK_COLUMNS}, ...).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class NormalizedTable {

    /**
     * Ordered column names
     */
    private List<String> columns;

    /**
     * Normalized rows, in export order
     */
    private List<NormalizedRow> rows;

    /**
     * Shape recognizer that produced this table, null when nothing matched
     */
    private String shape;

    public static NormalizedTable empty() {
        return NormalizedTable.builder()
                .columns(ReportField.DEFAULT_COLUMNS)
                .rows(new ArrayList<>())
                .build();
    }

    public static NormalizedTable of(List<String> columns, List<NormalizedRow> rows) {
        return NormalizedTable.builder()
                .columns(columns)
                .rows(rows)
                .build();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return rows == null || rows.isEmpty();
    }
}
