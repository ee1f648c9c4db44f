package com.tallyInsight.reportChat.normalizer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One line of a normalized report.
 *
 * Every export shape is flattened into this model. {@code label} is never empty (recognizers
 * synthesize {@code row_<i>}-style labels when the export carries none) and a null {@code value}
 * means the figure is genuinely unknown, which is not the same as a parsed zero.
 * The optional facets are only populated by the shapes that carry them.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class NormalizedRow {

    @JsonProperty(ReportField.SECTION)
    private String section;

    @JsonProperty(ReportField.LABEL)
    private String label;

    @JsonProperty(ReportField.VALUE)
    private Double value;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty(ReportField.QUANTITY)
    private Double quantity;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty(ReportField.RATE)
    private Double rate;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty(ReportField.DEBIT)
    private Double debit;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty(ReportField.CREDIT)
    private Double credit;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty(ReportField.CLOSING_BALANCE)
    private Double closingBalance;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty(ReportField.INFLOW)
    private Double inflow;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty(ReportField.OUTFLOW)
    private Double outflow;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty(ReportField.NET_FLOW)
    private Double netFlow;

    /**
     * Reads a numeric facet by its column name.
     *
     * @param field Column name from {@link ReportField}
     * @return The facet value, or null if absent or not a numeric column
     */
    public Double getNumeric(String field) {
        if (field == null) {
            return null;
        }
        return switch (field) {
            case ReportField.VALUE -> value;
            case ReportField.QUANTITY -> quantity;
            case ReportField.RATE -> rate;
            case ReportField.DEBIT -> debit;
            case ReportField.CREDIT -> credit;
            case ReportField.CLOSING_BALANCE -> closingBalance;
            case ReportField.INFLOW -> inflow;
            case ReportField.OUTFLOW -> outflow;
            case ReportField.NET_FLOW -> netFlow;
            default -> null;
        };
    }

    /**
     * @return true if at least one numeric facet is known
     */
    @JsonIgnore
    public boolean hasAnyNumeric() {
        for (String field : ReportField.NUMERIC_FIELDS) {
            if (getNumeric(field) != null) {
                return true;
            }
        }
        return false;
    }

    /**
     * Flat field map used as a chart data record. Null optional facets are left out,
     * {@code value} is always present.
     */
    public Map<String, Object> toDataRecord() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put(ReportField.SECTION, section);
        record.put(ReportField.LABEL, label);
        record.put(ReportField.VALUE, value);
        for (String field : ReportField.NUMERIC_FIELDS) {
            if (ReportField.VALUE.equals(field)) {
                continue;
            }
            Double facet = getNumeric(field);
            if (facet != null) {
                record.put(field, facet);
            }
        }
        return record;
    }
}
