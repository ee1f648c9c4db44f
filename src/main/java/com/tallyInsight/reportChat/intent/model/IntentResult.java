package com.tallyInsight.reportChat.intent.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Classification of one question.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IntentResult {

    public static final double RULE_CONFIDENCE = 0.7;
    public static final double DEFAULT_CONFIDENCE = 0.5;

    @JsonProperty("intent")
    private Intent intent;

    /**
     * Nominal [0, 1] score
     */
    @JsonProperty("confidence")
    private double confidence;

    /**
     * Canonical report name suggested by the question, e.g. "Stock Summary"
     */
    @JsonProperty("report_type_hint")
    private String reportTypeHint;

    @JsonProperty("source")
    private IntentSource source;

    /**
     * Company named by a company-selection question
     */
    @JsonProperty("company_name")
    private String companyName;

    public static IntentResult rule(Intent intent, String reportTypeHint) {
        return IntentResult.builder()
                .intent(intent)
                .confidence(RULE_CONFIDENCE)
                .reportTypeHint(reportTypeHint)
                .source(IntentSource.RULE)
                .build();
    }

    public static IntentResult fallback(String reportTypeHint) {
        return IntentResult.builder()
                .intent(Intent.SUMMARY)
                .confidence(DEFAULT_CONFIDENCE)
                .reportTypeHint(reportTypeHint)
                .source(IntentSource.DEFAULT)
                .build();
    }
}
