package com.tallyInsight.reportChat.intent.model;

import com.tallyInsight.reportChat.intent.util.ReportTypePatterns;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Function schema the model must call to classify a question.
 * Constrains the answer to the same intent set the rules use.
 */
public final class IntentFunctionDefinition {

    public static final String FUNCTION_NAME = "classify_report_question";
    public static final String FUNCTION_DESCRIPTION = """
        Classifies a question about an accounting report into exactly one intent,
        with a confidence and the report it refers to.
        """;

    private IntentFunctionDefinition() {}

    public static Map<String, Object> getFunctionSchema() {
        List<Object> reportTypes = new ArrayList<>(ReportTypePatterns.knownReports());
        reportTypes.add(null);
        return Map.of(
            "type", "object",
            "properties", Map.of(
                "intent", Map.of(
                    "type", "string",
                    "description", "company_selection, value, table, summary or graph",
                    "enum", Intent.wireNames()
                ),
                "confidence", Map.of(
                    "type", "number",
                    "description", "Confidence level of the classification from 0.0 to 1.0",
                    "minimum", 0.0,
                    "maximum", 1.0
                ),
                "reportType", Map.of(
                    "type", List.of("string", "null"),
                    "description", "Report the question is about, null if unclear",
                    "enum", reportTypes
                ),
                "reason", Map.of(
                    "type", List.of("string", "null"),
                    "description", "One-line explanation"
                )
            ),
            "required", List.of("intent", "confidence")
        );
    }
}
