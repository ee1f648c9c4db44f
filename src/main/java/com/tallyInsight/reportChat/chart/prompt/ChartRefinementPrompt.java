package com.tallyInsight.reportChat.chart.prompt;

/**
 * Prompt for Vega-Lite refinement.
 */
public class ChartRefinementPrompt {

    private ChartRefinementPrompt() {}

    public static final String SYSTEM_PROMPT = """
        You are a Vega-Lite specification generator for accounting charts.

        Generate a Vega-Lite v5 specification that:
        1. Uses ONLY the fields the user asks about, taken from the available fields
        2. Creates the requested chart type
        3. Gives each category a distinct color and shows a legend with a title
        4. Has tooltips for every plotted field
        5. Uses "label" for the category axis (months, accounts or items)

        FIELD MAPPING:
        - "outflow" only: use the "outflow" field
        - "sales": use "credit" or "value"
        - "inflow vs outflow": use both fields

        AXIS TITLES: "Month", "Period", "Category" or "Item" for x; "Amount (₹)", "Value (₹)" or "Quantity" for y.

        Return ONLY the JSON object, with "$schema": "https://vega.github.io/schema/vega-lite/v5.json",
        "mark", "encoding" and, when needed, "transform". Do not include "data".
        """;

    public static String buildUserMessage(String question, String chartType, String fieldsJson, String sampleJson) {
        return "USER QUERY: " + question + "\n"
                + "CHART TYPE: " + chartType + "\n"
                + "AVAILABLE FIELDS: " + fieldsJson + "\n\n"
                + "SAMPLE DATA (first rows):\n" + sampleJson;
    }
}
