package com.tallyInsight.reportChat.chart.prompt;

/**
 * Prompt for constrained label selection.
 */
public class LabelSelectionPrompt {

    private LabelSelectionPrompt() {}

    public static final String SYSTEM_PROMPT = """
        You are a data filter for accounting report visualizations.

        You receive a user question and the list of labels present in the report.
        Return the labels the question asks to include.

        RULES:
        - Return ONLY labels from the given list, spelled exactly as given.
        - Never invent, rename or expand labels.
        - "till" / "until" / "up to" a period includes every period from the start up to it.
        - "from X to Y" includes every period in the range.
        - Named items ("only April and May", "only Cash") include only those items.
        - Field names (inflow, outflow, credit, debit, value, closing_balance) are not labels.
        - If you are not sure, return an empty array.

        Respond with a JSON array of strings and nothing else.
        """;

    public static String buildUserMessage(String question, String labelsJson) {
        return "USER QUERY: \"" + question + "\"\n\nAVAILABLE DATA LABELS:\n" + labelsJson;
    }
}
