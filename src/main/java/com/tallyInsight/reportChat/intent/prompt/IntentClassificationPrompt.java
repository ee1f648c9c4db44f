package com.tallyInsight.reportChat.intent.prompt;

import java.util.List;

/**
 * Prompts for model-assisted intent classification.
 */
public class IntentClassificationPrompt {

    private IntentClassificationPrompt() {}

    public static final String SYSTEM_PROMPT = """
        You are a query classifier for a Tally accounting assistant.

        Classify the user's question into exactly ONE intent:
        1. company_selection - the user selects or changes the active company (e.g. "use Dakshin", "select ABC Ltd")
        2. value - the user wants a single number or a single item (e.g. "what is the value of capital account?",
           "which is my costliest stock item?", "compare cash and bank")
        3. summary - the user wants a textual explanation of a report
        4. graph - the user wants a visualization, or compares three or more items
        5. table - the user wants rows in tabular form, including "top N" lists

        Also identify the report the question is about:
        Balance Sheet (assets, liabilities, capital), Profit & Loss (incomes, expenses),
        Stock Summary (inventory, stock items), Day Book (vouchers, particulars),
        Bills Receivable, Bills Payable, Cash Flow, Sales Register, Ratio Analysis, Statistics.
        Use null when the report is unclear.

        Call the function with the intent, a confidence between 0.0 and 1.0, the report and a short reason.
        """;

    /**
     * Builds the user message: recent turns first, then the question being classified.
     */
    public static String buildUserMessage(String question, List<String> history) {
        StringBuilder message = new StringBuilder();
        if (history != null && !history.isEmpty()) {
            message.append("Recent conversation:\n");
            history.forEach(turn -> message.append(turn).append('\n'));
            message.append('\n');
        }
        message.append("Current query: \"").append(question).append('"');
        return message.toString();
    }
}
