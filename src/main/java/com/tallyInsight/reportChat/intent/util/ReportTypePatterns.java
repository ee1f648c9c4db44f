package com.tallyInsight.reportChat.intent.util;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Keyword patterns that map a question to a canonical report name.
 * Checked in declaration order; the narrow registers come before the broad statements.
 */
public final class ReportTypePatterns {

    public static final String BILLS_RECEIVABLE = "Bills Receivable";
    public static final String BILLS_PAYABLE = "Bills Payable";
    public static final String CASH_FLOW = "Cash Flow";
    public static final String SALES_REGISTER = "Sales Register";
    public static final String RATIO_ANALYSIS = "Ratio Analysis";
    public static final String STATISTICS = "Statistics";
    public static final String DAY_BOOK = "Day Book";
    public static final String STOCK_SUMMARY = "Stock Summary";
    public static final String BALANCE_SHEET = "Balance Sheet";
    public static final String PROFIT_AND_LOSS = "Profit & Loss";

    private static final Map<String, Pattern> PATTERNS = new LinkedHashMap<>();

    static {
        PATTERNS.put(BILLS_RECEIVABLE, Pattern.compile("\\b(bills? receivable|receivables?|sundry debtors outstanding)\\b"));
        PATTERNS.put(BILLS_PAYABLE, Pattern.compile("\\b(bills? payable|payables?)\\b"));
        PATTERNS.put(CASH_FLOW, Pattern.compile("\\b(cash ?flow|inflows?|outflows?|net flow)\\b"));
        PATTERNS.put(SALES_REGISTER, Pattern.compile("\\b(sales register|monthly sales|sales by month)\\b"));
        PATTERNS.put(RATIO_ANALYSIS, Pattern.compile("\\b(ratios?|ratio analysis|working capital)\\b"));
        PATTERNS.put(STATISTICS, Pattern.compile("\\b(statistics|voucher counts?|number of vouchers)\\b"));
        PATTERNS.put(DAY_BOOK, Pattern.compile("\\b(day ?book|particulars|vouchers?|debit amount|credit amount|entries)\\b"));
        PATTERNS.put(STOCK_SUMMARY, Pattern.compile("\\b(stock|inventory|items?|quantity|rate)\\b"));
        PATTERNS.put(BALANCE_SHEET, Pattern.compile("\\b(balance sheet|assets|liabilities|capital|loans|fixed assets|current assets)\\b"));
        PATTERNS.put(PROFIT_AND_LOSS, Pattern.compile("\\b(profit|loss|income|expenses?|indirect income|indirect expenses?|sales accounts?|purchase accounts?)\\b"));
    }

    private ReportTypePatterns() {}

    /**
     * @param normalizedQuestion Output of {@link QueryText#normalize(String)}
     * @return Canonical report name of the first matching pattern
     */
    public static Optional<String> infer(String normalizedQuestion) {
        if (normalizedQuestion == null || normalizedQuestion.isBlank()) {
            return Optional.empty();
        }
        return PATTERNS.entrySet().stream()
                .filter(entry -> entry.getValue().matcher(normalizedQuestion).find())
                .map(Map.Entry::getKey)
                .findFirst();
    }

    public static List<String> knownReports() {
        return List.copyOf(PATTERNS.keySet());
    }
}
