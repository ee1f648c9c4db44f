package com.tallyInsight.reportChat.normalizer.model;

/**
 * Section tags written into {@link NormalizedRow#getSection()} by the shape recognizers.
 */
public final class ReportSection {

    private ReportSection() {}

    public static final String STATISTICS = "Statistics";
    public static final String PROFIT_AND_LOSS = "ProfitAndLoss";
    public static final String CASH_FLOW_PROJECTION = "CashFlowProjection";
    public static final String BALANCE_SHEET = "BalanceSheet";
    public static final String BILLS = "Bills";
    public static final String STOCK_SUMMARY = "StockSummary";
    public static final String DAY_BOOK = "DayBook";
    public static final String SALES_REGISTER = "SalesRegister";
    public static final String CASH_FLOW = "CashFlow";
    public static final String RATIO_ANALYSIS = "RatioAnalysis";
    public static final String AUTO = "auto";
}
