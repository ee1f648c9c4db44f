package com.tallyInsight.reportChat.normalizer.model;

import java.util.List;

/**
 * Field names of the uniform row model, as they appear in table columns and chart data.
 */
public final class ReportField {

    private ReportField() {}

    public static final String SECTION = "section";
    public static final String LABEL = "label";
    public static final String VALUE = "value";
    public static final String QUANTITY = "quantity";
    public static final String RATE = "rate";
    public static final String DEBIT = "debit";
    public static final String CREDIT = "credit";
    public static final String CLOSING_BALANCE = "closing_balance";
    public static final String INFLOW = "inflow";
    public static final String OUTFLOW = "outflow";
    public static final String NET_FLOW = "net_flow";

    /**
     * Every numeric facet a row can carry.
     */
    public static final List<String> NUMERIC_FIELDS = List.of(
            VALUE, QUANTITY, RATE, DEBIT, CREDIT, CLOSING_BALANCE, INFLOW, OUTFLOW, NET_FLOW);

    public static final List<String> DEFAULT_COLUMNS = List.of(SECTION, LABEL, VALUE);
    public static final List<String> STOCK_COLUMNS = List.of(SECTION, LABEL, QUANTITY, RATE, VALUE);
    public static final List<String> VOUCHER_COLUMNS = List.of(SECTION, LABEL, VALUE, DEBIT, CREDIT);
    public static final List<String> LEDGER_COLUMNS = List.of(SECTION, LABEL, DEBIT, CREDIT, CLOSING_BALANCE, VALUE);
    public static final List<String> CASH_FLOW_COLUMNS = List.of(SECTION, LABEL, INFLOW, OUTFLOW, NET_FLOW);
}
