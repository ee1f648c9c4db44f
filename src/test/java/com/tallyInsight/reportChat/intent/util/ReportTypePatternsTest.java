package com.tallyInsight.reportChat.intent.util;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReportTypePatternsTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "show bills receivable                 | Bills Receivable",
            "plot payables by party                | Bills Payable",
            "graph the net flow                    | Cash Flow",
            "monthly sales as a line chart         | Sales Register",
            "what is the current ratio             | Ratio Analysis",
            "number of vouchers                    | Statistics",
            "show the day book                     | Day Book",
            "top 5 items by value                  | Stock Summary",
            "show the balance sheet                | Balance Sheet",
            "indirect expenses                     | Profit & Loss"
    })
    void infer_shouldMapKeywordsToCanonicalReport(String question, String report) {
        assertThat(ReportTypePatterns.infer(question)).contains(report);
    }

    @Test
    void infer_shouldPreferNarrowRegistersOverBroadStatements() {
        assertThat(ReportTypePatterns.infer("sundry debtors outstanding in the balance sheet")).contains("Bills Receivable");
    }

    @Test
    void infer_shouldReturnEmptyWhenNothingMatches() {
        assertThat(ReportTypePatterns.infer("hello there")).isEmpty();
        assertThat(ReportTypePatterns.infer("")).isEmpty();
    }

    @Test
    void knownReports_shouldListEveryCanonicalName() {
        assertThat(ReportTypePatterns.knownReports()).hasSize(10).contains("Balance Sheet", "Profit & Loss");
    }
}
