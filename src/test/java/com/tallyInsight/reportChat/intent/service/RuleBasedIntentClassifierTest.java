package com.tallyInsight.reportChat.intent.service;

import com.tallyInsight.reportChat.intent.model.Intent;
import com.tallyInsight.reportChat.intent.model.IntentResult;
import com.tallyInsight.reportChat.intent.model.IntentSource;
import com.tallyInsight.reportChat.intent.util.QueryText;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class RuleBasedIntentClassifierTest {

    private final RuleBasedIntentClassifier classifier = new RuleBasedIntentClassifier();

    private Optional<IntentResult> classify(String question) {
        return classifier.classify(question, QueryText.normalize(question));
    }

    private Intent intentOf(String question) {
        return classify(question).map(IntentResult::getIntent).orElse(null);
    }

    @Nested
    @DisplayName("company selection")
    class CompanySelection {

        @Test
        void classify_shouldDetectCompanySelectionAndExtractName() {
            IntentResult result = classify("use Sharma Traders Pvt Ltd").orElseThrow();

            assertThat(result.getIntent()).isEqualTo(Intent.COMPANY_SELECTION);
            assertThat(result.getCompanyName()).isEqualTo("Sharma Traders Pvt Ltd");
            assertThat(result.getConfidence()).isEqualTo(IntentResult.RULE_CONFIDENCE);
            assertThat(result.getSource()).isEqualTo(IntentSource.RULE);
        }

        @Test
        void classify_shouldNotTreatReportRequestAfterSetterVerbAsCompany() {
            assertThat(intentOf("use the balance sheet")).isNotEqualTo(Intent.COMPANY_SELECTION);
        }

        @Test
        void classify_shouldRejectLongRemainders() {
            assertThat(intentOf("select one two three four five six seven")).isNotEqualTo(Intent.COMPANY_SELECTION);
        }
    }

    @Nested
    @DisplayName("rule precedence")
    class Precedence {

        @Test
        void classify_shouldAnswerRankOneSuperlativeAsValue() {
            IntentResult result = classify("Which is the costliest item?").orElseThrow();

            assertThat(result.getIntent()).isEqualTo(Intent.VALUE);
            assertThat(result.getReportTypeHint()).isEqualTo("Stock Summary");
        }

        @Test
        void classify_shouldAnswerCostliestStockItemAsValueNotGraph() {
            assertThat(intentOf("What is my costliest stock item?")).isEqualTo(Intent.VALUE);
        }

        @Test
        void classify_shouldAnswerTopFiveCostliestAsTable() {
            assertThat(intentOf("Show top 5 costliest items")).isEqualTo(Intent.TABLE);
        }

        @Test
        void classify_shouldLetMultiItemWordsOverrideSuperlative() {
            assertThat(intentOf("chart the highest expenses")).isEqualTo(Intent.GRAPH);
        }

        @Test
        void classify_shouldAnswerTopNAsTable() {
            assertThat(intentOf("Show top 5 items by value")).isEqualTo(Intent.TABLE);
            assertThat(intentOf("top five costliest items")).isEqualTo(Intent.TABLE);
            assertThat(intentOf("show top customers")).isEqualTo(Intent.TABLE);
        }

        @Test
        void classify_shouldAnswerBinaryComparisonAsValue() {
            assertThat(intentOf("compare sales and purchase")).isEqualTo(Intent.VALUE);
            assertThat(intentOf("cash vs bank")).isEqualTo(Intent.VALUE);
        }

        @Test
        void classify_shouldAnswerMultiItemComparisonAsGraph() {
            assertThat(intentOf("Compare Cash, Bank, and Debtors")).isEqualTo(Intent.GRAPH);
            assertThat(intentOf("compare cash and bank and debtors")).isEqualTo(Intent.GRAPH);
        }

        @Test
        void classify_shouldLetPlotWordsSkipTheComparisonTier() {
            assertThat(intentOf("plot cash vs bank")).isEqualTo(Intent.GRAPH);
        }

        @Test
        void classify_shouldDetectTableKeyword() {
            IntentResult result = classify("show the balance sheet in a table").orElseThrow();

            assertThat(result.getIntent()).isEqualTo(Intent.TABLE);
            assertThat(result.getReportTypeHint()).isEqualTo("Balance Sheet");
        }

        @Test
        void classify_shouldDetectVisualKeyword() {
            assertThat(intentOf("pie of the P&L")).isEqualTo(Intent.GRAPH);
        }

        @Test
        void classify_shouldDetectValuePhrasing() {
            assertThat(intentOf("How much is the capital account")).isEqualTo(Intent.VALUE);
            assertThat(intentOf("what is the value of sugar")).isEqualTo(Intent.VALUE);
        }

        @Test
        void classify_shouldBeInconclusiveWithoutKeywords() {
            assertThat(classify("show me the stock summary")).isEmpty();
            assertThat(classifier.classify("", "")).isEmpty();
        }
    }
}
