package com.tallyInsight.reportChat.intent.service;

import com.tallyInsight.reportChat.intent.model.Intent;
import com.tallyInsight.reportChat.intent.model.IntentResult;
import com.tallyInsight.reportChat.intent.util.QueryText;
import com.tallyInsight.reportChat.intent.util.ReportTypePatterns;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fixed-precedence keyword rules. First matching tier wins:
 * <ol>
 *   <li>company selection</li>
 *   <li>rank-one superlative: value</li>
 *   <li>top-N: table</li>
 *   <li>binary comparison: value</li>
 *   <li>multi-item visual: graph</li>
 *   <li>table keyword: table</li>
 *   <li>visual keyword: graph</li>
 *   <li>value phrasing: value</li>
 * </ol>
 * Empty result means the rules are inconclusive.
 */
@Slf4j
@Component
public class RuleBasedIntentClassifier {

    private static final int MAX_COMPANY_NAME_WORDS = 6;

    private static final Pattern ANALYTIC_KEYWORD = Pattern.compile(
            "\\b(value|total|amount|balance|report|show|list|graph|chart|plot|table|compare|top|how|what|"
                    + "sheet|profit|loss|stock|summary|sales|cash|bills?|ledger|book|ratio)\\b");

    private static final Pattern SUPERLATIVE = Pattern.compile(
            "\\b(costliest|cheapest|highest|lowest|maximum|minimum|max|min|largest|smallest|biggest|"
                    + "most expensive|least expensive|most|least)\\b");

    private static final Pattern MULTI_ITEM = Pattern.compile("\\b(top|compare|graph|plot|chart|list)\\b");

    private static final Pattern TOP_N = Pattern.compile(
            "\\b(top|bottom|first|last)\\s+(\\d+|one|two|three|four|five|six|seven|eight|nine|ten|"
                    + "eleven|twelve|fifteen|twenty)\\b");

    private static final Pattern DISPLAY_VERB = Pattern.compile("\\b(show|list|display|give|get|find)\\b");

    private static final Pattern TOP_WORD = Pattern.compile("\\btop\\b");

    private static final Pattern COMPARISON = Pattern.compile(
            "\\b(compare|comparison|vs|versus|difference|between)\\b");

    private static final Pattern PLOT_WORD = Pattern.compile("\\b(plot|graph|chart)\\b");

    private static final Pattern VISUAL_OR_ANALYSIS = Pattern.compile(
            "\\b(graph|chart|plot|visuali[sz]e|compare|comparison|analysis|analy[sz]e|trend)\\b");

    private static final Pattern AND_WORD = Pattern.compile("\\band\\b");

    private static final List<Pattern> TABLE_PATTERNS = List.of(
            Pattern.compile("\\b(table|tabular|list all|show all|rows)\\b"),
            Pattern.compile("show.*in.*table"),
            Pattern.compile("list.*items"));

    private static final List<Pattern> VISUAL_PATTERNS = List.of(
            Pattern.compile("\\b(graph|chart|plot|visuali[sz]e|pie|trend)\\b"),
            Pattern.compile("show.*chart"),
            Pattern.compile("compare.*based on"),
            Pattern.compile("analy[sz]e.*by"));

    private static final List<Pattern> VALUE_PATTERNS = List.of(
            Pattern.compile("^what is (the )?value"),
            Pattern.compile("^how much"),
            Pattern.compile("^what's the (total|amount|value)"),
            Pattern.compile("\\bvalue of\\b"),
            Pattern.compile("^give me the (value|amount|total)"));

    /**
     * @param originalQuestion Question as typed, used for the company name
     * @param normalizedQuestion Output of {@link QueryText#normalize(String)}
     * @return Rule match with confidence {@link IntentResult#RULE_CONFIDENCE}, or empty
     */
    public Optional<IntentResult> classify(String originalQuestion, String normalizedQuestion) {
        if (normalizedQuestion == null || normalizedQuestion.isBlank()) {
            return Optional.empty();
        }
        String q = normalizedQuestion;
        String hint = ReportTypePatterns.infer(q).orElse(null);

        if (isCompanySelection(q)) {
            IntentResult result = IntentResult.rule(Intent.COMPANY_SELECTION, null);
            result.setCompanyName(QueryText.extractCompany(originalQuestion));
            return matched("company-selection", result);
        }

        boolean topN = TOP_N.matcher(q).find();

        if (SUPERLATIVE.matcher(q).find() && !MULTI_ITEM.matcher(q).find() && !topN) {
            return matched("superlative", IntentResult.rule(Intent.VALUE, hint));
        }

        if (topN || (DISPLAY_VERB.matcher(q).find() && TOP_WORD.matcher(q).find())) {
            return matched("top-n", IntentResult.rule(Intent.TABLE, hint));
        }

        int commaSegments = q.split(",", -1).length;
        int andCount = count(AND_WORD, q);

        if (COMPARISON.matcher(q).find() && !PLOT_WORD.matcher(q).find() && commaSegments <= 2 && andCount <= 1) {
            return matched("binary-comparison", IntentResult.rule(Intent.VALUE, hint));
        }

        if (VISUAL_OR_ANALYSIS.matcher(q).find() && (commaSegments >= 3 || andCount >= 2)) {
            return matched("multi-item-visual", IntentResult.rule(Intent.GRAPH, hint));
        }

        if (anyMatch(TABLE_PATTERNS, q)) {
            return matched("table-keyword", IntentResult.rule(Intent.TABLE, hint));
        }

        if (anyMatch(VISUAL_PATTERNS, q)) {
            return matched("visual-keyword", IntentResult.rule(Intent.GRAPH, hint));
        }

        if (anyMatch(VALUE_PATTERNS, q)) {
            return matched("value-phrasing", IntentResult.rule(Intent.VALUE, hint));
        }

        return Optional.empty();
    }

    private boolean isCompanySelection(String q) {
        Matcher setter = QueryText.SETTER_VERB.matcher(q);
        if (!setter.find()) {
            return false;
        }
        String remainder = q.substring(setter.end()).trim();
        if (remainder.isEmpty() || ANALYTIC_KEYWORD.matcher(remainder).find()) {
            return false;
        }
        return remainder.split("\\s+").length <= MAX_COMPANY_NAME_WORDS;
    }

    private Optional<IntentResult> matched(String rule, IntentResult result) {
        log.debug("Intent rule matched - rule: {}, intent: {}, reportTypeHint: {}",
                rule, result.getIntent(), result.getReportTypeHint());
        return Optional.of(result);
    }

    private static boolean anyMatch(List<Pattern> patterns, String q) {
        return patterns.stream().anyMatch(pattern -> pattern.matcher(q).find());
    }

    private static int count(Pattern pattern, String q) {
        Matcher matcher = pattern.matcher(q);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
