package com.tallyInsight.reportChat.orchestrator.service;

import com.tallyInsight.reportChat.intent.util.ReportTypePatterns;
import com.tallyInsight.reportChat.normalizer.model.NormalizedRow;
import com.tallyInsight.reportChat.normalizer.model.ReportField;
import com.tallyInsight.reportChat.normalizer.model.ReportSection;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ranks rows for superlative and top-N questions.
 *
 * Stock questions about cost ("costliest", "cheapest", "rate") rank by unit rate, everything else
 * by value. Rows without the ranking field never rank.
 */
@Component
public class RowRanker {

    private static final Pattern SUPERLATIVE = Pattern.compile(
            "\\b(costliest|cheapest|highest|lowest|maximum|minimum|max|min|largest|smallest|biggest|"
                    + "most|least)\\b");
    private static final Pattern ASCENDING = Pattern.compile("\\b(cheapest|lowest|minimum|min|smallest|least|bottom)\\b");
    private static final Pattern RATE_HINT = Pattern.compile("\\b(costliest|cheapest|rate|expensive|price)\\b");
    private static final Pattern TOP_N = Pattern.compile(
            "\\b(?:top|bottom|first|last)\\s+(\\d+|one|two|three|four|five|six|seven|eight|nine|ten|"
                    + "eleven|twelve|fifteen|twenty)\\b");

    private static final Map<String, Integer> SPELLED_NUMBERS = Map.ofEntries(
            Map.entry("one", 1), Map.entry("two", 2), Map.entry("three", 3), Map.entry("four", 4),
            Map.entry("five", 5), Map.entry("six", 6), Map.entry("seven", 7), Map.entry("eight", 8),
            Map.entry("nine", 9), Map.entry("ten", 10), Map.entry("eleven", 11), Map.entry("twelve", 12),
            Map.entry("fifteen", 15), Map.entry("twenty", 20));

    public boolean isSuperlative(String question) {
        return SUPERLATIVE.matcher(lower(question)).find();
    }

    /**
     * @return The field the question ranks by, {@code rate} or {@code value}
     */
    public String rankingField(String question, String reportName, List<NormalizedRow> rows) {
        boolean stock = ReportTypePatterns.STOCK_SUMMARY.equals(reportName)
                || (!rows.isEmpty() && ReportSection.STOCK_SUMMARY.equals(rows.get(0).getSection()));
        return stock && RATE_HINT.matcher(lower(question)).find() ? ReportField.RATE : ReportField.VALUE;
    }

    /**
     * @return Highest-ranked row, or the lowest for "cheapest"/"lowest"-style questions
     */
    public Optional<NormalizedRow> pickExtreme(List<NormalizedRow> rows, String question, String reportName) {
        String field = rankingField(question, reportName, rows);
        Comparator<NormalizedRow> byField = Comparator.comparingDouble(row -> row.getNumeric(field));
        return rows.stream()
                .filter(row -> row.getNumeric(field) != null)
                .max(ascending(question) ? byField.reversed() : byField);
    }

    /**
     * @return The first N ranked rows when the question asks for "top N", otherwise {@code rows} unchanged
     */
    public List<NormalizedRow> topN(List<NormalizedRow> rows, String question, String reportName) {
        Optional<Integer> limit = requestedCount(question);
        if (limit.isEmpty()) {
            return rows;
        }
        String field = rankingField(question, reportName, rows);
        Comparator<NormalizedRow> byField = Comparator.comparingDouble(row -> row.getNumeric(field));
        return rows.stream()
                .filter(row -> row.getNumeric(field) != null)
                .sorted(ascending(question) ? byField : byField.reversed())
                .limit(limit.get())
                .toList();
    }

    Optional<Integer> requestedCount(String question) {
        Matcher matcher = TOP_N.matcher(lower(question));
        if (!matcher.find()) {
            return Optional.empty();
        }
        String count = matcher.group(1);
        Integer parsed = SPELLED_NUMBERS.get(count);
        if (parsed == null) {
            try {
                parsed = Integer.parseInt(count);
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return parsed > 0 ? Optional.of(parsed) : Optional.empty();
    }

    private static boolean ascending(String question) {
        return ASCENDING.matcher(lower(question)).find();
    }

    private static String lower(String question) {
        return question == null ? "" : question.toLowerCase(Locale.ROOT);
    }
}
