package com.tallyInsight.reportChat.intent.util;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Question text helpers shared by the classifier and the graph command parser.
 */
public final class QueryText {

    private static final Map<Pattern, String> ABBREVIATIONS = new LinkedHashMap<>();

    static {
        ABBREVIATIONS.put(Pattern.compile("(?<![a-z0-9])p&l(?![a-z0-9])"), "profit and loss");
        ABBREVIATIONS.put(Pattern.compile("\\bbs\\b"), "balance sheet");
        ABBREVIATIONS.put(Pattern.compile("\\bpl\\b"), "profit and loss");
        ABBREVIATIONS.put(Pattern.compile("\\bqty\\b"), "quantity");
        ABBREVIATIONS.put(Pattern.compile("\\bamt\\b"), "amount");
    }

    public static final Pattern SETTER_VERB = Pattern.compile(
            "^\\s*(use|select|set|switch to|change to)\\s+", Pattern.CASE_INSENSITIVE);

    private static final Pattern COMPANY_PATTERN = Pattern.compile(
            "\\b([A-Z][A-Za-z &]+(?:Pvt\\.?\\s*Ltd\\.?|Limited|Corp|Inc)\\.?(?:\\s*L?\\d+)?)");

    private QueryText() {}

    /**
     * Lowercases, trims and expands accounting abbreviations (p&amp;l, bs, pl, qty, amt).
     */
    public static String normalize(String question) {
        if (question == null) {
            return "";
        }
        String normalized = question.toLowerCase(Locale.ROOT).trim();
        for (Map.Entry<Pattern, String> abbreviation : ABBREVIATIONS.entrySet()) {
            normalized = abbreviation.getKey().matcher(normalized).replaceAll(abbreviation.getValue());
        }
        return normalized;
    }

    /**
     * Finds a company mention in the original (case-preserved) question.
     *
     * A legal-suffix name ("Dakshin Traders Pvt Ltd") wins; otherwise the text after a setter verb
     * ("use Dakshin") is taken as the name.
     *
     * @return Company name, or null when none is mentioned
     */
    public static String extractCompany(String question) {
        if (question == null || question.isBlank()) {
            return null;
        }
        Matcher matcher = COMPANY_PATTERN.matcher(question);
        if (matcher.find()) {
            String company = SETTER_VERB.matcher(matcher.group(1).trim()).replaceFirst("");
            return company.isBlank() ? null : company.trim();
        }

        Matcher setter = SETTER_VERB.matcher(question);
        if (setter.find()) {
            String remainder = question.substring(setter.end()).replaceAll("[.!?]+$", "").trim();
            remainder = remainder.replaceFirst("(?i)^(the\\s+)?company\\s+", "").trim();
            return remainder.isBlank() ? null : remainder;
        }
        return null;
    }
}
