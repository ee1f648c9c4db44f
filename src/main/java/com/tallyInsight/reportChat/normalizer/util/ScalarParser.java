package com.tallyInsight.reportChat.normalizer.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses export scalars into numbers.
 *
 * Export amounts arrive as text such as {@code "1,23,456.50 Dr"}, {@code "₹ 5,000"} or
 * {@code "(1,234.00)"}. Thousands separators and currency markers are stripped, a trailing
 * accounting suffix or enclosing parentheses set the sign (debit positive, credit negative) and
 * anything that does not yield a finite number becomes null. Text carrying more than one number,
 * such as {@code "17.22 : 1"}, is ambiguous for {@link #parse} and goes through
 * {@link #parseRatio} instead.
 */
public final class ScalarParser {

    private static final Pattern ACCOUNTING_SUFFIX = Pattern.compile("(?i)\\s*(cr|dr)\\.?\\s*$");
    private static final Pattern CURRENCY_MARKER = Pattern.compile("(?i)(rs\\.?|inr|₹|\\$)");
    private static final Pattern PARENTHESIZED = Pattern.compile("^\\((.*)\\)$");
    private static final Pattern PLAIN_NUMBER = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");
    private static final Pattern NUMERIC_RUN = Pattern.compile("\\d+([.,]\\d+)*");
    private static final Pattern NON_NUMERIC = Pattern.compile("[^\\d.\\-]");

    private ScalarParser() {}

    /**
     * Parses a scalar into a number.
     *
     * @param raw String, number or null
     * @return Finite number, or null for empty, unparseable or non-scalar input
     */
    public static Double parse(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Number number) {
            return finiteOrNull(number.doubleValue());
        }
        if (!(raw instanceof CharSequence)) {
            return null;
        }

        String text = raw.toString().trim();
        if (text.isEmpty()) {
            return null;
        }

        boolean credit = false;
        Matcher suffix = ACCOUNTING_SUFFIX.matcher(text);
        if (suffix.find()) {
            credit = "cr".equalsIgnoreCase(suffix.group(1));
            text = text.substring(0, suffix.start());
        }

        text = CURRENCY_MARKER.matcher(text).replaceAll("").trim();
        boolean parenthesized = false;
        Matcher parens = PARENTHESIZED.matcher(text);
        if (parens.matches()) {
            parenthesized = true;
            text = parens.group(1).trim();
        }

        String compact = text.replace(",", "");
        String cleaned;
        if (PLAIN_NUMBER.matcher(compact).matches()) {
            // also covers Double.toString output such as "1.2345E7"
            cleaned = compact;
        } else {
            if (countNumericRuns(text) != 1) {
                return null;
            }
            cleaned = NON_NUMERIC.matcher(compact).replaceAll("");
        }
        if (cleaned.isEmpty() || cleaned.equals(".") || cleaned.equals("-") || cleaned.equals("-.")) {
            return null;
        }

        double parsed;
        try {
            parsed = Double.parseDouble(cleaned);
        } catch (NumberFormatException e) {
            return null;
        }

        if (parenthesized) {
            parsed = -parsed;
        }
        return finiteOrNull(credit ? -parsed : parsed);
    }

    /**
     * Parses only the leading numeric run of a scalar.
     * Used for ratio-style values mixing a number with units, e.g. {@code "0.00 days"} or
     * {@code "17.22 : 1"}, where only the first number is meaningful.
     *
     * @param raw String, number or null
     * @return Finite number, or null if no numeric run is found
     */
    public static Double parseRatio(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Number number) {
            return finiteOrNull(number.doubleValue());
        }

        String text = raw.toString().trim();
        StringBuilder run = new StringBuilder();
        boolean started = false;
        for (char ch : text.toCharArray()) {
            if (Character.isDigit(ch) || ch == ',' || ch == '.' || ch == '-') {
                run.append(ch);
                started = true;
            } else if (started) {
                break;
            }
        }

        if (run.length() == 0) {
            return null;
        }
        return parse(run.toString().replace(",", ""));
    }

    private static int countNumericRuns(String text) {
        Matcher run = NUMERIC_RUN.matcher(text);
        int count = 0;
        while (run.find()) {
            count++;
        }
        return count;
    }

    private static Double finiteOrNull(double value) {
        return Double.isFinite(value) ? value : null;
    }
}
