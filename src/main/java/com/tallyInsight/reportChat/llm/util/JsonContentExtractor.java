package com.tallyInsight.reportChat.llm.util;

/**
 * Pulls the JSON payload out of free-form model output (markdown fences, leading prose).
 */
public final class JsonContentExtractor {

    private JsonContentExtractor() {}

    /**
     * @param content Model output
     * @return Text from the first '{' to the last '}', or null when there is no object
     */
    public static String extractObject(String content) {
        return extractBetween(content, '{', '}');
    }

    /**
     * @param content Model output
     * @return Text from the first '[' to the last ']', or null when there is no array
     */
    public static String extractArray(String content) {
        return extractBetween(content, '[', ']');
    }

    private static String extractBetween(String content, char open, char close) {
        if (content == null) {
            return null;
        }
        String text = stripFences(content);
        int start = text.indexOf(open);
        int end = text.lastIndexOf(close);
        if (start < 0 || end <= start) {
            return null;
        }
        return text.substring(start, end + 1);
    }

    static String stripFences(String content) {
        return content.replaceAll("```(?:json)?", "").trim();
    }
}
