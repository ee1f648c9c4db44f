package com.tallyInsight.reportChat.intent.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Analytic goal of a question; selects the downstream handling.
 */
public enum Intent {
    COMPANY_SELECTION("company_selection"),
    VALUE("value"),
    TABLE("table"),
    SUMMARY("summary"),
    GRAPH("graph");

    private final String wireName;

    Intent(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static Intent fromWireName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Intent name is null");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(intent -> intent.wireName.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown intent: " + name));
    }

    public static List<String> wireNames() {
        return Arrays.stream(values()).map(Intent::getWireName).toList();
    }
}
