package com.tallyInsight.reportChat.intent.model;

/**
 * Which tier produced an {@link IntentResult}. Confidences from different tiers are not comparable.
 */
public enum IntentSource {
    RULE,
    MODEL,
    DEFAULT
}
