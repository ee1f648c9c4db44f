package com.tallyInsight.reportChat.intent.service;

import com.tallyInsight.reportChat.intent.model.IntentResult;

import java.util.List;

/**
 * Model-assisted classification, consulted only when the rules are inconclusive.
 */
public interface IntentModelClassifier {

    /**
     * @param normalizedQuestion Normalized question text
     * @param history Up to three prior turns, oldest first
     * @return Committed classification
     * @throws RuntimeException when the model is unavailable or answers outside the intent set
     */
    IntentResult classify(String normalizedQuestion, List<String> history);
}
