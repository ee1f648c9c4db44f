package com.tallyInsight.reportChat.intent.service;

import com.tallyInsight.reportChat.intent.model.IntentResult;
import com.tallyInsight.reportChat.intent.util.QueryText;
import com.tallyInsight.reportChat.intent.util.ReportTypePatterns;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Two-tier intent classification.
 *
 * Rules first; the model only when no rule matched. When the model is disabled or fails, the
 * question defaults to {@code summary} with confidence 0.5. Always returns exactly one result.
 */
@Slf4j
@Service
public class IntentClassificationService {

    static final int MAX_HISTORY_TURNS = 3;

    private final RuleBasedIntentClassifier ruleBasedClassifier;
    private final IntentModelClassifier modelClassifier;
    private final boolean modelFallbackEnabled;

    public IntentClassificationService(RuleBasedIntentClassifier ruleBasedClassifier,
                                       IntentModelClassifier modelClassifier,
                                       @Value("${report-chat.intent.model-fallback-enabled:true}") boolean modelFallbackEnabled) {
        this.ruleBasedClassifier = ruleBasedClassifier;
        this.modelClassifier = modelClassifier;
        this.modelFallbackEnabled = modelFallbackEnabled;
    }

    /**
     * @param question Question as typed
     * @param history Prior turns, oldest first; only the last three are used
     * @param correlationId Correlation ID for logging
     * @return Classification of the question
     */
    public IntentResult classify(String question, List<String> history, String correlationId) {
        log.debug("Step INTENT_CLASSIFY - correlationId: {}", correlationId);

        String normalized = QueryText.normalize(question);
        Optional<IntentResult> ruleResult = ruleBasedClassifier.classify(question, normalized);
        if (ruleResult.isPresent()) {
            log.info("Intent classified by rules - correlationId: {}, intent: {}, reportTypeHint: {}",
                    correlationId, ruleResult.get().getIntent(), ruleResult.get().getReportTypeHint());
            return ruleResult.get();
        }

        String inferredReport = ReportTypePatterns.infer(normalized).orElse(null);

        if (modelFallbackEnabled) {
            try {
                IntentResult modelResult = modelClassifier.classify(normalized, lastTurns(history));
                if (modelResult.getReportTypeHint() == null) {
                    modelResult.setReportTypeHint(inferredReport);
                }
                log.info("Intent classified by model - correlationId: {}, intent: {}, confidence: {}",
                        correlationId, modelResult.getIntent(), modelResult.getConfidence());
                return modelResult;
            } catch (RuntimeException e) {
                log.warn("Model intent classification failed, using default - correlationId: {}, error: {}",
                        correlationId, e.getMessage());
            }
        }

        log.info("Intent defaulted to summary - correlationId: {}", correlationId);
        return IntentResult.fallback(inferredReport);
    }

    static List<String> lastTurns(List<String> history) {
        if (history == null || history.isEmpty()) {
            return List.of();
        }
        return List.copyOf(history.subList(Math.max(0, history.size() - MAX_HISTORY_TURNS), history.size()));
    }
}
