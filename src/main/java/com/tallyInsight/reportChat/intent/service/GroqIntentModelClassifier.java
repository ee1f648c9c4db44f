package com.tallyInsight.reportChat.intent.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tallyInsight.reportChat.intent.dto.IntentClassificationResponse;
import com.tallyInsight.reportChat.intent.model.Intent;
import com.tallyInsight.reportChat.intent.model.IntentFunctionDefinition;
import com.tallyInsight.reportChat.intent.model.IntentResult;
import com.tallyInsight.reportChat.intent.model.IntentSource;
import com.tallyInsight.reportChat.intent.prompt.IntentClassificationPrompt;
import com.tallyInsight.reportChat.intent.util.ReportTypePatterns;
import com.tallyInsight.reportChat.llm.dto.GroqApiRequest;
import com.tallyInsight.reportChat.llm.dto.GroqApiResponse;
import com.tallyInsight.reportChat.llm.service.GroqApiClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Intent classification through Groq function calling. The function call is forced, so the model
 * has to commit to one of the five intents.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GroqIntentModelClassifier implements IntentModelClassifier {

    private final GroqApiClient groqApiClient;
    private final ObjectMapper objectMapper;

    @Value("${groq.api.intent-classification.model:llama-3.3-70b-versatile}")
    private String intentClassificationModel;

    @Override
    public IntentResult classify(String normalizedQuestion, List<String> history) {
        GroqApiRequest.Tool intentTool = GroqApiRequest.Tool.function(
                IntentFunctionDefinition.FUNCTION_NAME,
                IntentFunctionDefinition.FUNCTION_DESCRIPTION,
                IntentFunctionDefinition.getFunctionSchema());

        GroqApiResponse groqResponse = groqApiClient.callFunction(
                IntentClassificationPrompt.SYSTEM_PROMPT,
                IntentClassificationPrompt.buildUserMessage(normalizedQuestion, history),
                intentTool,
                intentClassificationModel);

        String arguments = groqResponse.getFunctionArguments(IntentFunctionDefinition.FUNCTION_NAME)
                .orElseThrow(() -> new IllegalStateException("Groq API did not return the classification function call"));

        IntentClassificationResponse response;
        try {
            response = objectMapper.readValue(arguments, IntentClassificationResponse.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to parse intent classification arguments: " + e.getMessage(), e);
        }

        Intent intent = Intent.fromWireName(response.getIntent());
        double confidence = response.getConfidence() != null ? clamp(response.getConfidence()) : IntentResult.DEFAULT_CONFIDENCE;
        String reportType = knownReportOrNull(response.getReportType());

        log.info("Model classification - intent: {}, confidence: {}, reportType: {}, reason: {}, tokens: {}",
                intent, confidence, reportType, response.getReason(), groqResponse.getTotalTokens());

        return IntentResult.builder()
                .intent(intent)
                .confidence(confidence)
                .reportTypeHint(reportType)
                .source(IntentSource.MODEL)
                .build();
    }

    private static double clamp(double confidence) {
        if (Double.isNaN(confidence)) {
            return IntentResult.DEFAULT_CONFIDENCE;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    private static String knownReportOrNull(String reportType) {
        if (reportType == null) {
            return null;
        }
        return ReportTypePatterns.knownReports().stream()
                .filter(known -> known.equalsIgnoreCase(reportType.trim()))
                .findFirst()
                .orElse(null);
    }
}
