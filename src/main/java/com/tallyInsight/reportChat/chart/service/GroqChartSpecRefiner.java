package com.tallyInsight.reportChat.chart.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tallyInsight.reportChat.chart.model.ChartSpec;
import com.tallyInsight.reportChat.chart.model.ChartType;
import com.tallyInsight.reportChat.chart.prompt.ChartRefinementPrompt;
import com.tallyInsight.reportChat.llm.dto.GroqApiResponse;
import com.tallyInsight.reportChat.llm.service.GroqApiClient;
import com.tallyInsight.reportChat.llm.util.JsonContentExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Asks Groq for a styled spec. Answers without a schema tag or an encoding are discarded.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GroqChartSpecRefiner implements ChartSpecRefiner {

    static final int SAMPLE_ROWS = 5;

    private final GroqApiClient groqApiClient;
    private final ObjectMapper objectMapper;

    @Value("${groq.api.model:llama-3.3-70b-versatile}")
    private String model;

    @Override
    public Optional<ChartSpec> refine(String question, ChartType chartType, List<String> numericFields,
                                      List<Map<String, Object>> values) {
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }

        String userMessage;
        try {
            userMessage = ChartRefinementPrompt.buildUserMessage(
                    question,
                    chartType.getMark(),
                    objectMapper.writeValueAsString(numericFields),
                    objectMapper.writerWithDefaultPrettyPrinter()
                            .writeValueAsString(values.subList(0, Math.min(SAMPLE_ROWS, values.size()))));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize chart sample", e);
        }

        GroqApiResponse response = groqApiClient.complete(ChartRefinementPrompt.SYSTEM_PROMPT, userMessage, model);
        String json = JsonContentExtractor.extractObject(response.getContent());
        if (json == null) {
            log.warn("Chart refinement returned no JSON object");
            return Optional.empty();
        }

        Map<String, Object> raw;
        try {
            raw = objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            log.warn("Chart refinement returned invalid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }

        if (raw.get("$schema") == null || !(raw.get("encoding") instanceof Map<?, ?> encoding) || encoding.isEmpty()) {
            log.warn("Chart refinement missing $schema or encoding, discarding");
            return Optional.empty();
        }
        raw.remove("data");
        ChartSpec spec = objectMapper.convertValue(raw, ChartSpec.class);
        spec.setChartType(chartType);
        return Optional.of(spec);
    }
}
