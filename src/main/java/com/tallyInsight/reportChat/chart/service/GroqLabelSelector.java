package com.tallyInsight.reportChat.chart.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tallyInsight.reportChat.chart.prompt.LabelSelectionPrompt;
import com.tallyInsight.reportChat.llm.dto.GroqApiResponse;
import com.tallyInsight.reportChat.llm.service.GroqApiClient;
import com.tallyInsight.reportChat.llm.util.JsonContentExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Label selection through Groq. Anything the model answers outside the allowed set is dropped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GroqLabelSelector implements LabelSelector {

    private final GroqApiClient groqApiClient;
    private final ObjectMapper objectMapper;

    @Value("${groq.api.model:llama-3.3-70b-versatile}")
    private String model;

    @Override
    public List<String> select(String question, List<String> allowedLabels) {
        if (allowedLabels.isEmpty()) {
            return List.of();
        }

        String labelsJson;
        try {
            labelsJson = objectMapper.writeValueAsString(allowedLabels);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize labels", e);
        }

        GroqApiResponse response = groqApiClient.complete(
                LabelSelectionPrompt.SYSTEM_PROMPT,
                LabelSelectionPrompt.buildUserMessage(question, labelsJson),
                model);

        String array = JsonContentExtractor.extractArray(response.getContent());
        if (array == null) {
            log.warn("Label selector returned no JSON array");
            return List.of();
        }

        List<String> proposed;
        try {
            proposed = objectMapper.readValue(array, new TypeReference<List<String>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to parse label selection: " + e.getMessage(), e);
        }

        Set<String> allowed = Set.copyOf(allowedLabels);
        Set<String> selected = new LinkedHashSet<>();
        for (String label : proposed) {
            if (label != null && allowed.contains(label)) {
                selected.add(label);
            } else {
                log.debug("Dropping label outside the report: {}", label);
            }
        }
        return List.copyOf(selected);
    }
}
