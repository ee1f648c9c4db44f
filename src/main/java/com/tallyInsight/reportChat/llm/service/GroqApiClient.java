package com.tallyInsight.reportChat.llm.service;

import com.tallyInsight.reportChat.llm.dto.GroqApiRequest;
import com.tallyInsight.reportChat.llm.dto.GroqApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

import java.util.List;

/**
 * Client for the Groq chat completions endpoint.
 *
 * Every model-backed collaborator (intent fallback, label selection, chart refinement) goes through
 * here. Failures are thrown; callers own the deterministic fallback.
 */
@Slf4j
@Service
public class GroqApiClient {

    private static final String GROQ_API_URL = "https://api.groq.com/openai/v1/chat/completions";
    private static final String DEFAULT_MODEL = "llama-3.3-70b-versatile";

    private final RestClient restClient;

    @Value("${groq.api.key:}")
    private String apiKey;

    @Value("${groq.api.model:" + DEFAULT_MODEL + "}")
    private String defaultModel;

    @Value("${groq.api.temperature:0.0}")
    private Double temperature;

    @Value("${groq.api.max-completion-tokens:1024}")
    private Integer maxCompletionTokens;

    public GroqApiClient() {
        this.restClient = RestClient.builder()
                .baseUrl(GROQ_API_URL)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    /**
     * @return true when an API key is configured
     */
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * Plain chat completion.
     *
     * @param systemPrompt System prompt for the task
     * @param userMessage User message to process
     * @param model Model to use, default model when blank
     * @return Raw response
     * @throws IllegalStateException if no API key is configured
     * @throws RuntimeException if the call fails
     */
    public GroqApiResponse complete(String systemPrompt, String userMessage, String model) {
        return execute(baseRequest(systemPrompt, userMessage, model).build());
    }

    /**
     * Chat completion with a single function offered and the call forced.
     *
     * @param systemPrompt System prompt for the task
     * @param userMessage User message to process
     * @param tool Function the model must call
     * @param model Model to use, default model when blank
     * @return Raw response, expected to carry a tool call
     * @throws IllegalStateException if no API key is configured
     * @throws RuntimeException if the call fails
     */
    public GroqApiResponse callFunction(String systemPrompt, String userMessage, GroqApiRequest.Tool tool, String model) {
        GroqApiRequest request = baseRequest(systemPrompt, userMessage, model)
                .tools(List.of(tool))
                .toolChoice("required")
                .build();
        return execute(request);
    }

    private GroqApiRequest.GroqApiRequestBuilder baseRequest(String systemPrompt, String userMessage, String model) {
        return GroqApiRequest.builder()
                .model(model == null || model.isBlank() ? defaultModel : model)
                .messages(List.of(
                        GroqApiRequest.Message.system(systemPrompt),
                        GroqApiRequest.Message.user(userMessage)))
                .temperature(temperature)
                .maxCompletionTokens(maxCompletionTokens)
                .topP(1.0)
                .stream(false);
    }

    private GroqApiResponse execute(GroqApiRequest request) {
        if (!isConfigured()) {
            throw new IllegalStateException("Groq API key is not configured. Set groq.api.key in application.yaml");
        }

        try {
            log.debug("Calling Groq API - model: {}, tools: {}",
                    request.getModel(), request.getTools() != null ? request.getTools().size() : 0);

            GroqApiResponse response = restClient.post()
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .body(request)
                    .retrieve()
                    .body(GroqApiResponse.class);

            if (response == null) {
                throw new RuntimeException("Groq API returned null response");
            }

            log.debug("Groq API response received - model: {}, tokens used: {}",
                    response.getModel(), response.getTotalTokens());
            return response;

        } catch (Exception e) {
            log.error("Error calling Groq API - model: {}", request.getModel(), e);
            throw new RuntimeException("Failed to call Groq API: " + e.getMessage(), e);
        }
    }
}
