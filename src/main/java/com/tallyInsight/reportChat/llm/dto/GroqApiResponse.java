package com.tallyInsight.reportChat.llm.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Optional;

/**
 * Chat completions response body. Only the first choice is ever read.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class GroqApiResponse {

    @JsonProperty("id")
    private String id;

    @JsonProperty("model")
    private String model;

    @JsonProperty("choices")
    private List<Choice> choices;

    @JsonProperty("usage")
    private Usage usage;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Choice {
        @JsonProperty("index")
        private Integer index;

        @JsonProperty("message")
        private Message message;

        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Message {
        @JsonProperty("role")
        private String role;

        @JsonProperty("content")
        private String content;

        @JsonProperty("tool_calls")
        private List<ToolCall> toolCalls;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ToolCall {
        @JsonProperty("id")
        private String id;

        @JsonProperty("type")
        private String type;

        @JsonProperty("function")
        private FunctionCall function;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FunctionCall {
        @JsonProperty("name")
        private String name;

        /**
         * Arguments as a JSON string
         */
        @JsonProperty("arguments")
        private String arguments;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Usage {
        @JsonProperty("prompt_tokens")
        private Integer promptTokens;

        @JsonProperty("completion_tokens")
        private Integer completionTokens;

        @JsonProperty("total_tokens")
        private Integer totalTokens;
    }

    private Optional<Message> firstMessage() {
        if (choices == null || choices.isEmpty() || choices.get(0) == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(choices.get(0).getMessage());
    }

    /**
     * @return Text content of the first choice, or null
     */
    @JsonIgnore
    public String getContent() {
        return firstMessage().map(Message::getContent).orElse(null);
    }

    /**
     * Arguments of the first call to the named function.
     *
     * @param functionName Function name offered in the request
     * @return JSON argument string, empty if the model did not call it
     */
    @JsonIgnore
    public Optional<String> getFunctionArguments(String functionName) {
        return firstMessage()
                .map(Message::getToolCalls)
                .flatMap(calls -> calls.stream()
                        .filter(call -> call.getFunction() != null)
                        .filter(call -> functionName.equals(call.getFunction().getName()))
                        .map(call -> call.getFunction().getArguments())
                        .filter(arguments -> arguments != null && !arguments.isBlank())
                        .findFirst());
    }

    @JsonIgnore
    public Object getTotalTokens() {
        return usage != null && usage.getTotalTokens() != null ? usage.getTotalTokens() : "unknown";
    }
}
