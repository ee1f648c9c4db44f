package com.tallyInsight.reportChat.intent.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Arguments of the classification function call.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class IntentClassificationResponse {

    @JsonProperty("intent")
    private String intent;

    @JsonProperty("confidence")
    private Double confidence;

    @JsonProperty("reportType")
    private String reportType;

    @JsonProperty("reason")
    private String reason;
}
