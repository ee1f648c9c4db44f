package com.tallyInsight.reportChat.gateway.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for report questions. The session comes from the X-Session-ID header.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

    @NotBlank(message = "question cannot be blank")
    @Size(max = 1000, message = "question must be at most 1000 characters")
    private String question;
}
