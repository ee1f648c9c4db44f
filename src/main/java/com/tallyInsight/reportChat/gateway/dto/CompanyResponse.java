package com.tallyInsight.reportChat.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Active company of a session plus the companies that have exports.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CompanyResponse {

    @JsonProperty("active_company")
    private String activeCompany;

    private List<String> companies;
}
