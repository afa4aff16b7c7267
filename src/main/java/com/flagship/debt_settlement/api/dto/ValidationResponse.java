package com.flagship.debt_settlement.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.debt_settlement.settlement.ValidationReport;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ValidationResponse {

    @JsonProperty("valid")
    boolean valid;

    @JsonProperty("issues")
    List<String> issues;

    public static ValidationResponse from(ValidationReport report) {
        return ValidationResponse.builder()
            .valid(report.isValid())
            .issues(report.getIssues())
            .build();
    }
}
