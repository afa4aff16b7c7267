package com.flagship.debt_settlement.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.debt_settlement.settlement.Exposure;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

@Value
@Builder
public class ExposureResponse {

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("owed_to_user")
    Map<String, BigDecimal> owedToUser;

    @JsonProperty("owed_by_user")
    Map<String, BigDecimal> owedByUser;

    public static ExposureResponse from(Exposure exposure) {
        return ExposureResponse.builder()
            .userId(exposure.getUserId())
            .owedToUser(exposure.getOwedToUser())
            .owedByUser(exposure.getOwedByUser())
            .build();
    }
}
