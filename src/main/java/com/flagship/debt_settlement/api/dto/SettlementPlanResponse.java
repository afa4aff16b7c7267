package com.flagship.debt_settlement.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.debt_settlement.settlement.Settlement;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Response DTO for a computed settlement plan.
 */
@Value
@Builder
public class SettlementPlanResponse {

    @JsonProperty("settlements")
    List<SettlementResponse> settlements;

    @JsonProperty("settlement_count")
    int settlementCount;

    public static SettlementPlanResponse from(List<Settlement> settlements) {
        return SettlementPlanResponse.builder()
            .settlements(settlements.stream().map(SettlementResponse::from).toList())
            .settlementCount(settlements.size())
            .build();
    }
}
