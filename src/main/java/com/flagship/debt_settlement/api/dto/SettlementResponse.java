package com.flagship.debt_settlement.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.debt_settlement.settlement.Settlement;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class SettlementResponse {

    @JsonProperty("from")
    String from;

    @JsonProperty("to")
    String to;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    String currency;

    public static SettlementResponse from(Settlement settlement) {
        return SettlementResponse.builder()
            .from(settlement.getFrom())
            .to(settlement.getTo())
            .amount(settlement.getAmount())
            .currency(settlement.getCurrency())
            .build();
    }
}
