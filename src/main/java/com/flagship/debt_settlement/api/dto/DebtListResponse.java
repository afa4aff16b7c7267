package com.flagship.debt_settlement.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.debt_settlement.settlement.Debt;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Debts derived from expense splits, ready to be posted back for settlement.
 */
@Value
@Builder
public class DebtListResponse {

    @JsonProperty("debts")
    List<Entry> debts;

    public static DebtListResponse from(List<Debt> debts) {
        return DebtListResponse.builder()
            .debts(debts.stream()
                .map(debt -> new Entry(debt.getFrom(), debt.getTo(), debt.getAmount(), debt.getCurrency()))
                .toList())
            .build();
    }

    @Value
    public static class Entry {

        @JsonProperty("from")
        String from;

        @JsonProperty("to")
        String to;

        @JsonProperty("amount")
        BigDecimal amount;

        @JsonProperty("currency")
        String currency;
    }
}
