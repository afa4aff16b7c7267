package com.flagship.debt_settlement.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.debt_settlement.settlement.UserBalance;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Net balances per currency, in aggregation order.
 */
@Value
@Builder
public class BalancesResponse {

    @JsonProperty("balances")
    Map<String, List<Entry>> balances;

    public static BalancesResponse from(Map<String, List<UserBalance>> balances) {
        Map<String, List<Entry>> converted = new LinkedHashMap<>();
        balances.forEach((currency, currencyBalances) -> converted.put(currency,
            currencyBalances.stream()
                .map(balance -> new Entry(balance.getUserId(), balance.getBalance(), balance.getCurrency()))
                .toList()));
        return BalancesResponse.builder().balances(converted).build();
    }

    @Value
    public static class Entry {

        @JsonProperty("user_id")
        String userId;

        @JsonProperty("balance")
        BigDecimal balance;

        @JsonProperty("currency")
        String currency;
    }
}
