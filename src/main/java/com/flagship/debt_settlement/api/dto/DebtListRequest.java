package com.flagship.debt_settlement.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.debt_settlement.settlement.Debt;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.List;

/**
 * Request body carrying an ordered debt list. Order matters: it drives tie-breaking.
 */
@Value
public class DebtListRequest {

    @NotNull(message = "Debts are required")
    @Valid
    @JsonProperty("debts")
    List<DebtRequest> debts;

    public List<Debt> toDomain() {
        return debts.stream()
            .map(DebtRequest::toDomain)
            .toList();
    }
}
