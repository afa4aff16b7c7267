package com.flagship.debt_settlement.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.debt_settlement.settlement.Debt;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One directed debt in a request body.
 *
 * The amount sign is deliberately not validated here so that
 * the validate endpoint can report non-positive amounts.
 */
@Value
public class DebtRequest {

    @NotBlank(message = "Debtor is required")
    @JsonProperty("from")
    String from;

    @NotBlank(message = "Creditor is required")
    @JsonProperty("to")
    String to;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotBlank(message = "Currency is required")
    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;

    public Debt toDomain() {
        return new Debt(from, to, amount, currency);
    }
}
