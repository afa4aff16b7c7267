package com.flagship.debt_settlement.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.debt_settlement.expense.Expense;
import com.flagship.debt_settlement.expense.SplitMethod;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Request DTO for one shared expense.
 */
@Value
public class ExpenseRequest {

    @JsonProperty("description")
    String description;

    @NotBlank(message = "Payer is required")
    @JsonProperty("payer")
    String payer;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotBlank(message = "Currency is required")
    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;

    @NotEmpty(message = "At least one participant is required")
    @JsonProperty("participants")
    List<String> participants;

    @NotBlank(message = "Split method is required")
    @Pattern(regexp = "(?i)^(equal|exact|percentage)$", message = "Split method must be equal, exact or percentage")
    @JsonProperty("method")
    String method;

    @JsonProperty("splits")
    Map<String, BigDecimal> splits;

    public Expense toDomain() {
        return Expense.builder()
            .description(description)
            .payer(payer)
            .amount(amount)
            .currency(currency)
            .participants(participants)
            .splitMethod(SplitMethod.valueOf(method.toUpperCase(Locale.ROOT)))
            .splits(splits == null ? Map.of() : splits)
            .build();
    }
}
