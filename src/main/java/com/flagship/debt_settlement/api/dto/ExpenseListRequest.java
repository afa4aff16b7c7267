package com.flagship.debt_settlement.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.debt_settlement.expense.Expense;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.List;

@Value
public class ExpenseListRequest {

    @NotNull(message = "Expenses are required")
    @Valid
    @JsonProperty("expenses")
    List<ExpenseRequest> expenses;

    public List<Expense> toDomain() {
        return expenses.stream()
            .map(ExpenseRequest::toDomain)
            .toList();
    }
}
