package com.flagship.debt_settlement.settlement;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * Raised when a debt with a missing or non-positive amount reaches aggregation
 * under {@link MalformedDebtPolicy#REJECT}.
 */
@Getter
public class InvalidDebtAmountException extends IllegalArgumentException {

    private final String from;
    private final String to;
    private final BigDecimal amount;

    public InvalidDebtAmountException(String from, String to, BigDecimal amount) {
        super(String.format("Invalid debt amount: %s between %s and %s", amount, from, to));
        this.from = from;
        this.to = to;
        this.amount = amount;
    }
}
