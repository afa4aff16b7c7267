package com.flagship.debt_settlement.settlement;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A directed obligation: {@code from} owes {@code to} the given amount.
 *
 * Construction does not reject a non-positive amount or a self-debt.
 * Those are reported by {@link LedgerValidator} and handled by
 * {@link BalanceAggregator} according to its {@link MalformedDebtPolicy}.
 */
@Value
public class Debt {
    String from;
    String to;
    BigDecimal amount;
    String currency;

    public static Debt of(String from, String to, String amount, String currency) {
        return new Debt(from, to, new BigDecimal(amount), currency);
    }

    /**
     * A debt is well-formed when its amount is present and strictly positive.
     */
    public boolean hasPositiveAmount() {
        return amount != null && amount.signum() > 0;
    }

    public boolean isSelfDebt() {
        return from != null && from.equals(to);
    }
}
