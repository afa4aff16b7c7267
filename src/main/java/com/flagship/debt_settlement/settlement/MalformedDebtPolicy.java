package com.flagship.debt_settlement.settlement;

/**
 * What {@link BalanceAggregator} does with a debt whose amount is missing or not positive.
 */
public enum MalformedDebtPolicy {
    /** Fail the whole aggregation with {@link InvalidDebtAmountException}. */
    REJECT,
    /** Drop the debt from the reduction and log a warning. */
    SKIP
}
