package com.flagship.debt_settlement.expense;

/**
 * How an expense amount is divided among its participants.
 */
public enum SplitMethod {
    /** Amount divided evenly; leftover cents go to the first participants. */
    EQUAL,
    /** Split values are the participants' shares and must add up to the amount. */
    EXACT,
    /** Split values are percentages and must add up to 100. */
    PERCENTAGE
}
