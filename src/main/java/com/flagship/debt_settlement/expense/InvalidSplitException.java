package com.flagship.debt_settlement.expense;

/**
 * Expense split input that cannot be turned into debts.
 */
public class InvalidSplitException extends IllegalArgumentException {

    public InvalidSplitException(String message) {
        super(message);
    }
}
