package com.flagship.debt_settlement.settlement;

/**
 * Wraps an unexpected failure of a per-currency matching task.
 */
public class SettlementComputationException extends RuntimeException {

    public SettlementComputationException(String message, Throwable cause) {
        super(message, cause);
    }
}
