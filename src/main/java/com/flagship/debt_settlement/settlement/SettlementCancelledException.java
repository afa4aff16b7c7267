package com.flagship.debt_settlement.settlement;

/**
 * The settlement run was abandoned before completion. No partial result is ever returned.
 */
public class SettlementCancelledException extends RuntimeException {

    public SettlementCancelledException(String message) {
        super(message);
    }

    public SettlementCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
