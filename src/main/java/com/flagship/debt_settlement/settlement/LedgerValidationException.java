package com.flagship.debt_settlement.settlement;

import lombok.Getter;

/**
 * Raised by {@link SettlementService} when fail-fast validation is enabled
 * and the debt list has at least one issue.
 */
@Getter
public class LedgerValidationException extends RuntimeException {

    private final ValidationReport report;

    public LedgerValidationException(ValidationReport report) {
        super("Debt ledger failed validation with " + report.getIssues().size() + " issue(s)");
        this.report = report;
    }
}
