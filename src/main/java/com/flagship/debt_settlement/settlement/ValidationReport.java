package com.flagship.debt_settlement.settlement;

import lombok.Value;

import java.util.List;

/**
 * Advisory result of {@link LedgerValidator#validate(List)}.
 */
@Value
public class ValidationReport {
    boolean valid;
    List<String> issues;

    public static ValidationReport of(List<String> issues) {
        return new ValidationReport(issues.isEmpty(), List.copyOf(issues));
    }
}
