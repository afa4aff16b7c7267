package com.flagship.debt_settlement.settlement;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Advisory checks over a debt list. Never throws; every problem becomes an issue line.
 *
 * Checks:
 * 1. Every debt has a positive amount
 * 2. No debt is owed by a user to themselves
 * 3. Per currency, aggregated balances sum to zero within epsilon
 *
 * The third check guards the aggregator's conservation property against regressions.
 * It aggregates with {@link MalformedDebtPolicy#SKIP} so malformed debts are
 * reported by check 1 instead of aborting validation.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerValidator {

    private final BalanceAggregator balanceAggregator;

    public ValidationReport validate(List<Debt> debts) {
        List<String> issues = new ArrayList<>();

        for (Debt debt : debts) {
            if (!debt.hasPositiveAmount()) {
                issues.add(String.format("Invalid debt amount: %s between %s and %s",
                        debt.getAmount(), debt.getFrom(), debt.getTo()));
            }
            if (debt.isSelfDebt()) {
                issues.add(String.format("Self debt: %s owes %s %s to themselves",
                        debt.getFrom(), debt.getAmount(), debt.getCurrency()));
            }
        }

        Map<String, List<UserBalance>> balances = balanceAggregator.aggregate(debts, MalformedDebtPolicy.SKIP);
        balances.forEach((currency, currencyBalances) -> {
            BigDecimal total = currencyBalances.stream()
                    .map(UserBalance::getBalance)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            if (total.abs().compareTo(MoneyRounding.EPSILON) > 0) {
                issues.add(String.format("Currency %s total should be zero, but is %s", currency, total));
            }
        });

        if (!issues.isEmpty()) {
            log.warn("Debt ledger validation found {} issue(s) across {} debt(s)", issues.size(), debts.size());
        }
        return ValidationReport.of(issues);
    }
}
