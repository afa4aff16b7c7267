package com.flagship.debt_settlement.settlement;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces directed debts into one net balance per user per currency.
 *
 * Invariants:
 * 1. Currencies appear in the order they are first seen in the debt list
 * 2. Within a currency, users appear in the order they are first referenced
 *    (the debtor of a debt before its creditor); the matcher breaks ties on this order
 * 3. Balances of one currency sum to exactly zero (no rounding is applied here)
 */
@Component
@Slf4j
public class BalanceAggregator {

    private final MalformedDebtPolicy malformedDebtPolicy;

    public BalanceAggregator(
            @Value("${settlement.malformed-debt-policy:REJECT}") MalformedDebtPolicy malformedDebtPolicy) {
        this.malformedDebtPolicy = malformedDebtPolicy;
    }

    /**
     * Aggregates with the configured {@link MalformedDebtPolicy}.
     */
    public Map<String, List<UserBalance>> aggregate(List<Debt> debts) {
        return aggregate(debts, malformedDebtPolicy);
    }

    /**
     * Aggregates debts into per-currency balance lists.
     *
     * @param debts Debts in ledger order
     * @param policy How to treat debts with a missing or non-positive amount
     * @return Balances keyed by currency, in first-seen currency order
     * @throws InvalidDebtAmountException if policy is REJECT and a debt is malformed
     */
    public Map<String, List<UserBalance>> aggregate(List<Debt> debts, MalformedDebtPolicy policy) {
        Map<String, Map<String, BigDecimal>> runningByCurrency = new LinkedHashMap<>();

        for (Debt debt : debts) {
            if (!debt.hasPositiveAmount()) {
                if (policy == MalformedDebtPolicy.REJECT) {
                    throw new InvalidDebtAmountException(debt.getFrom(), debt.getTo(), debt.getAmount());
                }
                log.warn("Skipping debt with non-positive amount: from={}, to={}, amount={}, currency={}",
                        debt.getFrom(), debt.getTo(), debt.getAmount(), debt.getCurrency());
                continue;
            }

            Map<String, BigDecimal> running =
                    runningByCurrency.computeIfAbsent(debt.getCurrency(), currency -> new LinkedHashMap<>());
            running.merge(debt.getFrom(), debt.getAmount().negate(), BigDecimal::add);
            running.merge(debt.getTo(), debt.getAmount(), BigDecimal::add);
        }

        Map<String, List<UserBalance>> result = new LinkedHashMap<>();
        runningByCurrency.forEach((currency, running) -> {
            List<UserBalance> balances = new ArrayList<>(running.size());
            running.forEach((userId, balance) -> balances.add(new UserBalance(userId, balance, currency)));
            result.put(currency, balances);
        });
        return result;
    }
}
