package com.flagship.debt_settlement.settlement;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sums, per currency, what others owe a user and what the user owes others.
 * The two sides are never netted against each other.
 */
@Component
public class ExposureCalculator {

    public Exposure exposure(String userId, List<Debt> debts) {
        Map<String, BigDecimal> owedToUser = new LinkedHashMap<>();
        Map<String, BigDecimal> owedByUser = new LinkedHashMap<>();

        for (Debt debt : debts) {
            if (debt.getAmount() == null) {
                continue;
            }
            if (userId.equals(debt.getTo())) {
                owedToUser.merge(debt.getCurrency(), debt.getAmount(), BigDecimal::add);
            } else if (userId.equals(debt.getFrom())) {
                owedByUser.merge(debt.getCurrency(), debt.getAmount(), BigDecimal::add);
            }
        }
        return new Exposure(userId, owedToUser, owedByUser);
    }
}
