package com.flagship.debt_settlement.expense;

import com.flagship.debt_settlement.settlement.Debt;
import com.flagship.debt_settlement.settlement.MoneyRounding;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns shared expenses into the directed debts the settlement engine consumes.
 *
 * Every participant other than the payer owes the payer their share.
 * Shares are computed in whole cents so they always add up to the expense amount.
 */
@Component
@Slf4j
public class ExpenseSplitter {

    private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");

    /**
     * Converts expenses to debts, keeping expense order.
     */
    public List<Debt> toDebts(List<Expense> expenses) {
        List<Debt> debts = new ArrayList<>();
        for (Expense expense : expenses) {
            debts.addAll(toDebts(expense));
        }
        return debts;
    }

    /**
     * Converts one expense to debts owed to its payer.
     *
     * @param expense The expense to split
     * @return One debt per participant with a non-zero share, excluding the payer
     * @throws InvalidSplitException if the expense or its split values are inconsistent
     */
    public List<Debt> toDebts(Expense expense) {
        validateExpense(expense);
        long total = MoneyRounding.toMinorUnits(expense.getAmount());

        Map<String, Long> shares = switch (expense.getSplitMethod()) {
            case EQUAL -> equalShares(expense.getParticipants(), total);
            case EXACT -> exactShares(expense, total);
            case PERCENTAGE -> percentageShares(expense, total);
        };

        List<Debt> debts = new ArrayList<>();
        shares.forEach((participant, share) -> {
            if (share > 0 && !participant.equals(expense.getPayer())) {
                debts.add(new Debt(participant, expense.getPayer(),
                        MoneyRounding.fromMinorUnits(share), expense.getCurrency()));
            }
        });

        log.debug("Split expense: payer={}, amount={}, currency={}, method={}, debts={}",
                expense.getPayer(), expense.getAmount(), expense.getCurrency(),
                expense.getSplitMethod(), debts.size());
        return debts;
    }

    private Map<String, Long> equalShares(List<String> participants, long total) {
        int count = participants.size();
        long base = total / count;
        long leftover = total % count;

        Map<String, Long> shares = new LinkedHashMap<>();
        for (int k = 0; k < count; k++) {
            shares.put(participants.get(k), base + (k < leftover ? 1 : 0));
        }
        return shares;
    }

    private Map<String, Long> exactShares(Expense expense, long total) {
        Map<String, Long> shares = new LinkedHashMap<>();
        long sum = 0;
        for (String participant : expense.getParticipants()) {
            BigDecimal value = requireSplitValue(expense, participant);
            if (value.stripTrailingZeros().scale() > MoneyRounding.SCALE) {
                throw new InvalidSplitException(String.format(
                        "Exact share for %s has more than %d decimal places: %s",
                        participant, MoneyRounding.SCALE, value));
            }
            long share = MoneyRounding.toMinorUnits(value);
            shares.put(participant, share);
            sum += share;
        }
        if (sum != total) {
            throw new InvalidSplitException(String.format(
                    "Exact shares add up to %s but the expense amount is %s",
                    MoneyRounding.fromMinorUnits(sum), MoneyRounding.fromMinorUnits(total)));
        }
        return shares;
    }

    private Map<String, Long> percentageShares(Expense expense, long total) {
        BigDecimal percentTotal = BigDecimal.ZERO;
        for (String participant : expense.getParticipants()) {
            percentTotal = percentTotal.add(requireSplitValue(expense, participant));
        }
        if (percentTotal.compareTo(ONE_HUNDRED) != 0) {
            throw new InvalidSplitException("Percentages must add up to 100, got " + percentTotal);
        }

        Map<String, Long> shares = new LinkedHashMap<>();
        List<String> funded = new ArrayList<>();
        long assigned = 0;
        for (String participant : expense.getParticipants()) {
            BigDecimal percent = expense.getSplits().get(participant);
            long share = BigDecimal.valueOf(total)
                    .multiply(percent)
                    .divide(ONE_HUNDRED, 0, RoundingMode.FLOOR)
                    .longValueExact();
            shares.put(participant, share);
            assigned += share;
            if (percent.signum() > 0) {
                funded.add(participant);
            }
        }

        // Flooring loses less than one cent per funded participant
        long leftover = total - assigned;
        for (int k = 0; k < leftover; k++) {
            shares.merge(funded.get(k % funded.size()), 1L, Long::sum);
        }
        return shares;
    }

    private BigDecimal requireSplitValue(Expense expense, String participant) {
        BigDecimal value = expense.getSplits().get(participant);
        if (value == null) {
            throw new InvalidSplitException(String.format(
                    "No %s split value for participant %s", expense.getSplitMethod(), participant));
        }
        if (value.signum() < 0) {
            throw new InvalidSplitException(String.format(
                    "Split value for %s must not be negative: %s", participant, value));
        }
        return value;
    }

    private void validateExpense(Expense expense) {
        if (expense.getPayer() == null || expense.getPayer().isBlank()) {
            throw new InvalidSplitException("Expense payer is required");
        }
        if (expense.getAmount() == null || expense.getAmount().signum() <= 0) {
            throw new InvalidSplitException("Expense amount must be positive");
        }
        if (expense.getAmount().stripTrailingZeros().scale() > MoneyRounding.SCALE) {
            throw new InvalidSplitException("Expense amount has more than two decimal places: " + expense.getAmount());
        }
        if (expense.getCurrency() == null || expense.getCurrency().isBlank()) {
            throw new InvalidSplitException("Expense currency is required");
        }
        if (expense.getSplitMethod() == null) {
            throw new InvalidSplitException("Split method is required");
        }
        if (expense.getParticipants() == null || expense.getParticipants().isEmpty()) {
            throw new InvalidSplitException("Expense must have at least one participant");
        }
        Set<String> seen = new HashSet<>();
        for (String participant : expense.getParticipants()) {
            if (participant == null || participant.isBlank()) {
                throw new InvalidSplitException("Participant ids must not be blank");
            }
            if (!seen.add(participant)) {
                throw new InvalidSplitException("Duplicate participant: " + participant);
            }
        }
        for (String splitUser : expense.getSplits().keySet()) {
            if (!seen.contains(splitUser)) {
                throw new InvalidSplitException("Split value given for non-participant: " + splitUser);
            }
        }
    }
}
