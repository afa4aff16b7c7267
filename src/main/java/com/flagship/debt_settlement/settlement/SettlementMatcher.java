package com.flagship.debt_settlement.settlement;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static com.flagship.debt_settlement.settlement.MoneyRounding.exceedsEpsilon;
import static com.flagship.debt_settlement.settlement.MoneyRounding.isSettled;
import static com.flagship.debt_settlement.settlement.MoneyRounding.round2;

/**
 * Greedy two-pointer matching of creditors against debtors for one currency.
 *
 * Creditors and debtors are walked in the order the aggregator emitted them,
 * not sorted by magnitude. Each step moves min(credit, debt) from the current
 * debtor to the current creditor and advances whichever side reached zero.
 *
 * This is a heuristic. It runs in O(n) and emits at most
 * creditors + debtors - 1 transfers, but it does not minimize the number of
 * transfers: that problem reduces to partitioning balances into zero-sum
 * subsets, which is NP-hard. See {@link ExactSettlementSolver} for the exact
 * (exponential) alternative.
 */
@Component
public class SettlementMatcher {

    /**
     * Matches the balances of a single currency.
     *
     * @param balances Balances of one currency, in aggregator order; never mutated
     * @return Transfers in the order they were produced
     */
    public List<Settlement> match(List<UserBalance> balances) {
        List<WorkingBalance> creditors = new ArrayList<>();
        List<WorkingBalance> debtors = new ArrayList<>();
        for (UserBalance balance : balances) {
            if (exceedsEpsilon(balance.getBalance())) {
                creditors.add(new WorkingBalance(balance));
            } else if (exceedsEpsilon(balance.getBalance().negate())) {
                debtors.add(new WorkingBalance(balance));
            }
        }

        List<Settlement> settlements = new ArrayList<>();
        int i = 0;
        int j = 0;
        while (i < creditors.size() && j < debtors.size()) {
            WorkingBalance creditor = creditors.get(i);
            WorkingBalance debtor = debtors.get(j);

            BigDecimal transfer = creditor.amount.min(debtor.amount.negate());
            if (exceedsEpsilon(transfer)) {
                settlements.add(new Settlement(debtor.userId, creditor.userId, round2(transfer), creditor.currency));
            }

            creditor.amount = creditor.amount.subtract(transfer);
            debtor.amount = debtor.amount.add(transfer);

            if (isSettled(creditor.amount)) {
                i++;
            }
            if (isSettled(debtor.amount)) {
                j++;
            }
        }
        return settlements;
    }

    /**
     * Mutable copy of a balance so the caller's list stays untouched.
     */
    private static final class WorkingBalance {
        private final String userId;
        private final String currency;
        private BigDecimal amount;

        private WorkingBalance(UserBalance balance) {
            this.userId = balance.getUserId();
            this.currency = balance.getCurrency();
            this.amount = balance.getBalance();
        }
    }
}
