package com.flagship.debt_settlement.settlement;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Exact minimizer of the number of transfers for one currency.
 *
 * A group of k participants whose balances sum to zero can always be settled
 * with k - 1 transfers, so the minimum number of transfers for n participants
 * is n minus the largest number of disjoint zero-sum groups they can be split
 * into. That number is found by dynamic programming over subsets, O(2^n * n)
 * time and O(2^n) memory, which is why callers only use this for small n.
 *
 * Balances are compared in whole cents. Each group found is settled with
 * {@link SettlementMatcher}, which emits at most k - 1 transfers per group.
 */
@Component
@RequiredArgsConstructor
public class ExactSettlementSolver {

    /** Above this many participants the subset tables no longer fit comfortably in memory. */
    public static final int HARD_PARTICIPANT_LIMIT = 20;

    private final SettlementMatcher settlementMatcher;

    /**
     * Number of participants the solver would work on: balances outside epsilon of zero.
     */
    public int participantCount(List<UserBalance> balances) {
        return activeBalances(balances).size();
    }

    /**
     * @param balances Balances of one currency, in aggregator order
     * @return Transfers with the fewest possible entries
     * @throws IllegalArgumentException if more than {@link #HARD_PARTICIPANT_LIMIT} participants are active
     */
    public List<Settlement> solve(List<UserBalance> balances) {
        List<UserBalance> active = activeBalances(balances);
        int n = active.size();
        if (n == 0) {
            return List.of();
        }
        if (n > HARD_PARTICIPANT_LIMIT) {
            throw new IllegalArgumentException(String.format(
                    "Exact settlement supports at most %d participants, got %d", HARD_PARTICIPANT_LIMIT, n));
        }

        long[] cents = new long[n];
        for (int k = 0; k < n; k++) {
            cents[k] = MoneyRounding.toMinorUnits(active.get(k).getBalance());
        }

        int full = (1 << n) - 1;
        long[] sum = new long[full + 1];
        int[] groups = new int[full + 1];
        byte[] removed = new byte[full + 1];

        for (int mask = 1; mask <= full; mask++) {
            int lowest = Integer.numberOfTrailingZeros(mask);
            sum[mask] = sum[mask & (mask - 1)] + cents[lowest];

            int best = -1;
            for (int k = 0; k < n; k++) {
                if ((mask & (1 << k)) != 0 && groups[mask ^ (1 << k)] > best) {
                    best = groups[mask ^ (1 << k)];
                    removed[mask] = (byte) k;
                }
            }
            groups[mask] = best + (sum[mask] == 0 ? 1 : 0);
        }

        List<List<Integer>> partition = new ArrayList<>();
        List<Integer> current = new ArrayList<>();
        int mask = full;
        while (mask != 0) {
            int k = removed[mask];
            current.add(k);
            mask ^= 1 << k;
            if (sum[mask] == 0) {
                current.sort(Comparator.naturalOrder());
                partition.add(current);
                current = new ArrayList<>();
            }
        }
        partition.sort(Comparator.comparing(group -> group.get(0)));

        List<Settlement> settlements = new ArrayList<>();
        for (List<Integer> group : partition) {
            List<UserBalance> groupBalances = new ArrayList<>(group.size());
            for (int k : group) {
                UserBalance balance = active.get(k);
                groupBalances.add(new UserBalance(
                        balance.getUserId(), MoneyRounding.fromMinorUnits(cents[k]), balance.getCurrency()));
            }
            settlements.addAll(settlementMatcher.match(groupBalances));
        }
        return settlements;
    }

    private static List<UserBalance> activeBalances(List<UserBalance> balances) {
        return balances.stream()
                .filter(balance -> MoneyRounding.exceedsEpsilon(balance.getBalance().abs()))
                .toList();
    }
}
