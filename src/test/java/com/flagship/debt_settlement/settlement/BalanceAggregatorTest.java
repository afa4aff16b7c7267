package com.flagship.debt_settlement.settlement;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for net balance aggregation.
 *
 * These tests verify that:
 * - Balances are partitioned by currency in first-seen order
 * - Users keep their first-encountered order (debtor before creditor)
 * - Balances of each currency sum to exactly zero
 * - Malformed debts are rejected or skipped according to policy
 */
class BalanceAggregatorTest {

    private final BalanceAggregator aggregator = new BalanceAggregator(MalformedDebtPolicy.REJECT);

    @Test
    @DisplayName("Empty debt list should yield an empty map")
    void testEmptyInput() {
        assertTrue(aggregator.aggregate(List.of()).isEmpty());
    }

    @Test
    @DisplayName("Three-party cycle should net to A=-5, B=-5, C=+10 in first-seen order")
    void testCycleBalances() {
        List<Debt> debts = List.of(
            Debt.of("A", "B", "10", "USD"),
            Debt.of("B", "C", "15", "USD"),
            Debt.of("C", "A", "5", "USD")
        );

        List<UserBalance> balances = aggregator.aggregate(debts).get("USD");

        assertEquals(List.of("A", "B", "C"), balances.stream().map(UserBalance::getUserId).toList());
        assertEquals(0, new BigDecimal("-5").compareTo(balances.get(0).getBalance()));
        assertEquals(0, new BigDecimal("-5").compareTo(balances.get(1).getBalance()));
        assertEquals(0, new BigDecimal("10").compareTo(balances.get(2).getBalance()));
        balances.forEach(balance -> assertEquals("USD", balance.getCurrency()));
    }

    @Test
    @DisplayName("Currencies should be partitioned in first-seen order")
    void testCurrencyPartitionOrder() {
        List<Debt> debts = List.of(
            Debt.of("A", "B", "1", "USD"),
            Debt.of("A", "B", "2", "EUR"),
            Debt.of("C", "A", "3", "USD"),
            Debt.of("B", "C", "4", "GBP")
        );

        Map<String, List<UserBalance>> result = aggregator.aggregate(debts);

        assertEquals(List.of("USD", "EUR", "GBP"), new ArrayList<>(result.keySet()));
        assertEquals(List.of("A", "B", "C"), result.get("USD").stream().map(UserBalance::getUserId).toList());
        assertEquals(List.of("A", "B"), result.get("EUR").stream().map(UserBalance::getUserId).toList());
        assertEquals(List.of("B", "C"), result.get("GBP").stream().map(UserBalance::getUserId).toList());
    }

    @Test
    @DisplayName("Balances should sum to exactly zero per currency for arbitrary ledgers")
    void testConservation() {
        Random random = new Random(42);
        String[] users = {"ana", "ben", "cho", "dev", "eli", "fay"};
        String[] currencies = {"USD", "EUR", "JPY"};
        List<Debt> debts = new ArrayList<>();
        for (int k = 0; k < 200; k++) {
            String from = users[random.nextInt(users.length)];
            String to = users[random.nextInt(users.length)];
            BigDecimal amount = BigDecimal.valueOf(1 + random.nextInt(100_000), 3);
            debts.add(new Debt(from, to, amount, currencies[random.nextInt(currencies.length)]));
        }

        aggregator.aggregate(debts).forEach((currency, balances) -> {
            BigDecimal total = balances.stream()
                .map(UserBalance::getBalance)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
            assertEquals(0, total.signum(), "Balances of " + currency + " must sum to zero, got " + total);
        });
    }

    @Test
    @DisplayName("Balances should accumulate at full precision without rounding")
    void testNoRounding() {
        List<Debt> debts = List.of(
            Debt.of("A", "B", "0.333", "USD"),
            Debt.of("A", "B", "0.333", "USD")
        );

        List<UserBalance> balances = aggregator.aggregate(debts).get("USD");

        assertEquals(new BigDecimal("-0.666"), balances.get(0).getBalance());
        assertEquals(new BigDecimal("0.666"), balances.get(1).getBalance());
    }

    @Test
    @DisplayName("Self debt should net to a zero balance but still list the user")
    void testSelfDebt() {
        List<UserBalance> balances = aggregator.aggregate(List.of(Debt.of("A", "A", "7", "USD"))).get("USD");

        assertEquals(1, balances.size());
        assertEquals(0, balances.get(0).getBalance().signum());
    }

    @Test
    @DisplayName("REJECT policy should fail with a typed error naming the offending pair")
    void testRejectNonPositiveAmount() {
        List<Debt> debts = List.of(
            Debt.of("A", "B", "10", "USD"),
            Debt.of("B", "C", "0", "USD")
        );

        InvalidDebtAmountException exception =
            assertThrows(InvalidDebtAmountException.class, () -> aggregator.aggregate(debts));

        assertEquals("B", exception.getFrom());
        assertEquals("C", exception.getTo());
        assertEquals(0, exception.getAmount().signum());
    }

    @Test
    @DisplayName("REJECT policy should also reject a missing amount")
    void testRejectMissingAmount() {
        List<Debt> debts = List.of(new Debt("A", "B", null, "USD"));

        assertThrows(InvalidDebtAmountException.class, () -> aggregator.aggregate(debts));
    }

    @Test
    @DisplayName("SKIP policy should drop malformed debts from the reduction")
    void testSkipNonPositiveAmount() {
        List<Debt> debts = List.of(
            Debt.of("A", "B", "10", "USD"),
            Debt.of("C", "D", "-3", "USD"),
            Debt.of("E", "F", "-1", "EUR")
        );

        Map<String, List<UserBalance>> result = aggregator.aggregate(debts, MalformedDebtPolicy.SKIP);

        assertEquals(List.of("USD"), new ArrayList<>(result.keySet()));
        assertEquals(List.of("A", "B"), result.get("USD").stream().map(UserBalance::getUserId).toList());
    }

    @Test
    @DisplayName("Configured SKIP policy should apply to the single-argument overload")
    void testConfiguredPolicy() {
        BalanceAggregator lenient = new BalanceAggregator(MalformedDebtPolicy.SKIP);

        Map<String, List<UserBalance>> result = lenient.aggregate(List.of(Debt.of("A", "B", "0", "USD")));

        assertTrue(result.isEmpty());
    }
}
