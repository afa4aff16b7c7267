package com.flagship.debt_settlement.settlement;

import com.flagship.debt_settlement.config.SettlementProperties;
import com.flagship.debt_settlement.observability.SettlementMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for the settlement pipeline.
 *
 * These tests verify that:
 * - Currencies are matched independently and merged in currency/amount order
 * - Parallel and sequential matching produce identical plans
 * - Cancellation never surfaces a partial plan
 * - Fail-fast validation and the exact solver are opt-in
 */
class SettlementServiceTest {

    private ExecutorService executor;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        registry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private SettlementService newService(SettlementProperties properties) {
        return newService(properties, new SettlementMatcher());
    }

    private SettlementService newService(SettlementProperties properties, SettlementMatcher matcher) {
        BalanceAggregator aggregator = new BalanceAggregator(MalformedDebtPolicy.REJECT);
        return new SettlementService(
            aggregator,
            matcher,
            new SettlementOrderer(),
            new ExposureCalculator(),
            new LedgerValidator(aggregator),
            new ExactSettlementSolver(matcher),
            properties,
            executor,
            new SettlementMetrics(registry)
        );
    }

    private static List<Debt> multiCurrencyLedger() {
        return List.of(
            Debt.of("A", "B", "10", "USD"),
            Debt.of("B", "C", "15", "USD"),
            Debt.of("C", "A", "5", "USD"),
            Debt.of("X", "Y", "5", "EUR"),
            Debt.of("P", "Q", "20", "EUR"),
            Debt.of("M", "N", "3.333", "GBP")
        );
    }

    private static Settlement settlement(String from, String to, String amount, String currency) {
        return new Settlement(from, to, new BigDecimal(amount), currency);
    }

    @Test
    @DisplayName("Full pipeline should group by currency and order largest first")
    void testPipeline() {
        SettlementService service = newService(SettlementProperties.defaults());

        List<Settlement> settlements = service.simplify(multiCurrencyLedger());

        assertEquals(List.of(
            settlement("P", "Q", "20.00", "EUR"),
            settlement("X", "Y", "5.00", "EUR"),
            settlement("M", "N", "3.33", "GBP"),
            settlement("A", "C", "5.00", "USD"),
            settlement("B", "C", "5.00", "USD")
        ), settlements);
        assertEquals(1.0, registry.counter("settlement.runs", "outcome", "success").count());
    }

    @Test
    @DisplayName("Empty ledger should produce an empty plan")
    void testEmptyLedger() {
        assertTrue(newService(SettlementProperties.defaults()).simplify(List.of()).isEmpty());
    }

    @Test
    @DisplayName("Parallel and sequential matching should produce identical plans")
    void testParallelMatchesSequential() {
        List<Debt> debts = new ArrayList<>();
        String[] currencies = {"USD", "EUR", "GBP", "JPY", "CHF"};
        for (int k = 0; k < 100; k++) {
            debts.add(new Debt("u" + (k % 7), "u" + ((k * 3 + 1) % 7),
                BigDecimal.valueOf(k + 1), currencies[k % currencies.length]));
        }

        SettlementProperties sequential = SettlementProperties.builder()
            .parallel(false)
            .exactSolverMaxParticipants(12)
            .build();

        List<Settlement> parallelPlan = newService(SettlementProperties.defaults()).simplify(debts);
        List<Settlement> sequentialPlan = newService(sequential).simplify(debts);

        assertFalse(parallelPlan.isEmpty());
        assertEquals(sequentialPlan, parallelPlan);
    }

    @Test
    @DisplayName("Balances, exposure and validation should be available without running the matcher")
    void testAuxiliaryEntryPoints() {
        SettlementService service = newService(SettlementProperties.defaults());
        List<Debt> debts = multiCurrencyLedger();

        assertEquals(List.of("USD", "EUR", "GBP"), new ArrayList<>(service.balances(debts).keySet()));
        assertEquals(new BigDecimal("5"), service.exposure("C", debts).getOwedByUser().get("USD"));
        assertTrue(service.validate(debts).isValid());
    }

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("Cancellation between currencies should abandon the parallel run")
        void testCancelledParallel() {
            SettlementService service = newService(SettlementProperties.defaults());
            AtomicInteger checks = new AtomicInteger();

            assertThrows(SettlementCancelledException.class,
                () -> service.simplify(multiCurrencyLedger(), () -> checks.incrementAndGet() > 1));
            assertEquals(1.0, registry.counter("settlement.runs", "outcome", "cancelled").count());
        }

        @Test
        @DisplayName("Cancellation between currencies should abandon the sequential run")
        void testCancelledSequential() {
            SettlementProperties sequential = SettlementProperties.builder()
                .parallel(false)
                .exactSolverMaxParticipants(12)
                .build();
            SettlementService service = newService(sequential);
            AtomicInteger checks = new AtomicInteger();

            assertThrows(SettlementCancelledException.class,
                () -> service.simplify(multiCurrencyLedger(), () -> checks.incrementAndGet() > 2));
        }

        @Test
        @DisplayName("Cancellation observed just before ordering should still return nothing")
        void testCancelledBeforeOrdering() {
            SettlementService service = newService(SettlementProperties.defaults());
            List<Debt> singleCurrency = List.of(Debt.of("A", "B", "10", "USD"));
            AtomicInteger checks = new AtomicInteger();

            // one check before USD, then one before ordering
            assertThrows(SettlementCancelledException.class,
                () -> service.simplify(singleCurrency, () -> checks.incrementAndGet() > 1));
        }

        @Test
        @DisplayName("A failing worker should fail the whole run")
        void testWorkerFailure() {
            SettlementMatcher failing = mock(SettlementMatcher.class);
            when(failing.match(anyList())).thenThrow(new IllegalStateException("matcher exploded"));
            SettlementService service = newService(SettlementProperties.defaults(), failing);

            SettlementComputationException exception = assertThrows(SettlementComputationException.class,
                () -> service.simplify(multiCurrencyLedger()));
            assertEquals("matcher exploded", exception.getCause().getMessage());
            assertEquals(1.0, registry.counter("settlement.runs", "outcome", "error").count());
        }
    }

    @Nested
    @DisplayName("Malformed input")
    class MalformedInput {

        @Test
        @DisplayName("Advisory mode should let the aggregator reject a non-positive amount")
        void testAggregatorRejects() {
            SettlementService service = newService(SettlementProperties.defaults());
            List<Debt> debts = List.of(Debt.of("A", "B", "10", "USD"), Debt.of("B", "A", "-1", "USD"));

            assertThrows(InvalidDebtAmountException.class, () -> service.simplify(debts));
            assertEquals(1.0, registry.counter("settlement.runs", "outcome", "rejected").count());
        }

        @Test
        @DisplayName("Advisory mode should let a self debt through")
        void testAdvisorySelfDebt() {
            SettlementService service = newService(SettlementProperties.defaults());

            assertTrue(service.simplify(List.of(Debt.of("A", "A", "10", "USD"))).isEmpty());
        }

        @Test
        @DisplayName("Fail-fast mode should reject a self debt with the full report")
        void testFailFast() {
            SettlementProperties failFast = SettlementProperties.builder()
                .failFast(true)
                .parallel(true)
                .exactSolverMaxParticipants(12)
                .build();
            SettlementService service = newService(failFast);
            List<Debt> debts = List.of(Debt.of("A", "A", "10", "USD"), Debt.of("B", "C", "0", "USD"));

            LedgerValidationException exception =
                assertThrows(LedgerValidationException.class, () -> service.simplify(debts));
            assertEquals(2, exception.getReport().getIssues().size());
            assertEquals(2.0, registry.counter("ledger.validation.issues").count());
        }
    }

    @Nested
    @DisplayName("Exact solver flag")
    class ExactSolverFlag {

        private final List<Debt> pairs = List.of(
            Debt.of("C", "A", "5", "USD"),
            Debt.of("D", "B", "5", "USD"),
            Debt.of("D", "A", "5", "USD")
        );

        @Test
        @DisplayName("Greedy should stay the default")
        void testGreedyByDefault() {
            // balances in first-seen order: C=-5, A=+10, D=-10, B=+5
            List<Settlement> settlements = newService(SettlementProperties.defaults()).simplify(pairs);

            assertEquals(3, settlements.size());
            assertEquals(3.0, registry.counter("settlement.transfers", "currency", "USD", "strategy", "greedy").count());
        }

        @Test
        @DisplayName("Enabled solver should minimize transfers for small currencies")
        void testExactWhenEnabled() {
            SettlementProperties exact = SettlementProperties.builder()
                .parallel(true)
                .exactSolverEnabled(true)
                .exactSolverMaxParticipants(12)
                .build();

            List<Settlement> settlements = newService(exact).simplify(pairs);

            assertEquals(List.of(
                settlement("D", "A", "10.00", "USD"),
                settlement("C", "B", "5.00", "USD")
            ), settlements);
        }

        @Test
        @DisplayName("Currencies above the participant limit should fall back to greedy")
        void testFallbackAboveLimit() {
            SettlementProperties tiny = SettlementProperties.builder()
                .parallel(true)
                .exactSolverEnabled(true)
                .exactSolverMaxParticipants(3)
                .build();

            assertEquals(3, newService(tiny).simplify(pairs).size());
        }
    }
}
