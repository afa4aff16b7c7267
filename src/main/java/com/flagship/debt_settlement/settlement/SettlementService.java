package com.flagship.debt_settlement.settlement;

import com.flagship.debt_settlement.config.SettlementProperties;
import com.flagship.debt_settlement.observability.CorrelationContext;
import com.flagship.debt_settlement.observability.SettlementMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.BooleanSupplier;

/**
 * Settlement pipeline: aggregate, match per currency, order.
 *
 * Key principles:
 * - Each currency is matched independently, on the worker pool when parallel matching is on
 * - All per-currency results are joined before ordering
 * - Cancellation is all-or-nothing: a partial plan is never returned
 * - Validation stays advisory unless fail-fast is configured
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettlementService {

    private static final String GREEDY = "greedy";
    private static final String EXACT = "exact";

    private final BalanceAggregator balanceAggregator;
    private final SettlementMatcher settlementMatcher;
    private final SettlementOrderer settlementOrderer;
    private final ExposureCalculator exposureCalculator;
    private final LedgerValidator ledgerValidator;
    private final ExactSettlementSolver exactSettlementSolver;
    private final SettlementProperties properties;
    private final ExecutorService settlementExecutor;
    private final SettlementMetrics settlementMetrics;

    /**
     * Computes the ordered settlement plan for a debt list.
     *
     * @param debts Debts in ledger order
     * @return Settlements ordered by currency, then largest amount first
     * @throws InvalidDebtAmountException if a debt is malformed and the aggregator rejects it
     * @throws LedgerValidationException if fail-fast validation is on and the ledger has issues
     */
    public List<Settlement> simplify(List<Debt> debts) {
        return simplify(debts, () -> false);
    }

    /**
     * Computes the settlement plan, checking {@code cancelled} between per-currency steps.
     *
     * @throws SettlementCancelledException if cancellation was observed; nothing partial is returned
     */
    public List<Settlement> simplify(List<Debt> debts, BooleanSupplier cancelled) {
        long startTime = System.currentTimeMillis();
        String outcome = "error";

        try {
            if (properties.isFailFast()) {
                ValidationReport report = validate(debts);
                if (!report.isValid()) {
                    outcome = "rejected";
                    throw new LedgerValidationException(report);
                }
            }

            Map<String, List<UserBalance>> balances = balanceAggregator.aggregate(debts);

            List<Settlement> settlements = properties.isParallel() && balances.size() > 1
                    ? matchInParallel(balances, cancelled)
                    : matchSequentially(balances, cancelled);

            checkCancelled(cancelled, "before ordering");
            List<Settlement> ordered = settlementOrderer.order(settlements);

            outcome = "success";
            log.info("Settlement plan computed: debts={}, currencies={}, settlements={}, duration={}ms",
                    debts.size(), balances.size(), ordered.size(), System.currentTimeMillis() - startTime);
            return ordered;

        } catch (SettlementCancelledException e) {
            outcome = "cancelled";
            log.warn("Settlement run cancelled: {}", e.getMessage());
            throw e;
        } catch (InvalidDebtAmountException e) {
            outcome = "rejected";
            throw e;
        } finally {
            settlementMetrics.recordRun(outcome, System.currentTimeMillis() - startTime);
        }
    }

    /**
     * Net balances per currency, exactly as the matcher will see them.
     */
    public Map<String, List<UserBalance>> balances(List<Debt> debts) {
        return balanceAggregator.aggregate(debts);
    }

    public Exposure exposure(String userId, List<Debt> debts) {
        return exposureCalculator.exposure(userId, debts);
    }

    public ValidationReport validate(List<Debt> debts) {
        ValidationReport report = ledgerValidator.validate(debts);
        settlementMetrics.recordValidationIssues(report.getIssues().size());
        return report;
    }

    private List<Settlement> matchSequentially(Map<String, List<UserBalance>> balances, BooleanSupplier cancelled) {
        List<Settlement> settlements = new ArrayList<>();
        for (Map.Entry<String, List<UserBalance>> entry : balances.entrySet()) {
            checkCancelled(cancelled, "before matching " + entry.getKey());
            MDC.put(CorrelationContext.CURRENCY_MDC_KEY, entry.getKey());
            try {
                settlements.addAll(matchCurrency(entry.getKey(), entry.getValue()));
            } finally {
                MDC.remove(CorrelationContext.CURRENCY_MDC_KEY);
            }
        }
        return settlements;
    }

    private List<Settlement> matchInParallel(Map<String, List<UserBalance>> balances, BooleanSupplier cancelled) {
        Map<String, String> callerContext = MDC.getCopyOfContextMap();
        Map<String, Future<List<Settlement>>> futures = new LinkedHashMap<>();

        try {
            for (Map.Entry<String, List<UserBalance>> entry : balances.entrySet()) {
                checkCancelled(cancelled, "before matching " + entry.getKey());
                String currency = entry.getKey();
                List<UserBalance> currencyBalances = List.copyOf(entry.getValue());
                futures.put(currency, settlementExecutor.submit(
                        () -> matchOnWorker(currency, currencyBalances, cancelled, callerContext)));
            }

            List<Settlement> settlements = new ArrayList<>();
            for (Map.Entry<String, Future<List<Settlement>>> entry : futures.entrySet()) {
                settlements.addAll(entry.getValue().get());
            }
            return settlements;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelAll(futures);
            throw new SettlementCancelledException("Interrupted while waiting for per-currency matching", e);
        } catch (CancellationException e) {
            cancelAll(futures);
            throw new SettlementCancelledException("Per-currency matching task was cancelled", e);
        } catch (ExecutionException e) {
            cancelAll(futures);
            if (e.getCause() instanceof SettlementCancelledException cancelledException) {
                throw cancelledException;
            }
            throw new SettlementComputationException("Per-currency matching failed", e.getCause());
        } catch (RuntimeException e) {
            cancelAll(futures);
            throw e;
        }
    }

    private List<Settlement> matchOnWorker(String currency, List<UserBalance> balances,
                                           BooleanSupplier cancelled, Map<String, String> callerContext) {
        if (callerContext != null) {
            MDC.setContextMap(callerContext);
        }
        MDC.put(CorrelationContext.CURRENCY_MDC_KEY, currency);
        try {
            checkCancelled(cancelled, "before matching " + currency);
            return matchCurrency(currency, balances);
        } finally {
            MDC.clear();
        }
    }

    private List<Settlement> matchCurrency(String currency, List<UserBalance> balances) {
        boolean exact = properties.isExactSolverEnabled()
                && exactSettlementSolver.participantCount(balances) <= properties.getExactSolverMaxParticipants();

        List<Settlement> settlements = exact
                ? exactSettlementSolver.solve(balances)
                : settlementMatcher.match(balances);

        String strategy = exact ? EXACT : GREEDY;
        settlementMetrics.recordTransfers(currency, strategy, settlements.size());
        log.debug("Matched currency: participants={}, settlements={}, strategy={}",
                balances.size(), settlements.size(), strategy);
        return settlements;
    }

    private static void checkCancelled(BooleanSupplier cancelled, String stage) {
        if (cancelled.getAsBoolean()) {
            throw new SettlementCancelledException("Settlement cancelled " + stage);
        }
    }

    private static void cancelAll(Map<String, Future<List<Settlement>>> futures) {
        futures.values().forEach(future -> future.cancel(true));
    }
}
