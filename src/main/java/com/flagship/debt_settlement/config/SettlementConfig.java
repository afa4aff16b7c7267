package com.flagship.debt_settlement.config;

import com.flagship.debt_settlement.settlement.ExactSettlementSolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Settlement engine configuration.
 *
 * Configures:
 * - Engine options (fail-fast validation, parallel matching, exact solver)
 * - The worker pool that matches currencies concurrently
 */
@Configuration
@Slf4j
public class SettlementConfig {

    @Value("${settlement.validation.fail-fast:false}")
    private boolean failFast;

    @Value("${settlement.parallel.enabled:true}")
    private boolean parallel;

    @Value("${settlement.parallel.workers:4}")
    private int workers;

    @Value("${settlement.exact-solver.enabled:false}")
    private boolean exactSolverEnabled;

    @Value("${settlement.exact-solver.max-participants:12}")
    private int exactSolverMaxParticipants;

    @Bean
    public SettlementProperties settlementProperties() {
        if (exactSolverMaxParticipants < 1 || exactSolverMaxParticipants > ExactSettlementSolver.HARD_PARTICIPANT_LIMIT) {
            throw new IllegalStateException(String.format(
                    "settlement.exact-solver.max-participants must be between 1 and %d, got %d",
                    ExactSettlementSolver.HARD_PARTICIPANT_LIMIT, exactSolverMaxParticipants));
        }
        SettlementProperties properties = SettlementProperties.builder()
                .failFast(failFast)
                .parallel(parallel)
                .exactSolverEnabled(exactSolverEnabled)
                .exactSolverMaxParticipants(exactSolverMaxParticipants)
                .build();
        log.info("Settlement engine configured: {}", properties);
        return properties;
    }

    /**
     * Fixed pool of daemon threads for per-currency matching.
     * Shut down when the application context closes.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService settlementExecutor() {
        if (workers < 1) {
            throw new IllegalStateException("settlement.parallel.workers must be at least 1, got " + workers);
        }
        AtomicInteger sequence = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "settlement-worker-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(workers, threadFactory);
    }
}
