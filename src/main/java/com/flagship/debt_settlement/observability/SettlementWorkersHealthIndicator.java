package com.flagship.debt_settlement.observability;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Health indicator for the per-currency matching pool.
 * Down once the pool is shut down; WARNING when tasks are queueing behind busy workers.
 */
@Component("settlementWorkers")
public class SettlementWorkersHealthIndicator implements HealthIndicator {

    private static final int QUEUE_WARNING_THRESHOLD = 100;

    private final ExecutorService settlementExecutor;

    public SettlementWorkersHealthIndicator(ExecutorService settlementExecutor) {
        this.settlementExecutor = settlementExecutor;
    }

    @Override
    public Health health() {
        if (settlementExecutor.isShutdown()) {
            return Health.down()
                    .withDetail("error", "Settlement worker pool is shut down")
                    .build();
        }
        if (!(settlementExecutor instanceof ThreadPoolExecutor pool)) {
            return Health.up().build();
        }

        int queued = pool.getQueue().size();
        Health.Builder builder = queued < QUEUE_WARNING_THRESHOLD
                ? Health.up()
                : Health.status("WARNING");

        return builder
                .withDetail("poolSize", pool.getCorePoolSize())
                .withDetail("activeWorkers", pool.getActiveCount())
                .withDetail("queuedTasks", queued)
                .withDetail("completedTasks", pool.getCompletedTaskCount())
                .build();
    }
}
