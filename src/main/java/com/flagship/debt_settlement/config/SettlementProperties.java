package com.flagship.debt_settlement.config;

import lombok.Builder;
import lombok.Value;

/**
 * Engine options resolved from {@code settlement.*} configuration.
 */
@Value
@Builder
public class SettlementProperties {

    /** Validate before matching and reject the whole run on any issue. */
    boolean failFast;

    /** Match currencies concurrently on the settlement worker pool. */
    boolean parallel;

    /** Use the exact solver for currencies small enough to afford it. */
    boolean exactSolverEnabled;

    int exactSolverMaxParticipants;

    public static SettlementProperties defaults() {
        return SettlementProperties.builder()
                .failFast(false)
                .parallel(true)
                .exactSolverEnabled(false)
                .exactSolverMaxParticipants(12)
                .build();
    }
}
