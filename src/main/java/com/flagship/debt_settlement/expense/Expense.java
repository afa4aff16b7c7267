package com.flagship.debt_settlement.expense;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * One shared expense paid by {@code payer} on behalf of {@code participants}.
 * The payer may or may not be a participant.
 */
@Value
@Builder
public class Expense {
    String description;
    String payer;
    BigDecimal amount;
    String currency;
    @Singular
    List<String> participants;
    SplitMethod splitMethod;
    @Singular
    Map<String, BigDecimal> splits;
}
