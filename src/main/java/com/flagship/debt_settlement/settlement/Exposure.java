package com.flagship.debt_settlement.settlement;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Raw, un-netted exposure of one user, keyed by currency code.
 * A user may be owed and owe money in the same currency at the same time.
 */
@Value
public class Exposure {
    String userId;
    Map<String, BigDecimal> owedToUser;
    Map<String, BigDecimal> owedByUser;
}
