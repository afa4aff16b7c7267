package com.flagship.debt_settlement.settlement;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A recommended transfer from a debtor to a creditor.
 * The amount is always positive and carries two decimal places.
 */
@Value
public class Settlement {
    String from;
    String to;
    BigDecimal amount;
    String currency;
}
