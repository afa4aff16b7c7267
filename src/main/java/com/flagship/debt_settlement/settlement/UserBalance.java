package com.flagship.debt_settlement.settlement;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Net position of one user within one currency.
 * Positive means the user is owed money (creditor), negative means the user owes (debtor).
 */
@Value
public class UserBalance {
    String userId;
    BigDecimal balance;
    String currency;
}
