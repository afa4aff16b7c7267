package com.flagship.debt_settlement.settlement;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders settlements by currency code ascending, then amount descending.
 * Entries with equal currency and amount keep their input order.
 */
@Component
public class SettlementOrderer {

    private static final Comparator<Settlement> CURRENCY_THEN_LARGEST_FIRST =
            Comparator.comparing(Settlement::getCurrency)
                    .thenComparing(Settlement::getAmount, Comparator.reverseOrder());

    public List<Settlement> order(List<Settlement> settlements) {
        List<Settlement> ordered = new ArrayList<>(settlements);
        // List.sort is a stable merge sort
        ordered.sort(CURRENCY_THEN_LARGEST_FIRST);
        return ordered;
    }
}
