package com.flagship.debt_settlement.api;

import com.flagship.debt_settlement.api.dto.DebtListResponse;
import com.flagship.debt_settlement.api.dto.ExpenseListRequest;
import com.flagship.debt_settlement.api.dto.SettlementPlanResponse;
import com.flagship.debt_settlement.expense.ExpenseSplitter;
import com.flagship.debt_settlement.settlement.Debt;
import com.flagship.debt_settlement.settlement.SettlementService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST Controller that derives debts from shared expenses.
 */
@RestController
@RequestMapping("/api/expenses")
@RequiredArgsConstructor
@Slf4j
public class ExpenseController {

    private final ExpenseSplitter expenseSplitter;
    private final SettlementService settlementService;

    @PostMapping("/debts")
    public ResponseEntity<DebtListResponse> debts(@Valid @RequestBody ExpenseListRequest request) {
        List<Debt> debts = expenseSplitter.toDebts(request.toDomain());
        log.info("Split expenses into debts: expenses={}, debts={}", request.getExpenses().size(), debts.size());
        return ResponseEntity.ok(DebtListResponse.from(debts));
    }

    /**
     * Splits the expenses and settles the resulting debts in one call.
     */
    @PostMapping("/settlements")
    public ResponseEntity<SettlementPlanResponse> settle(@Valid @RequestBody ExpenseListRequest request) {
        List<Debt> debts = expenseSplitter.toDebts(request.toDomain());
        Thread requestThread = Thread.currentThread();
        return ResponseEntity.ok(SettlementPlanResponse.from(
            settlementService.simplify(debts, requestThread::isInterrupted)));
    }
}
