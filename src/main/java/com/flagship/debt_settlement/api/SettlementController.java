package com.flagship.debt_settlement.api;

import com.flagship.debt_settlement.api.dto.BalancesResponse;
import com.flagship.debt_settlement.api.dto.DebtListRequest;
import com.flagship.debt_settlement.api.dto.ExposureResponse;
import com.flagship.debt_settlement.api.dto.SettlementPlanResponse;
import com.flagship.debt_settlement.api.dto.ValidationResponse;
import com.flagship.debt_settlement.settlement.Debt;
import com.flagship.debt_settlement.settlement.Settlement;
import com.flagship.debt_settlement.settlement.SettlementService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST Controller for settlement computations.
 *
 * Every endpoint is a pure function of the posted debt list; nothing is stored.
 */
@RestController
@RequestMapping("/api/settlements")
@RequiredArgsConstructor
@Slf4j
public class SettlementController {

    private final SettlementService settlementService;

    /**
     * Computes the settlement plan for a debt list.
     *
     * The run is abandoned if the request thread is interrupted.
     *
     * @param request Ordered debt list
     * @return Settlements ordered by currency, then largest amount first
     */
    @PostMapping
    public ResponseEntity<SettlementPlanResponse> simplify(@Valid @RequestBody DebtListRequest request) {
        log.info("Received settlement request: debts={}", request.getDebts().size());

        Thread requestThread = Thread.currentThread();
        List<Settlement> settlements = settlementService.simplify(request.toDomain(), requestThread::isInterrupted);

        return ResponseEntity.ok(SettlementPlanResponse.from(settlements));
    }

    @PostMapping("/balances")
    public ResponseEntity<BalancesResponse> balances(@Valid @RequestBody DebtListRequest request) {
        return ResponseEntity.ok(BalancesResponse.from(settlementService.balances(request.toDomain())));
    }

    /**
     * Raw amounts owed to and by one user, per currency.
     */
    @PostMapping("/exposure/{userId}")
    public ResponseEntity<ExposureResponse> exposure(@PathVariable("userId") String userId,
                                                     @Valid @RequestBody DebtListRequest request) {
        List<Debt> debts = request.toDomain();
        return ResponseEntity.ok(ExposureResponse.from(settlementService.exposure(userId, debts)));
    }

    /**
     * Advisory validation. Always 200; problems are listed in the body.
     */
    @PostMapping("/validate")
    public ResponseEntity<ValidationResponse> validate(@Valid @RequestBody DebtListRequest request) {
        return ResponseEntity.ok(ValidationResponse.from(settlementService.validate(request.toDomain())));
    }
}
