package com.financeforge.api.controller;

import com.financeforge.api.dto.TransferRequest;
import com.financeforge.ledger.CommandResult;
import com.financeforge.ledger.LedgerCommandService;
import com.financeforge.optimization.AllocationPlan;
import com.financeforge.optimization.OptimizationOpportunity;
import com.financeforge.optimization.OptimizationReport;
import com.financeforge.optimization.OptimizationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;

/**
 * REST API for arbitrage discovery, payment allocation and transfers.
 */
@RestController
@RequestMapping("/api/v1/optimization")
@RequiredArgsConstructor
@Tag(name = "Optimization", description = "Arbitrage opportunities and payment allocation")
public class OptimizationController {

    private final OptimizationService optimizationService;
    private final LedgerCommandService ledgerCommandService;

    @GetMapping
    @Operation(summary = "Full optimization report over the latest balances")
    public ResponseEntity<OptimizationReport> requestOptimization(
            @RequestParam(required = false) BigDecimal availableFunds,
            @RequestParam(required = false) BigDecimal annualIncome) {
        return ResponseEntity.ok(optimizationService.requestOptimization(availableFunds, annualIncome));
    }

    @GetMapping("/opportunities")
    @Operation(summary = "Balance-transfer opportunities, best first")
    public ResponseEntity<List<OptimizationOpportunity>> getOpportunities() {
        return ResponseEntity.ok(optimizationService.findOpportunities());
    }

    @GetMapping("/allocation")
    @Operation(summary = "Avalanche allocation of a payment budget")
    public ResponseEntity<AllocationPlan> allocate(@RequestParam BigDecimal availableFunds) {
        return ResponseEntity.ok(optimizationService.allocate(availableFunds));
    }

    @PostMapping("/transfers")
    @Operation(summary = "Move balance from one account to another")
    public ResponseEntity<CommandResult> executeTransfer(
            @Valid @RequestBody TransferRequest request,
            @RequestHeader(value = AccountController.IDEMPOTENCY_KEY, required = false) String idempotencyKey) {
        return AccountController.respond(ledgerCommandService.executeTransfer(
            request.getFromAccountId(), request.getToAccountId(), request.getAmount(), idempotencyKey));
    }
}
