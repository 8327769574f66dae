package com.financeforge.api.controller;

import com.financeforge.api.dto.ReconciliationRequest;
import com.financeforge.api.dto.StatementRecordRequest;
import com.financeforge.reconciliation.ReconciliationEngine;
import com.financeforge.reconciliation.ReconciliationReport;
import com.financeforge.reconciliation.ReconciliationResult;
import com.financeforge.reconciliation.ReconciliationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for reconciling ledger balances against external statements.
 */
@RestController
@RequestMapping("/api/v1/reconciliation")
@RequiredArgsConstructor
@Tag(name = "Reconciliation", description = "Statement reconciliation")
public class ReconciliationController {

    private final ReconciliationService reconciliationService;
    private final ReconciliationEngine reconciliationEngine;

    @PostMapping
    @Operation(summary = "Reconcile a batch of statement records")
    public ResponseEntity<ReconciliationReport> runReconciliation(@Valid @RequestBody ReconciliationRequest request) {
        return ResponseEntity.ok(reconciliationService.runReconciliation(
            request.getRecords().stream().map(StatementRecordRequest::toRecord).toList()));
    }

    @PostMapping("/accounts/{accountId}")
    @Operation(summary = "Reconcile one account by id")
    public ResponseEntity<ReconciliationResult> reconcileAccount(
            @PathVariable String accountId,
            @Valid @RequestBody StatementRecordRequest request) {
        return ResponseEntity.ok(reconciliationEngine.reconcile(accountId, request.getBalance(), request.getAsOf()));
    }
}
