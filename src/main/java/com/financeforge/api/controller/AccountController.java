package com.financeforge.api.controller;

import com.financeforge.accounts.AccountService;
import com.financeforge.accounts.CreditAccount;
import com.financeforge.api.dto.AmountRequest;
import com.financeforge.api.dto.BalanceResponse;
import com.financeforge.api.dto.BalanceUpdateRequest;
import com.financeforge.api.dto.RegisterAccountRequest;
import com.financeforge.ledger.CommandResult;
import com.financeforge.ledger.CommandStatus;
import com.financeforge.ledger.LedgerCommandService;
import com.financeforge.ledger.LedgerEvent;
import com.financeforge.projection.Checkpoint;
import com.financeforge.projection.ProjectionBuilder;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

/**
 * REST API for accounts and their ledger commands.
 */
@RestController
@RequestMapping("/api/v1/accounts")
@RequiredArgsConstructor
@Tag(name = "Accounts", description = "Account registration and ledger commands")
public class AccountController {

    static final String IDEMPOTENCY_KEY = "Idempotency-Key";

    private final AccountService accountService;
    private final LedgerCommandService ledgerCommandService;
    private final ProjectionBuilder projectionBuilder;

    @PostMapping
    @Operation(summary = "Register a credit account")
    public ResponseEntity<CreditAccount> registerAccount(
            @Valid @RequestBody RegisterAccountRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY, required = false) String idempotencyKey) {
        CreditAccount account = ledgerCommandService.openAccount(
            request.toRegistration(), request.getOpeningBalance(), idempotencyKey);
        return ResponseEntity.status(HttpStatus.CREATED).body(account);
    }

    @GetMapping
    @Operation(summary = "List registered accounts")
    public ResponseEntity<List<CreditAccount>> getAccounts() {
        return ResponseEntity.ok(accountService.getAccounts());
    }

    @GetMapping("/{accountId}")
    @Operation(summary = "Get account details")
    public ResponseEntity<CreditAccount> getAccount(@PathVariable String accountId) {
        return ResponseEntity.ok(accountService.getAccount(accountId));
    }

    @GetMapping("/{accountId}/balance")
    @Operation(summary = "Get the projected balance, optionally as of an instant")
    public ResponseEntity<BalanceResponse> getBalance(
            @PathVariable String accountId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant asOf) {
        accountService.getAccount(accountId);
        Checkpoint projection = projectionBuilder.project(accountId, asOf);
        return ResponseEntity.ok(new BalanceResponse(accountId, projection.getBalance(), projection.getSequence(), asOf));
    }

    @GetMapping("/{accountId}/history")
    @Operation(summary = "Get the events of an account within a time range")
    public ResponseEntity<List<LedgerEvent>> getHistory(
            @PathVariable String accountId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return ResponseEntity.ok(ledgerCommandService.queryHistory(accountId, from, to));
    }

    @PostMapping("/{accountId}/payments")
    @Operation(summary = "Record a payment")
    public ResponseEntity<CommandResult> recordPayment(
            @PathVariable String accountId,
            @Valid @RequestBody AmountRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY, required = false) String idempotencyKey) {
        return respond(ledgerCommandService.recordPayment(accountId, request.getAmount(), idempotencyKey));
    }

    @PostMapping("/{accountId}/charges")
    @Operation(summary = "Record a charge")
    public ResponseEntity<CommandResult> recordCharge(
            @PathVariable String accountId,
            @Valid @RequestBody AmountRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY, required = false) String idempotencyKey) {
        return respond(ledgerCommandService.recordCharge(accountId, request.getAmount(), idempotencyKey));
    }

    @PutMapping("/{accountId}/balance")
    @Operation(summary = "Record a stated balance as an adjustment")
    public ResponseEntity<CommandResult> updateBalance(
            @PathVariable String accountId,
            @Valid @RequestBody BalanceUpdateRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY, required = false) String idempotencyKey) {
        return respond(ledgerCommandService.updateBalance(accountId, request.getBalance(), idempotencyKey));
    }

    static ResponseEntity<CommandResult> respond(CommandResult result) {
        HttpStatus status = result.getStatus() == CommandStatus.COMMITTED ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(result);
    }
}
