package com.financeforge.ledger;

import com.financeforge.accounts.AccountRegistration;
import com.financeforge.accounts.AccountService;
import com.financeforge.accounts.CreditAccount;
import com.financeforge.common.Amounts;
import com.financeforge.common.IdempotencyKey;
import com.financeforge.common.exception.ConcurrencyConflictException;
import com.financeforge.common.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Command boundary of the ledger.
 *
 * Every command either commits its events, returns the events of an earlier
 * call with the same idempotency key, or is a no-op; invalid commands are
 * rejected before the log is touched. Commands read the tail, build the event
 * against it and append with the tail's sequence as expectation, so a race
 * with another writer is retried from a fresh read.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerCommandService {

    private final EventStore eventStore;
    private final AccountService accountService;

    /**
     * Register an account and record its opening balance as the first event.
     *
     * Every input is validated before the account is written. A retry after a
     * failed opening balance re-registers with identical terms and records the
     * balance then; with an idempotency key the opening balance is recorded once.
     */
    public CreditAccount openAccount(AccountRegistration registration, BigDecimal openingBalance,
                                     String idempotencyKey) {
        BigDecimal opening = openingBalance != null ? Amounts.of(openingBalance) : Amounts.ZERO;
        IdempotencyKey.validateOptional(idempotencyKey);

        CreditAccount account = accountService.registerAccount(registration);
        if (Amounts.isZero(opening)) {
            return account;
        }

        Optional<LedgerEvent> tail = eventStore.tail(account.getAccountId());
        if (tail.isPresent() && idempotencyKey == null) {
            if (tail.get().getBalanceAfter().compareTo(opening) != 0) {
                throw new ValidationException(String.format(
                    "Account %s already has ledger history; use a balance update to change its balance",
                    account.getAccountId()));
            }
            return account;
        }
        updateBalance(account.getAccountId(), opening, idempotencyKey);
        return account;
    }

    @Retryable(retryFor = ConcurrencyConflictException.class,
        maxAttemptsExpression = "${financeforge.ledger.conflict-retry.max-attempts:3}",
        backoff = @Backoff(delayExpression = "${financeforge.ledger.conflict-retry.delay-ms:10}"))
    public CommandResult recordPayment(String accountId, BigDecimal amount, String idempotencyKey) {
        BigDecimal payment = requirePositive(amount, "Payment");
        return recordSingle(accountId, EventKind.PAYMENT, payment.negate(), idempotencyKey);
    }

    @Retryable(retryFor = ConcurrencyConflictException.class,
        maxAttemptsExpression = "${financeforge.ledger.conflict-retry.max-attempts:3}",
        backoff = @Backoff(delayExpression = "${financeforge.ledger.conflict-retry.delay-ms:10}"))
    public CommandResult recordCharge(String accountId, BigDecimal amount, String idempotencyKey) {
        BigDecimal charge = requirePositive(amount, "Charge");
        return recordSingle(accountId, EventKind.CHARGE, charge, idempotencyKey);
    }

    /**
     * Record a stated balance. The difference from the projected balance is
     * appended as an ADJUSTMENT; an unchanged balance is a no-op.
     */
    @Retryable(retryFor = ConcurrencyConflictException.class,
        maxAttemptsExpression = "${financeforge.ledger.conflict-retry.max-attempts:3}",
        backoff = @Backoff(delayExpression = "${financeforge.ledger.conflict-retry.delay-ms:10}"))
    public CommandResult updateBalance(String accountId, BigDecimal newBalance, String idempotencyKey) {
        BigDecimal target = Amounts.of(newBalance);
        IdempotencyKey.validateOptional(idempotencyKey);
        accountService.getAccount(accountId);

        Optional<CommandResult> duplicate = findDuplicate(idempotencyKey, accountId, EventKind.ADJUSTMENT);
        if (duplicate.isPresent()) {
            return duplicate.get();
        }

        LedgerEvent tail = eventStore.tail(accountId).orElse(null);
        BigDecimal current = tail != null ? tail.getBalanceAfter() : Amounts.ZERO;
        BigDecimal delta = target.subtract(current);
        if (Amounts.isZero(delta)) {
            log.info("Balance update on {} to {} is a no-op", accountId, target);
            return CommandResult.noOp("Balance already " + target);
        }

        LedgerEvent event = eventStore.append(NewEvent.after(accountId, tail)
            .kind(EventKind.ADJUSTMENT)
            .amount(delta)
            .causationId(causation("balance-update", idempotencyKey))
            .idempotencyKey(idempotencyKey)
            .build());
        return CommandResult.committed(List.of(event));
    }

    /**
     * Move balance from one account to another (applying an arbitrage opportunity).
     * Both legs share one causation id and commit together.
     */
    @Retryable(retryFor = ConcurrencyConflictException.class,
        maxAttemptsExpression = "${financeforge.ledger.conflict-retry.max-attempts:3}",
        backoff = @Backoff(delayExpression = "${financeforge.ledger.conflict-retry.delay-ms:10}"))
    public CommandResult executeTransfer(String fromAccountId, String toAccountId, BigDecimal amount,
                                         String idempotencyKey) {
        BigDecimal transfer = requirePositive(amount, "Transfer");
        IdempotencyKey.validateOptional(idempotencyKey);
        if (fromAccountId == null || fromAccountId.equals(toAccountId)) {
            throw new ValidationException("Transfer needs two distinct accounts");
        }
        accountService.getAccount(fromAccountId);
        CreditAccount destination = accountService.getAccount(toAccountId);

        Optional<CommandResult> duplicate = findDuplicate(idempotencyKey, fromAccountId, EventKind.TRANSFER_OUT);
        if (duplicate.isPresent()) {
            return duplicate.get();
        }

        LedgerEvent sourceTail = eventStore.tail(fromAccountId).orElse(null);
        LedgerEvent destinationTail = eventStore.tail(toAccountId).orElse(null);
        BigDecimal sourceBalance = sourceTail != null ? sourceTail.getBalanceAfter() : Amounts.ZERO;
        BigDecimal destinationBalance = destinationTail != null ? destinationTail.getBalanceAfter() : Amounts.ZERO;

        if (transfer.compareTo(sourceBalance) > 0) {
            throw new ValidationException(String.format(
                "Transfer of %s exceeds the %s owed on %s", transfer, sourceBalance, fromAccountId));
        }
        if (!destination.hasCreditLimit()) {
            throw new ValidationException("Account " + toAccountId + " cannot receive transfers");
        }
        if (transfer.compareTo(destination.availableCapacity(destinationBalance)) > 0) {
            throw new ValidationException(String.format(
                "Transfer of %s exceeds available capacity %s on %s",
                transfer, destination.availableCapacity(destinationBalance), toAccountId));
        }

        String causationId = causation("transfer", idempotencyKey);
        List<LedgerEvent> events = eventStore.appendAll(List.of(
            NewEvent.after(fromAccountId, sourceTail)
                .kind(EventKind.TRANSFER_OUT)
                .amount(transfer.negate())
                .causationId(causationId)
                .idempotencyKey(idempotencyKey)
                .build(),
            NewEvent.after(toAccountId, destinationTail)
                .kind(EventKind.TRANSFER_IN)
                .amount(transfer)
                .causationId(causationId)
                .build()
        ));
        log.info("Transferred {} from {} to {} ({})", transfer, fromAccountId, toAccountId, causationId);
        return CommandResult.committed(events);
    }

    public List<LedgerEvent> queryHistory(String accountId, Instant from, Instant to) {
        accountService.getAccount(accountId);
        if (from != null && to != null && from.isAfter(to)) {
            throw new ValidationException("History range starts after it ends");
        }
        return eventStore.history(accountId, from, to);
    }

    private CommandResult recordSingle(String accountId, EventKind kind, BigDecimal amount, String idempotencyKey) {
        IdempotencyKey.validateOptional(idempotencyKey);
        accountService.getAccount(accountId);

        Optional<CommandResult> duplicate = findDuplicate(idempotencyKey, accountId, kind);
        if (duplicate.isPresent()) {
            return duplicate.get();
        }

        LedgerEvent tail = eventStore.tail(accountId).orElse(null);
        LedgerEvent event = eventStore.append(NewEvent.after(accountId, tail)
            .kind(kind)
            .amount(amount)
            .causationId(causation(kind.name().toLowerCase(), idempotencyKey))
            .idempotencyKey(idempotencyKey)
            .build());
        return CommandResult.committed(List.of(event));
    }

    private Optional<CommandResult> findDuplicate(String idempotencyKey, String accountId, EventKind kind) {
        if (idempotencyKey == null) {
            return Optional.empty();
        }
        return eventStore.findByIdempotencyKey(idempotencyKey).map(existing -> {
            if (!existing.getAccountId().equals(accountId) || existing.getKind() != kind) {
                throw new ValidationException("Idempotency key " + idempotencyKey
                    + " was already used for a different command");
            }
            log.info("Duplicate {} command on {} with idempotency key {}", kind, accountId, idempotencyKey);
            return CommandResult.duplicate(eventStore.findByCausationId(existing.getCausationId()));
        });
    }

    private static BigDecimal requirePositive(BigDecimal amount, String what) {
        BigDecimal value = Amounts.of(amount);
        if (!Amounts.isPositive(value)) {
            throw new ValidationException(what + " amount must be positive: " + value);
        }
        return value;
    }

    private static String causation(String command, String idempotencyKey) {
        return command + ":" + (idempotencyKey != null ? idempotencyKey : UUID.randomUUID().toString());
    }
}
