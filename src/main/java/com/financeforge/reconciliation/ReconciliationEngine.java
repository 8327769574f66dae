package com.financeforge.reconciliation;

import com.financeforge.accounts.AccountService;
import com.financeforge.alerts.Alert;
import com.financeforge.alerts.AlertSeverity;
import com.financeforge.common.Amounts;
import com.financeforge.common.exception.ConcurrencyConflictException;
import com.financeforge.common.exception.ValidationException;
import com.financeforge.ledger.EventKind;
import com.financeforge.ledger.EventStore;
import com.financeforge.ledger.LedgerEvent;
import com.financeforge.ledger.NewEvent;
import com.financeforge.projection.ProjectionBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Compares projected balances with external ones and closes the gap with an
 * ADJUSTMENT event.
 *
 * The adjustment is stamped at the statement's asOf, so reconciling the same
 * statement again sees the corrected projection and reports OK. A statement
 * older than the account's newest event is never adjusted automatically, nor
 * is a drift above the auto-apply limit.
 */
@Service
@Slf4j
public class ReconciliationEngine {

    public static final String DRIFT_ALERT = "RECONCILIATION_DRIFT";

    private final EventStore eventStore;
    private final ProjectionBuilder projectionBuilder;
    private final AccountService accountService;
    private final Clock clock;
    private final BigDecimal epsilon;
    private final BigDecimal warningThreshold;
    private final BigDecimal autoApplyLimit;

    public ReconciliationEngine(EventStore eventStore,
                                ProjectionBuilder projectionBuilder,
                                AccountService accountService,
                                Clock clock,
                                @Value("${financeforge.reconciliation.epsilon:0.01}") BigDecimal epsilon,
                                @Value("${financeforge.reconciliation.warning-threshold:10.00}") BigDecimal warningThreshold,
                                @Value("${financeforge.reconciliation.auto-apply-limit:1000.00}") BigDecimal autoApplyLimit) {
        this.eventStore = eventStore;
        this.projectionBuilder = projectionBuilder;
        this.accountService = accountService;
        this.clock = clock;
        this.epsilon = epsilon;
        this.warningThreshold = warningThreshold;
        this.autoApplyLimit = autoApplyLimit;
    }

    /**
     * @param asOf statement time; null means now
     * @throws ConcurrencyConflictException if the account kept moving through every retry
     */
    @Retryable(retryFor = ConcurrencyConflictException.class,
        maxAttemptsExpression = "${financeforge.ledger.conflict-retry.max-attempts:3}",
        backoff = @Backoff(delayExpression = "${financeforge.ledger.conflict-retry.delay-ms:10}"))
    public ReconciliationResult reconcile(String accountId, BigDecimal externalBalance, Instant asOf) {
        BigDecimal external = Amounts.of(externalBalance);
        Instant now = clock.instant();
        Instant statementTime = asOf != null ? asOf : now;
        if (statementTime.isAfter(now)) {
            throw new ValidationException("Statement time " + statementTime + " is in the future");
        }
        accountService.getAccount(accountId);

        BigDecimal projected = projectionBuilder.balanceOf(accountId, statementTime);
        LedgerEvent tail = eventStore.tail(accountId).orElse(null);
        BigDecimal drift = external.subtract(projected);

        ReconciliationResult.ReconciliationResultBuilder result = ReconciliationResult.builder()
            .accountReference(accountId)
            .accountId(accountId)
            .asOf(statementTime)
            .projectedBalance(projected)
            .externalBalance(external)
            .drift(drift)
            .candidates(List.of());

        if (Amounts.withinEpsilon(external, projected, epsilon)) {
            log.debug("Account {} reconciled at {}: {}", accountId, statementTime, projected);
            return result.status(ReconciliationStatus.OK).build();
        }

        if (tail != null && tail.getOccurredAt().isAfter(statementTime)) {
            log.warn("Statement for {} at {} predates newest event #{}; drift {} left for review",
                accountId, statementTime, tail.getSequence(), drift);
            return result.status(ReconciliationStatus.NEEDS_REVIEW)
                .reviewReason(ReviewReason.STALE_STATEMENT)
                .proposedAdjustment(drift)
                .alert(alert(accountId, AlertSeverity.WARNING, String.format(
                    "Stale statement for %s shows drift of %s; not adjusted", accountId, drift)))
                .build();
        }

        BigDecimal tailBalance = tail != null ? tail.getBalanceAfter() : Amounts.ZERO;
        if (tailBalance.compareTo(projected) != 0) {
            throw new ConcurrencyConflictException(accountId,
                "Account " + accountId + " changed while it was being reconciled");
        }

        if (drift.abs().compareTo(autoApplyLimit) > 0) {
            log.warn("Drift of {} on {} exceeds auto-apply limit {}; left for review", drift, accountId, autoApplyLimit);
            return result.status(ReconciliationStatus.NEEDS_REVIEW)
                .reviewReason(ReviewReason.LARGE_DRIFT)
                .proposedAdjustment(drift)
                .alert(alert(accountId, AlertSeverity.WARNING, String.format(
                    "Drift of %s on %s exceeds %s and needs confirmation", drift, accountId, autoApplyLimit)))
                .build();
        }

        LedgerEvent adjustment = eventStore.append(NewEvent.after(accountId, tail)
            .kind(EventKind.ADJUSTMENT)
            .amount(drift)
            .occurredAt(statementTime)
            .causationId("reconciliation:" + UUID.randomUUID())
            .build());

        AlertSeverity severity = drift.abs().compareTo(warningThreshold) >= 0 ? AlertSeverity.WARNING : AlertSeverity.INFO;
        log.warn("Reconciled {}: projected {}, external {}, appended adjustment #{} of {}",
            accountId, projected, external, adjustment.getSequence(), drift);
        return result.status(ReconciliationStatus.ADJUSTED)
            .adjustment(adjustment)
            .alert(alert(accountId, severity, String.format(
                "Adjusted %s by %s to match external balance %s", accountId, drift, external)))
            .build();
    }

    private Alert alert(String accountId, AlertSeverity severity, String message) {
        return Alert.builder()
            .kind(DRIFT_ALERT)
            .severity(severity)
            .subject(accountId)
            .message(message)
            .triggeredAt(clock.instant())
            .build();
    }
}
