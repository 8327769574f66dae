package com.financeforge.reconciliation;

import com.financeforge.alerts.Alert;
import com.financeforge.ledger.LedgerEvent;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of reconciling one external balance.
 *
 * drift is external minus projected. adjustment is the appended event when
 * ADJUSTED; for NEEDS_REVIEW on drift, proposedAdjustment is what would have been appended.
 * failure carries the error message when the record could not be applied.
 */
@Value
@Builder(toBuilder = true)
public class ReconciliationResult {
    String accountReference;
    String accountId;
    ReconciliationStatus status;
    ReviewReason reviewReason;
    Instant asOf;
    BigDecimal projectedBalance;
    BigDecimal externalBalance;
    BigDecimal drift;
    LedgerEvent adjustment;
    BigDecimal proposedAdjustment;
    List<MatchCandidate> candidates;
    Alert alert;
    String failure;

    static ReconciliationResult ambiguous(AccountResolution resolution, BigDecimal externalBalance, Instant asOf) {
        return ReconciliationResult.builder()
            .accountReference(resolution.getReference())
            .status(ReconciliationStatus.NEEDS_REVIEW)
            .reviewReason(ReviewReason.AMBIGUOUS_REFERENCE)
            .asOf(asOf)
            .externalBalance(externalBalance)
            .candidates(resolution.getCandidates())
            .build();
    }

    static ReconciliationResult notFound(String reference, BigDecimal externalBalance, Instant asOf) {
        return ReconciliationResult.builder()
            .accountReference(reference)
            .status(ReconciliationStatus.NOT_FOUND)
            .asOf(asOf)
            .externalBalance(externalBalance)
            .candidates(List.of())
            .build();
    }

    static ReconciliationResult unapplied(ExternalStatementRecord record, String accountId,
                                          ReconciliationStatus status, ReviewReason reason, String failure) {
        return ReconciliationResult.builder()
            .accountReference(record.getAccountReference())
            .accountId(accountId)
            .status(status)
            .reviewReason(reason)
            .asOf(record.getAsOf())
            .externalBalance(record.getBalance())
            .candidates(List.of())
            .failure(failure)
            .build();
    }
}
