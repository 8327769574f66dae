package com.financeforge.reconciliation;

import com.financeforge.alerts.Alert;
import com.financeforge.alerts.AlertCycle;
import com.financeforge.alerts.AlertEngine;
import com.financeforge.common.Amounts;
import com.financeforge.common.exception.ConcurrencyConflictException;
import com.financeforge.common.exception.LedgerPersistenceException;
import com.financeforge.common.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Batch reconciliation of external statement records.
 *
 * The whole batch is validated before any record is applied. Each record is then
 * resolved to an account and reconciled on its own; one record needing review
 * does not stop the others. Failures that can only surface while applying a record
 * (an account that kept moving through every retry, storage outages) become that
 * record's outcome, so a run never ends in an exception after it changed the log.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationService {

    private final AccountReferenceResolver resolver;
    private final ReconciliationEngine engine;
    private final AlertEngine alertEngine;
    private final Clock clock;

    public ReconciliationReport runReconciliation(List<ExternalStatementRecord> records) {
        if (records == null || records.isEmpty()) {
            throw new ValidationException("No statement records given");
        }
        Instant now = clock.instant();
        for (ExternalStatementRecord record : records) {
            if (record.getAccountReference() == null || record.getAccountReference().isBlank()) {
                throw new ValidationException("Statement record without an account reference");
            }
            Amounts.of(record.getBalance());
            if (record.getAsOf() != null && record.getAsOf().isAfter(now)) {
                throw new ValidationException(String.format("Statement time %s for %s is in the future",
                    record.getAsOf(), record.getAccountReference()));
            }
        }

        AlertCycle cycle = alertEngine.beginCycle();
        List<ReconciliationResult> results = new ArrayList<>();
        for (ExternalStatementRecord record : records) {
            ReconciliationResult result = reconcile(record);
            if (result.getAlert() != null) {
                Alert alert = result.getAlert();
                cycle.raise(alert.getKind(), alert.getSeverity(), alert.getSubject(), alert.getMessage());
            }
            results.add(result);
        }

        ReconciliationReport report = new ReconciliationReport(results, cycle.getAlerts());
        log.info("Reconciliation run over {} records: {}", records.size(), report.getSummary());
        return report;
    }

    private ReconciliationResult reconcile(ExternalStatementRecord record) {
        AccountResolution resolution = resolver.resolve(record.getAccountReference());
        if (resolution.isAmbiguous()) {
            return ReconciliationResult.ambiguous(resolution, record.getBalance(), record.getAsOf());
        }
        if (!resolution.isResolved()) {
            return ReconciliationResult.notFound(record.getAccountReference(), record.getBalance(), record.getAsOf());
        }
        String accountId = resolution.getAccount().getAccountId();
        try {
            ReconciliationResult result = engine.reconcile(accountId, record.getBalance(), record.getAsOf());
            return result.toBuilder().accountReference(record.getAccountReference()).build();
        } catch (ConcurrencyConflictException e) {
            log.warn("Account {} kept changing while reconciling {}: {}", accountId, record.getAccountReference(), e.getMessage());
            return ReconciliationResult.unapplied(record, accountId, ReconciliationStatus.NEEDS_REVIEW,
                ReviewReason.CONCURRENT_CHANGE, e.getMessage());
        } catch (LedgerPersistenceException e) {
            log.error("Could not reconcile {} against {}", accountId, record.getAccountReference(), e);
            return ReconciliationResult.unapplied(record, accountId, ReconciliationStatus.FAILED, null, e.getMessage());
        }
    }
}
