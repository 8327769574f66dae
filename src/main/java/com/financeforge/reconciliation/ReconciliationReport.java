package com.financeforge.reconciliation;

import com.financeforge.alerts.Alert;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * One result per input record, in input order, plus the de-duplicated alerts of the run.
 */
@Value
public class ReconciliationReport {
    List<ReconciliationResult> results;
    List<Alert> alerts;

    public Map<ReconciliationStatus, Long> getSummary() {
        Map<ReconciliationStatus, Long> summary = new TreeMap<>();
        results.forEach(result -> summary.merge(result.getStatus(), 1L, Long::sum));
        return summary;
    }
}
