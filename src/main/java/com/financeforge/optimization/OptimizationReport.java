package com.financeforge.optimization;

import com.financeforge.alerts.Alert;
import com.financeforge.phase.PhaseAssessment;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Result of one optimization request. The allocation and phase are null when
 * funds or income were not supplied.
 */
@Value
@Builder
public class OptimizationReport {
    Instant generatedAt;
    List<OptimizationOpportunity> opportunities;
    AllocationPlan allocation;
    PhaseAssessment phase;
    List<Alert> alerts;
}
