package com.financeforge.alerts;

import com.financeforge.optimization.OptimizationOpportunity;
import com.financeforge.phase.PhaseAssessment;
import com.financeforge.projection.AccountPosition;
import com.financeforge.projection.Snapshot;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Everything one evaluation cycle looks at. The phase is absent when no income was given.
 */
@Value
@Builder
public class AlertContext {
    Snapshot snapshot;
    @Singular
    List<AccountPosition> positions;
    @Singular
    List<OptimizationOpportunity> opportunities;
    PhaseAssessment phase;
    LocalDate evaluationDate;
}
