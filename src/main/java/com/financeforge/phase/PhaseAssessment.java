package com.financeforge.phase;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * A phase together with the inputs it was derived from.
 */
@Value
@Builder
public class PhaseAssessment {
    Phase phase;
    BigDecimal totalDebt;
    BigDecimal annualIncome;
    BigDecimal creditUsed;
    BigDecimal creditAvailable;
    double debtToIncome;
    double utilization;

    public List<Strategy> getStrategies() {
        return phase.getStrategies();
    }
}
