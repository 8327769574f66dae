package com.financeforge.optimization;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * A balance transfer from a higher-rate to a lower-rate account.
 * Derived on demand; never written to the ledger.
 */
@Value
@Builder
public class OptimizationOpportunity {
    String fromAccountId;
    String toAccountId;
    BigDecimal transferAmount;
    BigDecimal rateDifferential;
    BigDecimal monthlySavings;
    BigDecimal annualSavings;
    double riskScore;
    Map<String, Double> riskFactors;

    public String getSubject() {
        return fromAccountId + "->" + toAccountId;
    }
}
