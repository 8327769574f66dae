package com.financeforge.phase;

import com.financeforge.common.exception.ValidationException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Maps debt, income and credit usage to a {@link Phase}.
 *
 * CRISIS when debt-to-income is at or above the crisis ratio or utilization is at
 * or above the crisis utilization; otherwise RECOVERY when debt-to-income is above
 * the recovery ratio; otherwise GROWTH. Ratios are compared by cross-multiplication
 * so zero denominators need no special arithmetic.
 */
@Component
public class PhaseClassifier {

    private final BigDecimal crisisDebtToIncome;
    private final BigDecimal crisisUtilization;
    private final BigDecimal recoveryDebtToIncome;

    public PhaseClassifier(@Value("${financeforge.phase.crisis-debt-to-income:2.0}") BigDecimal crisisDebtToIncome,
                           @Value("${financeforge.phase.crisis-utilization:0.8}") BigDecimal crisisUtilization,
                           @Value("${financeforge.phase.recovery-debt-to-income:0.5}") BigDecimal recoveryDebtToIncome) {
        this.crisisDebtToIncome = crisisDebtToIncome;
        this.crisisUtilization = crisisUtilization;
        this.recoveryDebtToIncome = recoveryDebtToIncome;
    }

    public Phase classify(BigDecimal totalDebt, BigDecimal annualIncome,
                          BigDecimal creditUsed, BigDecimal creditAvailable) {
        requireNonNegative(totalDebt, "Total debt");
        requireNonNegative(annualIncome, "Annual income");
        requireNonNegative(creditUsed, "Credit used");
        requireNonNegative(creditAvailable, "Credit available");

        // debt / income >= crisis  <=>  debt >= crisis * income (income 0: any debt is an infinite ratio)
        boolean crisisDebt = totalDebt.signum() > 0
            && totalDebt.compareTo(crisisDebtToIncome.multiply(annualIncome)) >= 0;
        boolean crisisCredit = creditUsed.signum() > 0
            && creditUsed.compareTo(crisisUtilization.multiply(creditAvailable)) >= 0;
        if (crisisDebt || crisisCredit) {
            return Phase.CRISIS;
        }
        if (totalDebt.compareTo(recoveryDebtToIncome.multiply(annualIncome)) > 0) {
            return Phase.RECOVERY;
        }
        return Phase.GROWTH;
    }

    /**
     * Ratio for reporting; infinite when the denominator is zero and the numerator is not.
     */
    public static double ratio(BigDecimal numerator, BigDecimal denominator) {
        if (denominator.signum() == 0) {
            return numerator.signum() == 0 ? 0.0 : Double.POSITIVE_INFINITY;
        }
        return numerator.divide(denominator, MathContext.DECIMAL64).doubleValue();
    }

    private static void requireNonNegative(BigDecimal value, String name) {
        if (value == null || value.signum() < 0) {
            throw new ValidationException(name + " must be zero or positive: " + value);
        }
    }
}
