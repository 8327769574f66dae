package com.financeforge.phase;

import com.financeforge.common.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for phase boundaries.
 */
class PhaseClassifierTest {

    private final PhaseClassifier classifier =
        new PhaseClassifier(new BigDecimal("2.0"), new BigDecimal("0.8"), new BigDecimal("0.5"));

    @Test
    void testDebtToIncomeBoundaryIsCrisis() {
        assertEquals(Phase.CRISIS, classify("100000", "50000", "500", "1000"));
    }

    @Test
    void testUtilizationBoundaryIsCrisis() {
        assertEquals(Phase.CRISIS, classify("10000", "100000", "800", "1000"));
    }

    @Test
    void testRecovery() {
        assertEquals(Phase.RECOVERY, classify("60000", "100000", "100", "1000"));
    }

    @Test
    void testRecoveryBoundaryIsGrowth() {
        assertEquals(Phase.GROWTH, classify("50000", "100000", "100", "1000"));
    }

    @Test
    void testGrowth() {
        assertEquals(Phase.GROWTH, classify("30000", "100000", "200", "1000"));
    }

    @Test
    void testZeroIncomeWithDebtIsCrisis() {
        assertEquals(Phase.CRISIS, classify("100", "0", "0", "0"));
    }

    @Test
    void testNoDebtNoIncomeIsGrowth() {
        assertEquals(Phase.GROWTH, classify("0", "0", "0", "0"));
    }

    @Test
    void testUsageWithoutAvailableCreditIsCrisis() {
        assertEquals(Phase.CRISIS, classify("100", "100000", "100", "0"));
    }

    @Test
    void testNegativeInputRejected() {
        assertThrows(ValidationException.class, () -> classify("-1", "100000", "0", "0"));
    }

    @Test
    void testStrategiesFollowPhase() {
        assertTrue(Phase.CRISIS.getStrategies().contains(Strategy.MINIMUMS_FIRST));
        assertTrue(Phase.GROWTH.getStrategies().contains(Strategy.SURPLUS_INVESTING));
        assertFalse(Phase.CRISIS.getStrategies().contains(Strategy.BALANCE_TRANSFER_ARBITRAGE));
    }

    @Test
    void testRatio() {
        assertEquals(Double.POSITIVE_INFINITY, PhaseClassifier.ratio(BigDecimal.ONE, BigDecimal.ZERO));
        assertEquals(0.0, PhaseClassifier.ratio(BigDecimal.ZERO, BigDecimal.ZERO));
        assertEquals(0.5, PhaseClassifier.ratio(new BigDecimal("1"), new BigDecimal("2")), 1e-12);
    }

    private Phase classify(String debt, String income, String used, String available) {
        return classifier.classify(new BigDecimal(debt), new BigDecimal(income),
            new BigDecimal(used), new BigDecimal(available));
    }
}
