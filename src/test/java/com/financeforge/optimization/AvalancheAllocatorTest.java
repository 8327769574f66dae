package com.financeforge.optimization;

import com.financeforge.accounts.AccountKind;
import com.financeforge.common.exception.ValidationException;
import com.financeforge.projection.AccountPosition;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.financeforge.optimization.ArbitrageAnalyzerTest.position;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for avalanche payment allocation.
 */
class AvalancheAllocatorTest {

    private final AvalancheAllocator allocator = new AvalancheAllocator();

    @Test
    void testInsufficientFundsForMinimums() {
        AccountPosition high = withMinimum(position("high", AccountKind.REVOLVING_CREDIT, "0.29", "5000.00", "1000.00"), "50.00");
        AccountPosition low = withMinimum(position("low", AccountKind.REVOLVING_CREDIT, "0.15", "5000.00", "1000.00"), "50.00");

        AllocationPlan plan = allocator.allocate(List.of(low, high), new BigDecimal("80.00"));

        assertFalse(plan.isMinimumsCovered());
        assertEquals(1, plan.getUnmetMinimums().size());
        UnmetMinimum unmet = plan.getUnmetMinimums().get(0);
        assertEquals("low", unmet.getAccountId());
        assertEquals(new BigDecimal("30.00"), unmet.getPaid());
        assertEquals(new BigDecimal("20.00"), unmet.getShortfall());
        assertEquals("high", plan.getAllocations().get(0).getAccountId());
        assertEquals(new BigDecimal("50.00"), plan.getAllocations().get(0).getAmount());
    }

    @Test
    void testRemainderGoesToHighestRate() {
        AccountPosition high = withMinimum(position("high", AccountKind.REVOLVING_CREDIT, "0.29", "5000.00", "1000.00"), "50.00");
        AccountPosition low = withMinimum(position("low", AccountKind.REVOLVING_CREDIT, "0.15", "5000.00", "1000.00"), "50.00");

        AllocationPlan plan = allocator.allocate(List.of(low, high), new BigDecimal("500.00"));

        assertTrue(plan.isMinimumsCovered());
        assertEquals(new BigDecimal("450.00"), plan.getAllocations().get(0).getAmount());
        assertEquals(new BigDecimal("400.00"), plan.getAllocations().get(0).getExtraPayment());
        assertEquals(new BigDecimal("50.00"), plan.getAllocations().get(1).getAmount());
        assertEquals(0, plan.getUnallocated().signum());
    }

    @Test
    void testCascadeAfterBalanceCleared() {
        AccountPosition high = withMinimum(position("high", AccountKind.REVOLVING_CREDIT, "0.29", "5000.00", "300.00"), "50.00");
        AccountPosition low = withMinimum(position("low", AccountKind.REVOLVING_CREDIT, "0.15", "5000.00", "1000.00"), "50.00");

        AllocationPlan plan = allocator.allocate(List.of(high, low), new BigDecimal("600.00"));

        assertEquals(new BigDecimal("300.00"), plan.getAllocations().get(0).getAmount());
        assertEquals(new BigDecimal("300.00"), plan.getAllocations().get(1).getAmount());
    }

    @Test
    void testSurplusReportedAsUnallocated() {
        AccountPosition card = position("card", AccountKind.REVOLVING_CREDIT, "0.20", "5000.00", "100.00");
        AccountPosition paidOff = position("paid", AccountKind.REVOLVING_CREDIT, "0.25", "5000.00", "0.00");

        AllocationPlan plan = allocator.allocate(List.of(card, paidOff), new BigDecimal("250.00"));

        assertEquals(1, plan.getAllocations().size());
        assertEquals(new BigDecimal("100.00"), plan.getAllocations().get(0).getAmount());
        assertEquals(new BigDecimal("150.00"), plan.getUnallocated());
    }

    @Test
    void testNegativeFundsRejected() {
        assertThrows(ValidationException.class, () -> allocator.allocate(List.of(), new BigDecimal("-1.00")));
    }

    private static AccountPosition withMinimum(AccountPosition position, String minimum) {
        position.getAccount().setMinimumPayment(new BigDecimal(minimum));
        return position;
    }
}
