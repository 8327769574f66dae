package com.financeforge.optimization;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
public class AllocationPlan {
    BigDecimal availableFunds;
    @Singular
    List<PaymentAllocation> allocations;
    @Singular
    List<UnmetMinimum> unmetMinimums;
    BigDecimal unallocated;

    public boolean isMinimumsCovered() {
        return unmetMinimums.isEmpty();
    }
}
