package com.financeforge.optimization;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class PaymentAllocation {
    String accountId;
    BigDecimal apr;
    BigDecimal balance;
    BigDecimal minimumPayment;
    BigDecimal amount;

    public BigDecimal getExtraPayment() {
        return amount.subtract(minimumPayment).max(BigDecimal.ZERO);
    }
}
