package com.financeforge.optimization;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A minimum payment the available funds could not cover.
 */
@Value
public class UnmetMinimum {
    String accountId;
    BigDecimal required;
    BigDecimal paid;

    public BigDecimal getShortfall() {
        return required.subtract(paid);
    }
}
