package com.financeforge.optimization;

import com.financeforge.projection.AccountPosition;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A possible balance transfer being scored by the risk model.
 */
@Value
public class TransferCandidate {
    AccountPosition source;
    AccountPosition destination;
    BigDecimal transferAmount;
    LocalDate evaluationDate;

    public BigDecimal getRateDifferential() {
        return source.getApr().subtract(destination.getApr());
    }
}
