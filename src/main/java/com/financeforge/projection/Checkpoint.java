package com.financeforge.projection;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Memoized fold of one account's chain up to a sequence.
 * Only ever a shortcut; a full replay must arrive at the same balance.
 */
@Value
public class Checkpoint {
    String accountId;
    long sequence;
    BigDecimal balance;
    Instant lastOccurredAt;
}
