package com.financeforge.ledger;

import com.financeforge.common.Amounts;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * An event proposed for appending.
 *
 * The writer states the tail it built the event against: the sequence it expects
 * the account's tail to have (0 for an empty account) and the balance it starts from.
 * balanceAfter is always balanceBefore + amount.
 */
@Value
@Builder
public class NewEvent {
    String accountId;
    EventKind kind;
    BigDecimal amount;
    BigDecimal balanceBefore;
    long expectedSequence;
    /** Defaults to the store clock when null. */
    Instant occurredAt;
    String causationId;
    String idempotencyKey;

    public BigDecimal getBalanceAfter() {
        return balanceBefore.add(amount);
    }

    /**
     * Builder preset continuing the given tail (or an empty account when null).
     */
    public static NewEventBuilder after(String accountId, LedgerEvent tail) {
        return NewEvent.builder()
            .accountId(accountId)
            .expectedSequence(tail != null ? tail.getSequence() : 0L)
            .balanceBefore(tail != null ? tail.getBalanceAfter() : Amounts.ZERO);
    }
}
