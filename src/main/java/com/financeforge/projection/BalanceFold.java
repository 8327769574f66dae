package com.financeforge.projection;

import com.financeforge.common.Amounts;
import com.financeforge.common.exception.LedgerIntegrityException;
import com.financeforge.ledger.LedgerEvent;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Running fold of one account's events. Rejects any event that does not
 * continue the chain it has folded so far.
 */
class BalanceFold {

    private final String accountId;
    private long sequence;
    private BigDecimal balance;
    private Instant lastOccurredAt;
    private int folded;

    private BalanceFold(String accountId, long sequence, BigDecimal balance, Instant lastOccurredAt) {
        this.accountId = accountId;
        this.sequence = sequence;
        this.balance = balance;
        this.lastOccurredAt = lastOccurredAt;
    }

    static BalanceFold genesis(String accountId) {
        return new BalanceFold(accountId, 0L, Amounts.ZERO, null);
    }

    static BalanceFold resume(Checkpoint checkpoint) {
        return new BalanceFold(checkpoint.getAccountId(), checkpoint.getSequence(),
            checkpoint.getBalance(), checkpoint.getLastOccurredAt());
    }

    BalanceFold applyAll(List<LedgerEvent> events) {
        events.forEach(this::apply);
        return this;
    }

    void apply(LedgerEvent event) {
        if (event.getSequence() != sequence + 1 || event.getBalanceBefore().compareTo(balance) != 0) {
            throw new LedgerIntegrityException(String.format(
                "Chain broken on %s at event #%d: folded sequence %d with balance %s, event starts from %s",
                accountId, event.getSequence(), sequence, balance, event.getBalanceBefore()));
        }
        balance = event.getBalanceAfter();
        sequence = event.getSequence();
        lastOccurredAt = event.getOccurredAt();
        folded++;
    }

    /**
     * Fold only the events up to and including the given sequence.
     */
    BalanceFold applyUpTo(List<LedgerEvent> events, long lastSequence) {
        for (LedgerEvent event : events) {
            if (event.getSequence() > lastSequence) {
                break;
            }
            apply(event);
        }
        return this;
    }

    String accountId() {
        return accountId;
    }

    long sequence() {
        return sequence;
    }

    BigDecimal balance() {
        return balance;
    }

    int folded() {
        return folded;
    }

    Checkpoint toCheckpoint() {
        return new Checkpoint(accountId, sequence, balance, lastOccurredAt);
    }
}
