package com.financeforge.projection;

import com.financeforge.common.Amounts;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Point-in-time balances derived from the event log.
 *
 * Snapshots are immutable and disposable: they can always be rebuilt by
 * replaying the log, and are never written back to it.
 */
@Value
public class Snapshot {

    /**
     * Events that occurred after this instant are excluded; null means "latest".
     */
    Instant asOf;

    Map<String, BigDecimal> balances;

    /**
     * Sequence of the last event folded per account (0 when none).
     */
    Map<String, Long> sequences;

    public Snapshot(Instant asOf, Map<String, BigDecimal> balances, Map<String, Long> sequences) {
        this.asOf = asOf;
        this.balances = Collections.unmodifiableMap(new TreeMap<>(balances));
        this.sequences = Collections.unmodifiableMap(new TreeMap<>(sequences));
    }

    public BigDecimal balanceOf(String accountId) {
        return balances.getOrDefault(accountId, Amounts.ZERO);
    }

    public long sequenceOf(String accountId) {
        return sequences.getOrDefault(accountId, 0L);
    }

    public Set<String> accountIds() {
        return balances.keySet();
    }
}
