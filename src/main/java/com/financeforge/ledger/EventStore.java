package com.financeforge.ledger;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only store of balance-changing events. The authoritative history of
 * every account; everything else is derived from it by replay.
 *
 * Implementations serialize appends per account (one writer per account at a
 * time) while letting appends to different accounts proceed independently.
 * Reads never block writers.
 */
public interface EventStore {

    /**
     * Append one event, atomically.
     *
     * @return the committed event, carrying its store-assigned id and sequence
     * @throws com.financeforge.common.exception.ConsistencyException if balanceBefore does not match the tail
     * @throws com.financeforge.common.exception.ConcurrencyConflictException if the tail moved since the writer read it
     * @throws com.financeforge.common.exception.ValidationException if the event is malformed
     * @throws com.financeforge.common.exception.LedgerPersistenceException if storage stays unavailable after retries
     */
    LedgerEvent append(NewEvent event);

    /**
     * Append several events, possibly on several accounts, in one all-or-nothing commit.
     * Events for the same account are applied in list order.
     */
    List<LedgerEvent> appendAll(List<NewEvent> events);

    /**
     * Events of one account in chain order, optionally only those that occurred at or before upTo.
     */
    List<LedgerEvent> replay(String accountId, Instant upTo);

    /**
     * Events of one account after the given sequence, optionally bounded by upTo.
     */
    List<LedgerEvent> replaySince(String accountId, long afterSequence, Instant upTo);

    Optional<LedgerEvent> tail(String accountId);

    /**
     * Events of one account that occurred within [from, to]; either bound may be null.
     */
    List<LedgerEvent> history(String accountId, Instant from, Instant to);

    Optional<LedgerEvent> findByIdempotencyKey(String idempotencyKey);

    List<LedgerEvent> findByCausationId(String causationId);

    /**
     * Ids of every account that has at least one event.
     */
    List<String> accountIds();

    /**
     * A consistent prefix of the whole log in commit order: every event committed
     * when the call started, and no event whose append was still in flight.
     */
    List<LedgerEvent> frozenPrefix();

    /**
     * Load a previously exported log into an empty store in one transaction. The
     * verification callback runs inside that transaction after the events are written;
     * if it throws, nothing is kept.
     */
    void importEvents(List<LedgerEvent> events, Runnable verification);
}
