package com.financeforge.projection;

import com.financeforge.accounts.AccountRepository;
import com.financeforge.accounts.CreditAccount;
import com.financeforge.common.exception.LedgerIntegrityException;
import com.financeforge.ledger.EventStore;
import com.financeforge.ledger.LedgerEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Folds the event log into balance snapshots.
 *
 * Latest snapshots start from per-account checkpoints and fold only the events
 * after them; historical snapshots fall back to a full replay for accounts whose
 * checkpoint lies beyond the requested instant. Checkpoints are advanced once
 * enough events have accumulated past them and are verified against a full
 * replay before they are trusted.
 */
@Service
@Slf4j
public class ProjectionBuilder {

    private final EventStore eventStore;
    private final AccountRepository accountRepository;
    private final int checkpointInterval;
    private final boolean verifyOnCheckpoint;

    private volatile Map<String, Checkpoint> checkpoints = Map.of();

    public ProjectionBuilder(EventStore eventStore,
                             AccountRepository accountRepository,
                             @Value("${financeforge.projection.checkpoint-interval:500}") int checkpointInterval,
                             @Value("${financeforge.projection.verify-on-checkpoint:true}") boolean verifyOnCheckpoint) {
        this.eventStore = eventStore;
        this.accountRepository = accountRepository;
        this.checkpointInterval = checkpointInterval;
        this.verifyOnCheckpoint = verifyOnCheckpoint;
    }

    /**
     * Balances of every known account as of the given instant (null for latest).
     */
    public Snapshot snapshot(Instant asOf) {
        Map<String, Checkpoint> current = checkpoints;
        Map<String, BalanceFold> folds = new LinkedHashMap<>();
        int suffixEvents = 0;

        for (String accountId : knownAccountIds()) {
            BalanceFold fold = fold(accountId, current.get(accountId), asOf);
            suffixEvents += fold.folded();
            folds.put(accountId, fold);
        }

        if (asOf == null && suffixEvents >= checkpointInterval) {
            advanceCheckpoints(folds);
        }
        return toSnapshot(asOf, folds);
    }

    /**
     * Balances rebuilt from genesis, ignoring every checkpoint.
     */
    public Snapshot fullReplay(Instant asOf) {
        Map<String, BalanceFold> folds = new LinkedHashMap<>();
        for (String accountId : knownAccountIds()) {
            folds.put(accountId, BalanceFold.genesis(accountId).applyAll(eventStore.replay(accountId, asOf)));
        }
        return toSnapshot(asOf, folds);
    }

    /**
     * Projection of a single account, using its checkpoint when it is usable for asOf.
     */
    public Checkpoint project(String accountId, Instant asOf) {
        return fold(accountId, checkpoints.get(accountId), asOf).toCheckpoint();
    }

    public BigDecimal balanceOf(String accountId, Instant asOf) {
        return project(accountId, asOf).getBalance();
    }

    /**
     * Fold an arbitrary list of committed events (in commit order) into a snapshot.
     * Used for exported prefixes, where the store may already hold later events.
     */
    public Snapshot foldEvents(List<LedgerEvent> events) {
        Map<String, BalanceFold> folds = new TreeMap<>();
        for (LedgerEvent event : events) {
            folds.computeIfAbsent(event.getAccountId(), BalanceFold::genesis).apply(event);
        }
        return toSnapshot(null, folds);
    }

    /**
     * Verify the current checkpoints, then checkpoint every account at its latest event.
     *
     * @return the number of accounts checkpointed
     */
    public synchronized int checkpoint() {
        verifyCheckpoints();
        Map<String, BalanceFold> folds = new LinkedHashMap<>();
        for (String accountId : knownAccountIds()) {
            folds.put(accountId, BalanceFold.genesis(accountId).applyAll(eventStore.replay(accountId, null)));
        }
        checkpoints = toCheckpoints(folds);
        log.info("Checkpointed {} accounts", checkpoints.size());
        return checkpoints.size();
    }

    /**
     * Re-derive every checkpoint by full replay.
     *
     * @throws LedgerIntegrityException if any checkpoint disagrees with the log
     */
    public void verifyCheckpoints() {
        checkpoints.values().forEach(this::verify);
    }

    public void invalidateCheckpoints() {
        checkpoints = Map.of();
        log.info("Projection checkpoints invalidated");
    }

    public Map<String, Checkpoint> getCheckpoints() {
        return checkpoints;
    }

    private synchronized void advanceCheckpoints(Map<String, BalanceFold> folds) {
        Map<String, Checkpoint> advanced = toCheckpoints(folds);
        if (verifyOnCheckpoint) {
            advanced.values().forEach(this::verify);
        }
        checkpoints = advanced;
        log.debug("Advanced projection checkpoints for {} accounts", advanced.size());
    }

    private BalanceFold fold(String accountId, Checkpoint checkpoint, Instant asOf) {
        if (checkpoint != null && (asOf == null || !checkpoint.getLastOccurredAt().isAfter(asOf))) {
            return BalanceFold.resume(checkpoint)
                .applyAll(eventStore.replaySince(accountId, checkpoint.getSequence(), asOf));
        }
        return BalanceFold.genesis(accountId).applyAll(eventStore.replay(accountId, asOf));
    }

    private void verify(Checkpoint checkpoint) {
        BalanceFold replayed = BalanceFold.genesis(checkpoint.getAccountId())
            .applyUpTo(eventStore.replay(checkpoint.getAccountId(), null), checkpoint.getSequence());
        if (replayed.sequence() != checkpoint.getSequence()
            || replayed.balance().compareTo(checkpoint.getBalance()) != 0) {
            log.error("Checkpoint for {} diverges from full replay: checkpoint #{}={}, replay #{}={}",
                checkpoint.getAccountId(), checkpoint.getSequence(), checkpoint.getBalance(),
                replayed.sequence(), replayed.balance());
            throw new LedgerIntegrityException(String.format(
                "Checkpoint for %s at #%d (%s) diverges from full replay (#%d, %s)",
                checkpoint.getAccountId(), checkpoint.getSequence(), checkpoint.getBalance(),
                replayed.sequence(), replayed.balance()));
        }
    }

    private Set<String> knownAccountIds() {
        Set<String> accountIds = new TreeSet<>(eventStore.accountIds());
        accountRepository.findAll().stream()
            .map(CreditAccount::getAccountId)
            .forEach(accountIds::add);
        return accountIds;
    }

    private static Map<String, Checkpoint> toCheckpoints(Map<String, BalanceFold> folds) {
        Map<String, Checkpoint> result = new HashMap<>();
        folds.values().stream()
            .filter(fold -> fold.sequence() > 0)
            .forEach(fold -> result.put(fold.accountId(), fold.toCheckpoint()));
        return Map.copyOf(result);
    }

    private static Snapshot toSnapshot(Instant asOf, Map<String, BalanceFold> folds) {
        Map<String, BigDecimal> balances = new HashMap<>();
        Map<String, Long> sequences = new HashMap<>();
        folds.values().forEach(fold -> {
            balances.put(fold.accountId(), fold.balance());
            sequences.put(fold.accountId(), fold.sequence());
        });
        return new Snapshot(asOf, balances, sequences);
    }
}
