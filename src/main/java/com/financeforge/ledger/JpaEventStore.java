package com.financeforge.ledger;

import com.financeforge.common.Amounts;
import com.financeforge.common.exception.ConcurrencyConflictException;
import com.financeforge.common.exception.ConsistencyException;
import com.financeforge.common.exception.LedgerIntegrityException;
import com.financeforge.common.exception.LedgerPersistenceException;
import com.financeforge.common.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.Lock;

/**
 * Event store backed by the ledger_events table.
 *
 * Append path:
 * 1. Validate the shape of each event (sign, scale, causation)
 * 2. Take the account locks (bounded wait)
 * 3. In a fresh transaction, re-read each tail and check expected sequence and balance chain
 * 4. Insert and commit, then release the locks
 *
 * The unique (account_id, account_sequence) constraint backs up the in-process
 * locks when several instances share one database.
 */
@Service
@Slf4j
public class JpaEventStore implements EventStore {

    private final LedgerEventRepository repository;
    private final AccountLockRegistry locks;
    private final TransactionTemplate appendTransaction;
    private final Clock clock;

    public JpaEventStore(LedgerEventRepository repository, AccountLockRegistry locks,
                         PlatformTransactionManager transactionManager, Clock clock) {
        this.repository = repository;
        this.locks = locks;
        this.clock = clock;
        this.appendTransaction = new TransactionTemplate(transactionManager);
        this.appendTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    @Retryable(retryFor = LedgerPersistenceException.class,
        maxAttemptsExpression = "${financeforge.ledger.persistence-retry.max-attempts:3}",
        backoff = @Backoff(delayExpression = "${financeforge.ledger.persistence-retry.delay-ms:100}",
            multiplierExpression = "${financeforge.ledger.persistence-retry.multiplier:2}"))
    public LedgerEvent append(NewEvent event) {
        return doAppendAll(List.of(event)).get(0);
    }

    @Override
    @Retryable(retryFor = LedgerPersistenceException.class,
        maxAttemptsExpression = "${financeforge.ledger.persistence-retry.max-attempts:3}",
        backoff = @Backoff(delayExpression = "${financeforge.ledger.persistence-retry.delay-ms:100}",
            multiplierExpression = "${financeforge.ledger.persistence-retry.multiplier:2}"))
    public List<LedgerEvent> appendAll(List<NewEvent> events) {
        return doAppendAll(events);
    }

    private List<LedgerEvent> doAppendAll(List<NewEvent> events) {
        if (events == null || events.isEmpty()) {
            throw new ValidationException("Nothing to append");
        }
        events.forEach(this::validateShape);

        Set<String> accountIds = new LinkedHashSet<>();
        events.forEach(event -> accountIds.add(event.getAccountId()));

        Deque<Lock> held = locks.acquireForAppend(accountIds);
        try {
            List<LedgerEvent> committed = appendTransaction.execute(status -> insertChained(events));
            committed.forEach(event -> log.info("Appended {} #{} on {}: {} ({} -> {}), cause={}",
                event.getKind(), event.getSequence(), event.getAccountId(), event.getAmount(),
                event.getBalanceBefore(), event.getBalanceAfter(), event.getCausationId()));
            return committed;
        } catch (DataIntegrityViolationException e) {
            // Another instance extended the chain or claimed the idempotency key first
            log.warn("Append on {} lost a race at commit: {}", accountIds, e.getMostSpecificCause().getMessage());
            throw new ConcurrencyConflictException(String.join(",", accountIds),
                "Concurrent append detected at commit for " + accountIds);
        } catch (DataAccessException | TransactionException e) {
            log.warn("Event log storage unavailable while appending to {}: {}", accountIds, e.getMessage());
            throw new LedgerPersistenceException("Event log storage unavailable", e);
        } finally {
            locks.release(held);
        }
    }

    private List<LedgerEvent> insertChained(List<NewEvent> events) {
        Map<String, LedgerEvent> tails = new HashMap<>();
        List<LedgerEvent> committed = new ArrayList<>();
        Instant now = Instant.now(clock);

        for (NewEvent event : events) {
            String accountId = event.getAccountId();
            LedgerEvent tail = tails.containsKey(accountId)
                ? tails.get(accountId)
                : repository.findFirstByAccountIdOrderBySequenceDesc(accountId).orElse(null);

            long tailSequence = tail != null ? tail.getSequence() : 0L;
            if (event.getExpectedSequence() != tailSequence) {
                throw new ConcurrencyConflictException(accountId, event.getExpectedSequence(), tailSequence);
            }

            BigDecimal tailBalance = tail != null ? tail.getBalanceAfter() : Amounts.ZERO;
            if (tailBalance.compareTo(event.getBalanceBefore()) != 0) {
                throw new ConsistencyException(accountId, tailBalance, event.getBalanceBefore());
            }

            Instant occurredAt = event.getOccurredAt() != null ? event.getOccurredAt() : now;
            if (tail != null && occurredAt.isBefore(tail.getOccurredAt())) {
                throw new ValidationException(String.format(
                    "Event on %s at %s precedes the account's latest event at %s",
                    accountId, occurredAt, tail.getOccurredAt()));
            }

            LedgerEvent saved = repository.saveAndFlush(new LedgerEvent(
                accountId,
                tailSequence + 1,
                event.getKind(),
                Amounts.of(event.getAmount()),
                Amounts.of(event.getBalanceBefore()),
                occurredAt,
                now,
                event.getCausationId(),
                event.getIdempotencyKey()
            ));
            tails.put(accountId, saved);
            committed.add(saved);
        }
        return committed;
    }

    private void validateShape(NewEvent event) {
        if (event.getAccountId() == null || event.getAccountId().isBlank()) {
            throw new ValidationException("Event account id is required");
        }
        if (event.getKind() == null) {
            throw new ValidationException("Event kind is required");
        }
        if (event.getAmount() == null || event.getBalanceBefore() == null) {
            throw new ValidationException("Event amount and balanceBefore are required");
        }
        Amounts.of(event.getAmount());
        Amounts.of(event.getBalanceBefore());
        if (!event.getKind().accepts(event.getAmount())) {
            throw new ValidationException(String.format("Amount %s is not valid for a %s event",
                event.getAmount(), event.getKind()));
        }
        if (event.getCausationId() == null || event.getCausationId().isBlank()) {
            throw new ValidationException("Event causation id is required");
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<LedgerEvent> replay(String accountId, Instant upTo) {
        return upTo == null
            ? repository.findByAccountIdOrderBySequenceAsc(accountId)
            : repository.findByAccountIdAndOccurredAtLessThanEqualOrderBySequenceAsc(accountId, upTo);
    }

    @Override
    @Transactional(readOnly = true)
    public List<LedgerEvent> replaySince(String accountId, long afterSequence, Instant upTo) {
        return upTo == null
            ? repository.findByAccountIdAndSequenceGreaterThanOrderBySequenceAsc(accountId, afterSequence)
            : repository.findByAccountIdAndSequenceGreaterThanAndOccurredAtLessThanEqualOrderBySequenceAsc(
                accountId, afterSequence, upTo);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<LedgerEvent> tail(String accountId) {
        return repository.findFirstByAccountIdOrderBySequenceDesc(accountId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<LedgerEvent> history(String accountId, Instant from, Instant to) {
        return replay(accountId, to).stream()
            .filter(event -> from == null || !event.getOccurredAt().isBefore(from))
            .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<LedgerEvent> findByIdempotencyKey(String idempotencyKey) {
        return repository.findByIdempotencyKey(idempotencyKey);
    }

    @Override
    @Transactional(readOnly = true)
    public List<LedgerEvent> findByCausationId(String causationId) {
        return repository.findByCausationIdOrderByIdAsc(causationId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> accountIds() {
        return repository.findDistinctAccountIds();
    }

    @Override
    public List<LedgerEvent> frozenPrefix() {
        Long highWaterMark;
        Lock exclusive = locks.acquireExclusive();
        try {
            highWaterMark = repository.findMaxId().orElse(0L);
        } finally {
            exclusive.unlock();
        }
        // Every id at or below the mark was committed before the exclusive lock was granted
        List<LedgerEvent> prefix = repository.findByIdLessThanEqualOrderByIdAsc(highWaterMark);
        log.info("Froze event log prefix at id {} ({} events)", highWaterMark, prefix.size());
        return prefix;
    }

    @Override
    public void importEvents(List<LedgerEvent> events, Runnable verification) {
        Lock exclusive = locks.acquireExclusive();
        try {
            appendTransaction.executeWithoutResult(status -> {
                if (repository.count() > 0) {
                    throw new ValidationException("Event log is not empty; restore requires an empty log");
                }
                Map<String, LedgerEvent> tails = new HashMap<>();
                for (LedgerEvent event : events) {
                    LedgerEvent previous = tails.get(event.getAccountId());
                    boolean chained = previous == null
                        ? event.getSequence() == 1 && event.getBalanceBefore().signum() == 0
                        : event.follows(previous);
                    if (!chained || event.getBalanceBefore().add(event.getAmount()).compareTo(event.getBalanceAfter()) != 0) {
                        throw new LedgerIntegrityException(String.format(
                            "Imported event #%d on %s breaks the balance chain", event.getSequence(), event.getAccountId()));
                    }
                    LedgerEvent copy = new LedgerEvent(event.getAccountId(), event.getSequence(), event.getKind(),
                        event.getAmount(), event.getBalanceBefore(), event.getOccurredAt(), event.getRecordedAt(),
                        event.getCausationId(), event.getIdempotencyKey());
                    repository.save(copy);
                    tails.put(event.getAccountId(), event);
                }
                repository.flush();
                verification.run();
            });
            log.info("Imported {} events into the event log", events.size());
        } catch (DataAccessException | TransactionException e) {
            throw new LedgerPersistenceException("Event log storage unavailable during import", e);
        } finally {
            exclusive.unlock();
        }
    }
}
